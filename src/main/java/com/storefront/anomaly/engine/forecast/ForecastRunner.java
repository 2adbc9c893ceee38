package com.storefront.anomaly.engine.forecast;

import com.storefront.anomaly.engine.AnalysisException;
import com.storefront.anomaly.model.Expectation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Fits every series of a run on the forecast executor. Series are independent and read-only,
 * so each task owns its series and returns its own expectation list; nothing is shared.
 * The table is only assembled after all tasks have finished.
 */
@Component
public class ForecastRunner {

    private static final Logger log = LoggerFactory.getLogger(ForecastRunner.class);

    private final BaselineForecaster forecaster;
    private final ExecutorService executor;

    public ForecastRunner(BaselineForecaster forecaster,
                          @Qualifier("forecastExecutor") ExecutorService executor) {
        this.forecaster = forecaster;
        this.executor = executor;
    }

    /**
     * @param start  first hour shared by every series
     * @param series series to fit, iteration order is preserved in the table
     */
    public ExpectationTable run(Instant start, Map<SeriesKey, HourlySeries> series) {
        List<SeriesKey> keys = new ArrayList<>(series.keySet());
        List<Callable<List<Expectation>>> tasks = new ArrayList<>(keys.size());
        for (SeriesKey key : keys) {
            HourlySeries s = series.get(key);
            tasks.add(() -> fitSeries(key, s));
        }

        List<Future<List<Expectation>>> futures;
        try {
            futures = executor.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisException("Forecasting interrupted before all series were fitted", e);
        }

        Map<SeriesKey, List<Expectation>> bySeries = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            SeriesKey key = keys.get(i);
            try {
                bySeries.put(key, futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AnalysisException("Forecasting interrupted while collecting " + key, e);
            } catch (ExecutionException e) {
                log.error("Forecast failed for series {}: {}", key, e.getCause().getMessage(), e.getCause());
                throw new AnalysisException("Forecast failed for series " + key, e.getCause());
            }
        }

        log.debug("Fitted {} series from {}", bySeries.size(), start);
        return new ExpectationTable(start, bySeries);
    }

    private List<Expectation> fitSeries(SeriesKey key, HourlySeries series) {
        List<Expectation> expectations = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            expectations.add(forecaster.forecast(key, series, i));
        }
        return List.copyOf(expectations);
    }
}
