package com.storefront.anomaly.engine.forecast;

import com.storefront.anomaly.config.AnalysisConfig;
import com.storefront.anomaly.model.Expectation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Additive decomposition forecaster: linear trend + daily cycle + weekly cycle + residual noise.
 *
 * Fitting runs one backfitting pass so the trend is not biased by the daily cycle:
 *   1. provisional daily profile from the raw history
 *   2. least-squares trend on (history - provisional daily profile)
 *   3. daily profile on the detrended history
 *   4. weekly profile on what the daily profile leaves over
 *
 * The interval half-width is the configured percentile of |residual|, inflated for the
 * degrees of freedom spent on the fit, and never narrower than a Poisson-style count floor
 * (z * sqrt(expected)), so quiet series are not flagged on noise.
 *
 * Cycles are indexed by epoch hour, so all timestamps are effectively UTC.
 */
@Component
public class SeasonalBaselineForecaster implements BaselineForecaster {

    static final int HOURS_PER_DAY = 24;
    static final int HOURS_PER_WEEK = 168;

    // 1970-01-01T00:00Z was a Thursday; shift so slot 0 is Monday 00:00.
    private static final long EPOCH_WEEK_OFFSET = 72;

    private final AnalysisConfig config;

    public SeasonalBaselineForecaster(AnalysisConfig config) {
        this.config = config;
    }

    @Override
    public Expectation forecast(SeriesKey key, HourlySeries series, int targetIndex) {
        AnalysisConfig.Forecast cfg = config.getForecast();
        Instant hour = series.hourAt(targetIndex);

        int from = Math.max(0, targetIndex - cfg.getMaxHistoryHours());
        double[] history = series.window(from, targetIndex);
        int n = history.length;

        if (n == 0 || n < cfg.getMinHistoryHours()) {
            return Expectation.insufficient(key.metric(), key.dimension(), key.value(), hour, n);
        }

        long firstEpochHour = epochHour(series.hourAt(from));
        boolean fitDaily = n >= Math.max(cfg.getDailyMinHistoryHours(), HOURS_PER_DAY);
        boolean fitWeekly = n >= Math.max(cfg.getWeeklyMinHistoryHours(), HOURS_PER_WEEK);

        double[] provisionalDaily = fitDaily
                ? cycleProfile(history, firstEpochHour, HOURS_PER_DAY, 0)
                : new double[HOURS_PER_DAY];

        double[] deseasonalized = new double[n];
        for (int i = 0; i < n; i++) {
            deseasonalized[i] = history[i] - provisionalDaily[slot(firstEpochHour + i, HOURS_PER_DAY, 0)];
        }
        double[] trend = fitTrend(deseasonalized, cfg.isTrendEnabled());
        double intercept = trend[0];
        double slope = trend[1];

        double[] detrended = new double[n];
        for (int i = 0; i < n; i++) {
            detrended[i] = history[i] - (intercept + slope * i);
        }
        double[] daily = fitDaily
                ? cycleProfile(detrended, firstEpochHour, HOURS_PER_DAY, 0)
                : new double[HOURS_PER_DAY];

        double[] remainder = new double[n];
        for (int i = 0; i < n; i++) {
            remainder[i] = detrended[i] - daily[slot(firstEpochHour + i, HOURS_PER_DAY, 0)];
        }
        double[] weekly = fitWeekly
                ? cycleProfile(remainder, firstEpochHour, HOURS_PER_WEEK, EPOCH_WEEK_OFFSET)
                : new double[HOURS_PER_WEEK];

        double[] absResiduals = new double[n];
        for (int i = 0; i < n; i++) {
            double residual = remainder[i] - weekly[slot(firstEpochHour + i, HOURS_PER_WEEK, EPOCH_WEEK_OFFSET)];
            absResiduals[i] = Math.abs(residual);
        }

        long targetEpochHour = firstEpochHour + n;
        double projected = intercept + slope * n
                + daily[slot(targetEpochHour, HOURS_PER_DAY, 0)]
                + weekly[slot(targetEpochHour, HOURS_PER_WEEK, EPOCH_WEEK_OFFSET)];
        double expected = Math.max(0.0, projected);

        int params = (cfg.isTrendEnabled() ? 2 : 1)
                + (fitDaily ? HOURS_PER_DAY - 1 : 0)
                + (fitWeekly ? HOURS_PER_WEEK - 1 : 0);
        double dofCorrection = Math.sqrt(n / Math.max(1.0, n - params));

        double residualWidth = new Percentile().evaluate(absResiduals, cfg.getConfidenceLevel() * 100.0)
                * dofCorrection * cfg.getIntervalScale();
        double countFloor = Math.max(cfg.getMinIntervalHalfWidth(),
                cfg.getCountNoiseZ() * Math.sqrt(Math.max(expected, 1.0)));
        double halfWidth = Math.max(residualWidth, countFloor);

        return Expectation.builder()
                .metric(key.metric())
                .dimension(key.dimension())
                .value(key.value())
                .hour(hour)
                .expected(expected)
                .lower(Math.max(0.0, expected - halfWidth))
                .upper(expected + halfWidth)
                .historyHours(n)
                .insufficientHistory(false)
                .build();
    }

    /**
     * Returns {intercept, slope}. With the trend disabled the level is the plain mean.
     */
    private double[] fitTrend(double[] values, boolean trendEnabled) {
        if (!trendEnabled || values.length < 2) {
            double sum = 0.0;
            for (double v : values) sum += v;
            return new double[]{sum / values.length, 0.0};
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < values.length; i++) {
            regression.addData(i, values[i]);
        }
        return new double[]{regression.getIntercept(), regression.getSlope()};
    }

    /**
     * Mean value per cycle slot, centred so the profile averages to zero over the slots that were seen.
     */
    static double[] cycleProfile(double[] values, long firstEpochHour, int period, long offset) {
        double[] sums = new double[period];
        int[] counts = new int[period];
        for (int i = 0; i < values.length; i++) {
            int s = slot(firstEpochHour + i, period, offset);
            sums[s] += values[i];
            counts[s]++;
        }

        double[] profile = new double[period];
        double total = 0.0;
        int seen = 0;
        for (int s = 0; s < period; s++) {
            if (counts[s] > 0) {
                profile[s] = sums[s] / counts[s];
                total += profile[s];
                seen++;
            }
        }
        if (seen == 0) return profile;

        double centre = total / seen;
        for (int s = 0; s < period; s++) {
            if (counts[s] > 0) profile[s] -= centre;
        }
        return profile;
    }

    static int slot(long epochHour, int period, long offset) {
        return (int) Math.floorMod(epochHour + offset, (long) period);
    }

    static long epochHour(Instant hour) {
        return Math.floorDiv(hour.getEpochSecond(), 3600L);
    }
}
