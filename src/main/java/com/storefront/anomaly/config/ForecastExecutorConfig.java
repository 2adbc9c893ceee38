package com.storefront.anomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ForecastExecutorConfig {

    @Bean(name = "forecastExecutor", destroyMethod = "shutdown")
    public ExecutorService forecastExecutor(AnalysisConfig config) {
        int threads = Math.max(1, config.getForecast().getParallelism());
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "forecast-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
