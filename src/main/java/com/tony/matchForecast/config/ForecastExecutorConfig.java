package com.tony.matchForecast.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@RequiredArgsConstructor
public class ForecastExecutorConfig {

    private final ForecastProperties properties;

    /**
     * Pool du fan-out d'une prédiction (agrégations, contexte, stratégies).
     */
    @Bean(name = "forecastExecutor")
    public Executor forecastExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("forecast-");
        executor.initialize();
        return executor;
    }

    /**
     * Pool séparé pour les lots : un lot qui attend ses prédictions ne bloque pas le fan-out.
     */
    @Bean(name = "forecastBatchExecutor")
    public Executor forecastBatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getBatch().getThreads());
        executor.setMaxPoolSize(properties.getBatch().getThreads());
        executor.setQueueCapacity(properties.getBatch().getMaxSize());
        executor.setThreadNamePrefix("forecast-batch-");
        executor.initialize();
        return executor;
    }
}
