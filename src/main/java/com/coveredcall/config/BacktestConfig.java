package com.coveredcall.config;

import com.coveredcall.backtest.engine.BacktestEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionException;

/**
 * Configuration for backtest execution.
 *
 * Comparison sweeps fan out one run per configuration onto a dedicated pool so
 * request threads are not tied up by CPU-bound simulations.
 */
@Configuration
@Slf4j
public class BacktestConfig {

    @Bean
    public BacktestEngine backtestEngine() {
        return new BacktestEngine();
    }

    /**
     * Executor for comparison sweeps. Core and max pool size come from
     * {@code covered-call.backtest.compare-pool-size}.
     */
    @Bean(name = "backtestExecutor")
    public ThreadPoolTaskExecutor backtestExecutor(CoveredCallProperties properties) {
        int poolSize = Math.max(1, properties.getBacktest().getComparePoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("Backtest-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Backtest task rejected, queue full. Consider comparing fewer configurations.");
            throw new RejectedExecutionException(
                    "Backtest queue full. Please wait for current comparisons to complete.");
        });
        executor.initialize();
        log.info("Backtest executor initialized: pool={}, queue=100", poolSize);
        return executor;
    }
}
