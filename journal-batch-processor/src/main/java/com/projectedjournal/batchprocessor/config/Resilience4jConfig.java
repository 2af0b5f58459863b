package com.projectedjournal.batchprocessor.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Resilience4j time-limiter configuration.
 *
 * <p>Cash-grid normalisation is CPU-bound and runs on its own small pool so that the
 * {@link TimeLimiter} can give up on a pathological grid and fail the job instead of hanging it.
 * The timeout comes from {@code journal.normalisation-timeout}; the remaining settings are read from
 * {@code application.yml} under {@code resilience4j.timelimiter.instances.cashGridNormaliser}.
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    public static final String CASH_GRID_NORMALISER = "cashGridNormaliser";

    @Value("${resilience4j.timelimiter.instances.cashGridNormaliser.cancel-running-future:true}")
    private boolean cancelRunningFuture;

    // ─── Beans ───────────────────────────────────────────────────────────────

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry() {
        return TimeLimiterRegistry.ofDefaults();
    }

    @Bean(CASH_GRID_NORMALISER)
    public TimeLimiter cashGridNormaliserTimeLimiter(TimeLimiterRegistry registry, JournalProperties properties) {
        TimeLimiterConfig cfg = TimeLimiterConfig.custom()
                .timeoutDuration(properties.getNormalisationTimeout())
                .cancelRunningFuture(cancelRunningFuture)
                .build();
        TimeLimiter limiter = registry.timeLimiter(CASH_GRID_NORMALISER, cfg);
        log.info("TimeLimiter '{}' created — timeout={}, cancelRunningFuture={}",
                CASH_GRID_NORMALISER, properties.getNormalisationTimeout(), cancelRunningFuture);
        return limiter;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService normalisationExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("cash-grid-"));
    }
}
