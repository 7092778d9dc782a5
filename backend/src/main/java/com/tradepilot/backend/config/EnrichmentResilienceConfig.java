package com.tradepilot.backend.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class EnrichmentResilienceConfig {

    @Bean
    public TimeLimiter enrichmentTimeLimiter(StrategyProperties strategyProperties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(strategyProperties.getMerge().getEnrichment().getTimeout())
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of("enrichment", config);
    }

    @Bean(name = "enrichmentTimeoutScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService enrichmentTimeoutScheduler() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "enrichment-timeout");
            thread.setDaemon(true);
            return thread;
        });
    }
}
