package com.dealengine.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.TransientDataAccessException;

import java.time.Clock;
import java.time.Duration;

/**
 * Shared infrastructure beans.
 */
@Configuration
public class DealEngineConfig {

    public static final String ACTIVATION_STORE_RETRY = "activationStore";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Retry for transient activation store failures (lock timeouts, optimistic
     * conflicts, query timeouts). Callers retry with the identical key.
     */
    @Bean
    public Retry activationStoreRetry(
            @Value("${deal-engine.activation.retry.max-attempts:3}") int maxAttempts,
            @Value("${deal-engine.activation.retry.wait:PT0.1S}") Duration wait) {
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .waitDuration(wait)
            .retryExceptions(TransientDataAccessException.class)
            .build();
        return Retry.of(ACTIVATION_STORE_RETRY, config);
    }
}
