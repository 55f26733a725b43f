package com.library.circulation.config;

import com.library.circulation.error.exception.base.BaseException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.TransientDataAccessException;

@Slf4j
@Configuration
public class ResilienceConfig {

    /**
     * Retries lock timeouts and other transient storage failures with exponential backoff.
     * Business rejections are terminal and pass straight through.
     */
    @Bean
    public Retry circulationRetry(CirculationProperties properties) {
        CirculationProperties.Retry settings = properties.getRetry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.getInitialBackoffMillis(), settings.getMultiplier()))
                .retryExceptions(TransientDataAccessException.class)
                .ignoreExceptions(BaseException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        Retry retry = registry.retry("circulationRetry");
        retry.getEventPublisher().onRetry(event -> log.warn("Circulation retry #{} after {}ms: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                String.valueOf(event.getLastThrowable())));
        return retry;
    }
}
