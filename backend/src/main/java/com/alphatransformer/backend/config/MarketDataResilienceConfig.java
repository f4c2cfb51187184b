package com.alphatransformer.backend.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;

@Configuration
public class MarketDataResilienceConfig {

    @Bean
    public Retry marketRestRetry(MarketDataProperties properties) {
        MarketDataProperties.Rest rest = properties.getRest();
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialBackoff(
                Duration.ofMillis(rest.getRetryBaseDelayMs()),
                2.0
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, rest.getRetryMaxAttempts()))
                .intervalFunction(intervalFunction)
                .retryExceptions(ResourceAccessException.class, HttpServerErrorException.class)
                .build();
        return Retry.of("market-rest", config);
    }
}
