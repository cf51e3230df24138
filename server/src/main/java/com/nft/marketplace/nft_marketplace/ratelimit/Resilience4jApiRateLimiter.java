package com.nft.marketplace.nft_marketplace.ratelimit;

import java.time.Duration;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;

/**
 * One resilience4j {@link RateLimiter} per identifier, refreshed every second.
 */
public class Resilience4jApiRateLimiter implements ApiRateLimiter {

    private static final Duration REFRESH_PERIOD = Duration.ofSeconds(1);

    private final RateLimiterRegistry registry;

    public Resilience4jApiRateLimiter(int requestsPerSecond) {
        if (requestsPerSecond <= 0) {
            throw new IllegalArgumentException("Requests per second must be positive");
        }
        this.registry = RateLimiterRegistry.of(RateLimiterConfig.custom()
                .limitRefreshPeriod(REFRESH_PERIOD)
                .limitForPeriod(requestsPerSecond)
                .timeoutDuration(Duration.ZERO) // never block a servlet thread
                .build());
    }

    @Override
    public boolean tryAcquire(String identifier) {
        return registry.rateLimiter(identifier).acquirePermission();
    }

    @Override
    public long getRetryAfterSeconds(String identifier) {
        RateLimiter limiter = registry.rateLimiter(identifier);
        if (limiter.getMetrics().getAvailablePermissions() > 0) {
            return 0;
        }
        return REFRESH_PERIOD.toSeconds();
    }

    @Override
    public void reset(String identifier) {
        registry.remove(identifier);
    }
}
