package com.nft.marketplace.nft_marketplace.ratelimit;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API rate limiting, 10 requests/second per caller unless
 * {@code marketplace.rate-limit.requests-per-second} says otherwise.
 */
@Configuration
public class RateLimitConfig {

    @Value("${marketplace.rate-limit.requests-per-second:10}")
    private int requestsPerSecond;

    @Bean
    public ApiRateLimiter apiRateLimiter() {
        return new Resilience4jApiRateLimiter(requestsPerSecond);
    }

    @Bean
    public RateLimitFilter rateLimitFilter(ApiRateLimiter apiRateLimiter) {
        return new RateLimitFilter(apiRateLimiter);
    }

    /**
     * The filter runs inside the security chain, after the caller is known.
     */
    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration(RateLimitFilter filter) {
        FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }
}
