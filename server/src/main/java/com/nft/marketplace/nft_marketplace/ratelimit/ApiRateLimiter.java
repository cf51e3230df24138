package com.nft.marketplace.nft_marketplace.ratelimit;

/**
 * Per-caller request throttling for the HTTP API.
 */
public interface ApiRateLimiter {

    /**
     * Attempts to acquire a permit for the given identifier without waiting.
     *
     * @param identifier The unique identifier for the client (account or IP)
     * @return true if the request is allowed, false if rate limit exceeded
     */
    boolean tryAcquire(String identifier);

    /**
     * Seconds the client should wait before retrying.
     */
    long getRetryAfterSeconds(String identifier);

    /**
     * Drops the limiter state of one identifier.
     */
    void reset(String identifier);
}
