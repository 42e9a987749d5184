package com.dining.reservation_service.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;

/**
 * One Resilience4j rate limiter per client address, held in a bounded cache.
 * A client idle for a whole refresh period is evicted; its next request starts a fresh window,
 * which is what the old limiter would have granted anyway.
 */
public class ClientRateLimiters {

    private final RateLimiterConfig config;
    private final Cache<String, RateLimiter> limiters;

    public ClientRateLimiters(RateLimiterConfig config, long maximumClients) {
        this(config, maximumClients, Ticker.systemTicker());
    }

    ClientRateLimiters(RateLimiterConfig config, long maximumClients, Ticker ticker) {
        this.config = config;
        this.limiters = Caffeine.newBuilder()
                .expireAfterAccess(config.getLimitRefreshPeriod())
                .maximumSize(maximumClients)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    public RateLimiter forClient(String client) {
        return limiters.get(client, key -> RateLimiter.of("client-" + key, config));
    }

    long trackedClients() {
        limiters.cleanUp();
        return limiters.estimatedSize();
    }
}
