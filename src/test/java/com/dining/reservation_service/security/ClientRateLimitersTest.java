package com.dining.reservation_service.security;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ClientRateLimiters")
class ClientRateLimitersTest {

    private static final Duration WINDOW = Duration.ofMinutes(10);

    private final AtomicLong nanos = new AtomicLong();
    private ClientRateLimiters clientRateLimiters;

    @BeforeEach
    void setUp() {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(2)
                .limitRefreshPeriod(WINDOW)
                .timeoutDuration(Duration.ZERO)
                .build();
        clientRateLimiters = new ClientRateLimiters(config, 3, nanos::get);
    }

    @Test
    @DisplayName("Requests from one client share a limiter and are refused past the limit")
    void limitsPerClient() {
        RateLimiter first = clientRateLimiters.forClient("10.0.0.1");

        assertThat(first.acquirePermission()).isTrue();
        assertThat(clientRateLimiters.forClient("10.0.0.1").acquirePermission()).isTrue();
        assertThat(clientRateLimiters.forClient("10.0.0.1").acquirePermission()).isFalse();
        assertThat(clientRateLimiters.forClient("10.0.0.2").acquirePermission()).isTrue();
        assertThat(clientRateLimiters.forClient("10.0.0.1")).isSameAs(first);
    }

    @Test
    @DisplayName("Clients idle for a full window are evicted")
    void evictsIdleClients() {
        clientRateLimiters.forClient("10.0.0.1");
        clientRateLimiters.forClient("10.0.0.2");
        assertThat(clientRateLimiters.trackedClients()).isEqualTo(2);

        nanos.addAndGet(WINDOW.plusSeconds(1).toNanos());

        assertThat(clientRateLimiters.trackedClients()).isZero();
    }

    @Test
    @DisplayName("An active client stays tracked while an idle one is evicted")
    void keepsActiveClients() {
        clientRateLimiters.forClient("10.0.0.1");
        clientRateLimiters.forClient("10.0.0.2");

        nanos.addAndGet(WINDOW.dividedBy(2).toNanos());
        clientRateLimiters.forClient("10.0.0.1");
        nanos.addAndGet(WINDOW.dividedBy(2).plusSeconds(1).toNanos());

        assertThat(clientRateLimiters.trackedClients()).isEqualTo(1);
    }

    @Test
    @DisplayName("The number of tracked clients never exceeds the bound")
    void boundsTrackedClients() {
        for (int i = 0; i < 50; i++) {
            clientRateLimiters.forClient("10.0.1." + i);
        }

        assertThat(clientRateLimiters.trackedClients()).isLessThanOrEqualTo(3);
    }
}
