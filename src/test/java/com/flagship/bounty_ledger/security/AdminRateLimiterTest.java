package com.flagship.bounty_ledger.security;

import com.flagship.bounty_ledger.config.BountyProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdminRateLimiterTest {

    @Mock
    private StringRedisTemplate redis;

    @Mock
    private ValueOperations<String, String> ops;

    private BountyProperties properties;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        properties = new BountyProperties();
        properties.getAdmin().getRateLimit().setMaxRequests(3);
        properties.getAdmin().getRateLimit().setWindow(Duration.ofMinutes(1));
        clock = new MutableClock(Instant.parse("2025-01-01T10:00:00Z"));
    }

    @Test
    @DisplayName("Requests over the ceiling within one window are refused")
    void tryAcquire_OverCeiling_Refused() {
        AdminRateLimiter limiter = new AdminRateLimiter(properties, Optional.empty(), clock);

        assertTrue(limiter.tryAcquire("10.0.0.1"));
        assertTrue(limiter.tryAcquire("10.0.0.1"));
        assertTrue(limiter.tryAcquire("10.0.0.1"));
        assertFalse(limiter.tryAcquire("10.0.0.1"));
        assertTrue(limiter.tryAcquire("10.0.0.2"), "other clients have their own window");
    }

    @Test
    @DisplayName("A new window starts a fresh count")
    void tryAcquire_NextWindow_Reset() {
        AdminRateLimiter limiter = new AdminRateLimiter(properties, Optional.empty(), clock);
        for (int i = 0; i < 3; i++) {
            limiter.tryAcquire("10.0.0.1");
        }
        assertFalse(limiter.tryAcquire("10.0.0.1"));

        clock.advance(Duration.ofSeconds(45));
        assertEquals(15, limiter.retryAfterSeconds());

        clock.advance(Duration.ofSeconds(15));
        assertTrue(limiter.tryAcquire("10.0.0.1"));
    }

    @Test
    @DisplayName("Windows from earlier periods are dropped once the window rolls")
    void tryAcquire_WindowRolls_StaleClientsEvicted() {
        AdminRateLimiter limiter = new AdminRateLimiter(properties, Optional.empty(), clock);
        for (int i = 0; i < 500; i++) {
            limiter.tryAcquire("10.0." + (i / 256) + "." + (i % 256));
        }
        assertEquals(500, limiter.trackedClients());

        clock.advance(Duration.ofDays(1));
        assertTrue(limiter.tryAcquire("10.9.9.9"));

        assertEquals(1, limiter.trackedClients());
    }

    @Test
    @DisplayName("A client seen again in a later window starts from zero after eviction")
    void tryAcquire_AfterEviction_FreshCount() {
        AdminRateLimiter limiter = new AdminRateLimiter(properties, Optional.empty(), clock);
        for (int i = 0; i < 4; i++) {
            limiter.tryAcquire("10.0.0.1");
        }
        limiter.tryAcquire("10.0.0.2");

        clock.advance(Duration.ofMinutes(2));
        assertTrue(limiter.tryAcquire("10.0.0.1"));
        assertTrue(limiter.tryAcquire("10.0.0.1"));
        assertTrue(limiter.tryAcquire("10.0.0.1"));
        assertFalse(limiter.tryAcquire("10.0.0.1"));
        assertEquals(1, limiter.trackedClients());
    }

    @Test
    @DisplayName("Redis counter is used when enabled and expires with the window")
    void tryAcquire_RedisEnabled_CountsInRedis() {
        properties.getAdmin().getRateLimit().setRedisEnabled(true);
        when(redis.opsForValue()).thenReturn(ops);
        when(ops.increment(anyString())).thenReturn(1L, 4L);
        AdminRateLimiter limiter = new AdminRateLimiter(properties, Optional.of(redis), clock);

        assertTrue(limiter.tryAcquire("10.0.0.1"));
        assertFalse(limiter.tryAcquire("10.0.0.1"));

        long windowIndex = clock.millis() / Duration.ofMinutes(1).toMillis();
        verify(redis).expire(eq("admin-rate:10.0.0.1:" + windowIndex), eq(Duration.ofSeconds(61)));
    }

    @Test
    @DisplayName("Redis failure falls back to the local counter")
    void tryAcquire_RedisDown_CountsLocally() {
        properties.getAdmin().getRateLimit().setRedisEnabled(true);
        when(redis.opsForValue()).thenReturn(ops);
        when(ops.increment(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));
        AdminRateLimiter limiter = new AdminRateLimiter(properties, Optional.of(redis), clock);

        assertTrue(limiter.tryAcquire("10.0.0.1"));
        assertTrue(limiter.tryAcquire("10.0.0.1"));
        assertTrue(limiter.tryAcquire("10.0.0.1"));
        assertFalse(limiter.tryAcquire("10.0.0.1"));
    }

    @Test
    @DisplayName("Redis template is ignored unless enabled")
    void tryAcquire_RedisDisabled_IgnoresTemplate() {
        AdminRateLimiter limiter = new AdminRateLimiter(properties, Optional.of(redis), clock);

        assertTrue(limiter.tryAcquire("10.0.0.1"));
        verifyNoInteractions(redis);
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
