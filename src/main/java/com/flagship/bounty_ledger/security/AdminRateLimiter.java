package com.flagship.bounty_ledger.security;

import com.flagship.bounty_ledger.config.BountyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-window request counter per client address for admin endpoints.
 *
 * Counts in Redis when enabled so every instance shares the window; falls back to an in-process
 * counter when Redis is disabled or failing.
 */
@Component
@Slf4j
public class AdminRateLimiter {

    private static final String REDIS_KEY_PREFIX = "admin-rate:";

    private final BountyProperties.RateLimit config;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final Clock clock;
    private final Map<String, Window> localWindows = new ConcurrentHashMap<>();
    private final AtomicLong currentWindowIndex = new AtomicLong(-1);

    @Autowired
    public AdminRateLimiter(BountyProperties properties, Optional<StringRedisTemplate> redisTemplate) {
        this(properties, redisTemplate, Clock.systemUTC());
    }

    AdminRateLimiter(BountyProperties properties, Optional<StringRedisTemplate> redisTemplate, Clock clock) {
        this.config = properties.getAdmin().getRateLimit();
        this.redisTemplate = config.isRedisEnabled() ? redisTemplate : Optional.empty();
        this.clock = clock;
    }

    /**
     * Counts one request and reports whether it is still within the ceiling.
     */
    public boolean tryAcquire(String clientKey) {
        long windowMillis = config.getWindow().toMillis();
        long windowIndex = clock.millis() / windowMillis;

        if (redisTemplate.isPresent()) {
            try {
                String redisKey = REDIS_KEY_PREFIX + clientKey + ":" + windowIndex;
                Long count = redisTemplate.get().opsForValue().increment(redisKey);
                if (count != null && count == 1L) {
                    redisTemplate.get().expire(redisKey, config.getWindow().plus(Duration.ofSeconds(1)));
                }
                return count != null && count <= config.getMaxRequests();
            } catch (RuntimeException e) {
                log.warn("Redis rate limit counter failed, counting locally. Error: {}", e.getMessage());
            }
        }

        evictExpiredWindows(windowIndex);
        Window window = localWindows.compute(clientKey, (key, current) ->
                current == null || current.index != windowIndex ? new Window(windowIndex) : current);
        return window.count.incrementAndGet() <= config.getMaxRequests();
    }

    /**
     * Drops every client's window from earlier periods, once per window roll.
     */
    private void evictExpiredWindows(long windowIndex) {
        long previous = currentWindowIndex.get();
        if (previous < windowIndex && currentWindowIndex.compareAndSet(previous, windowIndex)) {
            localWindows.values().removeIf(window -> window.index < windowIndex);
        }
    }

    int trackedClients() {
        return localWindows.size();
    }

    public long retryAfterSeconds() {
        long windowMillis = config.getWindow().toMillis();
        long remaining = windowMillis - (clock.millis() % windowMillis);
        return Math.max(1, (remaining + 999) / 1000);
    }

    private static final class Window {
        private final long index;
        private final AtomicInteger count = new AtomicInteger();

        private Window(long index) {
            this.index = index;
        }
    }
}
