package com.memoryvault.application;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.memoryvault.config.AuthProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window limit on voice verification attempts per principal.
 *
 * <p>Windows are evaluated against the injected {@link Clock}; Caffeine only
 * evicts idle principals.
 */
@Component
@Slf4j
public class VerificationRateLimiter {

    private final Clock clock;
    private final int maxAttempts;
    private final Duration window;
    private final Cache<String, Deque<Instant>> attempts;

    public VerificationRateLimiter(AuthProperties properties, Clock clock) {
        this.clock = clock;
        this.maxAttempts = properties.getRateLimitMaxAttempts();
        this.window = properties.getRateLimitWindow();
        this.attempts = Caffeine.newBuilder()
            .expireAfterAccess(window.multipliedBy(2))
            .maximumSize(100_000)
            .build();
    }

    /**
     * Counts one attempt for {@code principalId}.
     *
     * @return false if the principal already used up the current window
     */
    public boolean tryAcquire(String principalId) {
        Instant now = Instant.now(clock);
        Instant windowStart = now.minus(window);
        Deque<Instant> history = attempts.get(principalId, id -> new ArrayDeque<>());
        synchronized (history) {
            while (!history.isEmpty() && !history.peekFirst().isAfter(windowStart)) {
                history.pollFirst();
            }
            if (history.size() >= maxAttempts) {
                log.warn("Verification rate limit hit: principal={}, attempts={}, window={}",
                    principalId, history.size(), window);
                return false;
            }
            history.addLast(now);
            return true;
        }
    }

    public void reset(String principalId) {
        attempts.invalidate(principalId);
    }
}
