package com.memoryvault.application;

import com.memoryvault.config.AuthProperties;
import com.memoryvault.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class VerificationRateLimiterTest {

    private MutableClock clock;
    private VerificationRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-14T10:00:00Z"));
        limiter = new VerificationRateLimiter(new AuthProperties(), clock);
    }

    @Test
    void allowsThreeAttemptsPerWindow() {
        assertTrue(limiter.tryAcquire("alice"));
        assertTrue(limiter.tryAcquire("alice"));
        assertTrue(limiter.tryAcquire("alice"));
        assertFalse(limiter.tryAcquire("alice"));
    }

    @Test
    void principalsAreLimitedIndependently() {
        for (int i = 0; i < 3; i++) {
            limiter.tryAcquire("alice");
        }

        assertFalse(limiter.tryAcquire("alice"));
        assertTrue(limiter.tryAcquire("bob"));
    }

    @Test
    void windowSlides() {
        limiter.tryAcquire("alice");
        clock.advance(Duration.ofSeconds(30));
        limiter.tryAcquire("alice");
        limiter.tryAcquire("alice");
        assertFalse(limiter.tryAcquire("alice"));

        clock.advance(Duration.ofSeconds(30));
        assertTrue(limiter.tryAcquire("alice"));
        assertFalse(limiter.tryAcquire("alice"));
    }

    @Test
    void resetClearsHistory() {
        for (int i = 0; i < 3; i++) {
            limiter.tryAcquire("alice");
        }
        limiter.reset("alice");

        assertTrue(limiter.tryAcquire("alice"));
    }
}
