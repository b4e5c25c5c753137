package com.prism.service.core.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.prism.service.core.config.IngestProperties;
import java.time.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FixedWindowRateLimiterTest {

    private final Clock clock = mock(Clock.class);
    private FixedWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        IngestProperties properties = new IngestProperties();
        properties.setRateLimitPerMinute(2);
        limiter = new FixedWindowRateLimiter(properties, clock);
        when(clock.millis()).thenReturn(1_000L);
    }

    @Test
    void allowsUpToTheLimitWithinAWindow() {
        assertEquals(new RateLimitDecision(true, 1), limiter.acquire("k1"));
        assertEquals(new RateLimitDecision(true, 0), limiter.acquire("k1"));
        assertEquals(new RateLimitDecision(false, 0), limiter.acquire("k1"));
        assertFalse(limiter.acquire("k1").allowed());
    }

    @Test
    void keysHaveIndependentWindows() {
        limiter.acquire("k1");
        limiter.acquire("k1");

        assertTrue(limiter.acquire("k2").allowed());
        assertFalse(limiter.acquire("k1").allowed());
    }

    @Test
    void windowReopensAfterSixtySeconds() {
        limiter.acquire("k1");
        limiter.acquire("k1");

        when(clock.millis()).thenReturn(60_999L);
        assertFalse(limiter.acquire("k1").allowed());

        when(clock.millis()).thenReturn(61_000L);
        assertEquals(new RateLimitDecision(true, 1), limiter.acquire("k1"));
    }

    @Test
    void resetForgetsEveryWindow() {
        limiter.acquire("k1");
        limiter.acquire("k1");

        limiter.reset();

        assertTrue(limiter.acquire("k1").allowed());
    }
}
