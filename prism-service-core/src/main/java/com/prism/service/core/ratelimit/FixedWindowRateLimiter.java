package com.prism.service.core.ratelimit;

import com.prism.service.core.config.IngestProperties;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Fixed one-minute windows per key. A window opens on the first request after the previous one expired, so
 * limits reset per key rather than on wall-clock minute boundaries.
 */
@Component
public class FixedWindowRateLimiter implements RateLimitStore {

    static final Duration WINDOW = Duration.ofSeconds(60);

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final IngestProperties properties;
    private final Clock clock;

    public FixedWindowRateLimiter(IngestProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public RateLimitDecision acquire(String key) {
        int limit = properties.getRateLimitPerMinute();
        long now = clock.millis();
        Window window = windows.compute(key, (k, current) -> {
            if (current == null || now - current.start() >= WINDOW.toMillis()) {
                return new Window(now, 1, true);
            }
            if (current.count() >= limit) {
                return new Window(current.start(), current.count(), false);
            }
            return new Window(current.start(), current.count() + 1, true);
        });
        return window.allowed()
                ? new RateLimitDecision(true, limit - window.count())
                : new RateLimitDecision(false, 0);
    }

    void reset() {
        windows.clear();
    }

    /** {@code allowed} records the outcome of the request that produced this state. */
    private record Window(long start, int count, boolean allowed) {}
}
