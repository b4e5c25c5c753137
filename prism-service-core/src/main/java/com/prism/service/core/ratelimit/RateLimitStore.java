package com.prism.service.core.ratelimit;

/** Counts requests per key. The in-memory implementation is per process; a shared store can replace it. */
public interface RateLimitStore {

    RateLimitDecision acquire(String key);
}
