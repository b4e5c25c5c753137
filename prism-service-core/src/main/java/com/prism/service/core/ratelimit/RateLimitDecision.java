package com.prism.service.core.ratelimit;

public record RateLimitDecision(boolean allowed, int remaining) {}
