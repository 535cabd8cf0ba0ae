package com.campus.reviews.ratelimit;

import java.time.Duration;

public record RateDecision(boolean allowed, int limit, int remaining, Duration retryAfter) {

    public static RateDecision allowed(int limit, int remaining) {
        return new RateDecision(true, limit, remaining, Duration.ZERO);
    }

    public static RateDecision denied(int limit, Duration retryAfter) {
        return new RateDecision(false, limit, 0, retryAfter);
    }
}
