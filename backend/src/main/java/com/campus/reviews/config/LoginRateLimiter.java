package com.campus.reviews.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

// Per-IP guard on the login endpoint; users are unknown before authentication.
@Component
public class LoginRateLimiter {

    private record Bucket(int count, long resetAt) {}

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final int limit;
    private final long windowMs;

    public LoginRateLimiter(@Value("${app.security.login-attempts-per-minute:5}") int limit) {
        this.limit = limit;
        this.windowMs = 60_000;
    }

    public boolean allow(String key) {
        long now = Instant.now().toEpochMilli();
        boolean[] allowed = new boolean[1];
        buckets.compute(key, (k, b) -> {
            if (b == null || now > b.resetAt()) {
                b = new Bucket(0, now + windowMs);
            }
            if (b.count() >= limit) {
                return b;
            }
            allowed[0] = true;
            return new Bucket(b.count() + 1, b.resetAt());
        });
        if (buckets.size() > 10_000) {
            buckets.values().removeIf(b -> now > b.resetAt());
        }
        return allowed[0];
    }
}
