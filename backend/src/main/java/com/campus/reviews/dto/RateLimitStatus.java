package com.campus.reviews.dto;

import com.campus.reviews.ratelimit.ActionKind;

import java.time.Duration;
import java.time.Instant;

public record RateLimitStatus(
        ActionKind actionKind,
        int currentCount,
        int limit,
        int remaining,
        Duration window,
        Instant resetsAt
) {}
