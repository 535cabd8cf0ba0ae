package com.campus.reviews.dto;

import com.campus.reviews.entity.FlagReason;

import java.time.Instant;
import java.util.UUID;

// created=false means the caller had already flagged this review
public record FlagResponse(
        UUID flagId,
        UUID reviewId,
        FlagReason reason,
        boolean created,
        Instant createdAt
) {}
