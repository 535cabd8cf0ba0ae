package com.campus.reviews.dto;

import com.campus.reviews.entity.ReviewStatus;
import com.campus.reviews.moderation.ReviewTransition;

import java.time.Instant;
import java.util.UUID;

public record RejectedAttemptDTO(
        Long id,
        UUID reviewId,
        String actorId,
        ReviewTransition action,
        ReviewStatus currentStatus,
        String message,
        Instant createdAt
) {}
