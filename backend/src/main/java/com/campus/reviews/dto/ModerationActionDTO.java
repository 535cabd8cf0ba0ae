package com.campus.reviews.dto;

import com.campus.reviews.entity.ReviewStatus;
import com.campus.reviews.moderation.ReviewTransition;

import java.time.Instant;
import java.util.UUID;

public record ModerationActionDTO(
        Long id,
        UUID reviewId,
        String actorId,
        ReviewTransition action,
        ReviewStatus fromStatus,
        ReviewStatus toStatus,
        String reasonText,
        Instant createdAt
) {}
