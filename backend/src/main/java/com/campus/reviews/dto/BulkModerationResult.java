package com.campus.reviews.dto;

import com.campus.reviews.entity.ReviewStatus;

import java.util.UUID;

/** Per-review line of a bulk action. Exactly one of {@code action} and {@code error} is set. */
public record BulkModerationResult(
        UUID reviewId,
        ModerationActionDTO action,
        String error,
        ReviewStatus currentStatus
) {

    public boolean applied() {
        return action != null;
    }
}
