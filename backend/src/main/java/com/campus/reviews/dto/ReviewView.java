package com.campus.reviews.dto;

import com.campus.reviews.entity.DisplayMode;
import com.campus.reviews.entity.ReviewStatus;
import com.campus.reviews.entity.TargetKind;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * The only shape in which a review leaves the service to non-privileged
 * callers. Has no author field whatever the display mode.
 */
public record ReviewView(
        UUID id,
        TargetKind targetKind,
        UUID targetId,
        String bodyText,
        Map<String, Integer> ratings,
        DisplayMode displayMode,
        ReviewStatus status,
        int flagCount,
        long helpfulCount,
        long notHelpfulCount,
        Instant createdAt,
        Instant updatedAt
) {}
