package com.campus.reviews.entity;

import java.util.EnumSet;
import java.util.Set;

public enum ReviewStatus {
    PENDING,
    PUBLISHED,
    FLAGGED,
    UNDER_REVIEW,
    APPROVED,
    REMOVED,
    APPEALED,
    REINSTATED;

    /** Statuses that sit in the moderation queue. */
    public static final Set<ReviewStatus> QUEUE = EnumSet.of(FLAGGED, UNDER_REVIEW);

    /** Content may still be replaced by its author. */
    public boolean isEditable() {
        return this == PENDING || this == PUBLISHED;
    }

    /** Moderation outcome that puts the review (back) on public pages. */
    public boolean isPublishing() {
        return this == PUBLISHED || this == APPROVED || this == REINSTATED;
    }
}
