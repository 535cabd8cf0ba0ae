package com.campus.reviews.exception;

import com.campus.reviews.entity.ReviewStatus;
import com.campus.reviews.moderation.ReviewTransition;

import java.util.UUID;

public class InvalidTransitionException extends ReviewPipelineException {

    private final UUID reviewId;
    private final ReviewStatus currentStatus;
    private final ReviewTransition attemptedAction;

    public InvalidTransitionException(UUID reviewId, ReviewStatus currentStatus, ReviewTransition attemptedAction) {
        super("Cannot " + attemptedAction + " a review in status " + currentStatus);
        this.reviewId = reviewId;
        this.currentStatus = currentStatus;
        this.attemptedAction = attemptedAction;
    }

    public UUID getReviewId() {
        return reviewId;
    }

    public ReviewStatus getCurrentStatus() {
        return currentStatus;
    }

    public ReviewTransition getAttemptedAction() {
        return attemptedAction;
    }
}
