package com.campus.reviews.exception;

import com.campus.reviews.entity.ReviewStatus;

public class ReviewLockedException extends ReviewPipelineException {

    private final ReviewStatus currentStatus;

    public ReviewLockedException(ReviewStatus currentStatus) {
        super("Review is locked by moderation (" + currentStatus + ") and cannot be edited");
        this.currentStatus = currentStatus;
    }

    public ReviewStatus getCurrentStatus() {
        return currentStatus;
    }
}
