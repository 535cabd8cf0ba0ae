package com.campus.reviews.exception;

import java.util.UUID;

public class ReviewNotFoundException extends ReviewPipelineException {

    public ReviewNotFoundException(UUID reviewId) {
        super("Review not found: " + reviewId);
    }
}
