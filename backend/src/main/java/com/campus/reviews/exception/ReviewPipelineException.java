package com.campus.reviews.exception;

/**
 * Base of every failure the review pipeline reports to its callers.
 */
public abstract class ReviewPipelineException extends RuntimeException {

    protected ReviewPipelineException(String message) {
        super(message);
    }

    protected ReviewPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
