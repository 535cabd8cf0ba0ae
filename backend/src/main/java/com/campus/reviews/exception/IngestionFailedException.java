package com.campus.reviews.exception;

// The message is safe to show; the cause is for logs only.
public class IngestionFailedException extends ReviewPipelineException {

    public IngestionFailedException(Throwable cause) {
        super("Review could not be saved, please try again", cause);
    }
}
