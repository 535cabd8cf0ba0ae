package com.campus.reviews.exception;

public class ElevationRequiredException extends ReviewPipelineException {

    public ElevationRequiredException(String message) {
        super(message);
    }
}
