package com.campus.reviews.exception;

import java.util.Map;

public class ValidationException extends ReviewPipelineException {

    private final Map<String, String> details;

    public ValidationException(String message) {
        this(message, Map.of());
    }

    public ValidationException(String message, Map<String, String> details) {
        super(message);
        this.details = Map.copyOf(details);
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
