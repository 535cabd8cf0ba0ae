package com.campus.reviews.exception;

import com.campus.reviews.ratelimit.ActionKind;

import java.time.Duration;

public class RateLimitedException extends ReviewPipelineException {

    private final ActionKind actionKind;
    private final Duration retryAfter;

    public RateLimitedException(ActionKind actionKind, Duration retryAfter) {
        super("Rate limit exceeded for " + actionKind);
        this.actionKind = actionKind;
        this.retryAfter = retryAfter;
    }

    public ActionKind getActionKind() {
        return actionKind;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
