package com.campus.reviews.ratelimit;

public enum ActionKind {
    REVIEW_SUBMIT,
    FLAG_SUBMIT,
    VOTE_CAST
}
