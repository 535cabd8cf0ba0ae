package com.campus.reviews.entity;

public enum VoteType {
    HELPFUL,
    NOT_HELPFUL
}
