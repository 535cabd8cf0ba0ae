package com.campus.reviews.entity;

public enum FlagReason {
    SPAM,
    PROFANITY,
    HARASSMENT,
    IRRELEVANT,
    OTHER
}
