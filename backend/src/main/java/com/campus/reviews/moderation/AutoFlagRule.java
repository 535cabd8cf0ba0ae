package com.campus.reviews.moderation;

import com.campus.reviews.entity.FlagReason;

public enum AutoFlagRule {
    PROFANITY("profanity", FlagReason.PROFANITY),
    SPAM("spam", FlagReason.SPAM),
    NEGATIVITY("negativity", FlagReason.HARASSMENT),
    COMPOSITE("composite", FlagReason.OTHER),
    SCORER_FAILURE("scorer-failure", FlagReason.OTHER);

    private final String key;
    private final FlagReason reason;

    AutoFlagRule(String key, FlagReason reason) {
        this.key = key;
        this.reason = reason;
    }

    public String key() {
        return key;
    }

    public FlagReason reason() {
        return reason;
    }
}
