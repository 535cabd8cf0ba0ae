package com.campus.reviews.moderation;

public interface RiskScorer {

    /** Must be deterministic for a given ruleset and free of side effects. */
    RiskAssessment score(String text);
}
