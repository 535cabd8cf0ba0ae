package com.campus.reviews.dto;

public record ScorerStatsDTO(
        double autoFlagThreshold,
        int userFlagThreshold,
        int autoFlagCountThreshold,
        double spamWeight,
        double negativityWeight,
        double profanityWeight,
        long timeoutMillis,
        int profanityTerms,
        int sentimentTerms,
        int spamPatterns
) {}
