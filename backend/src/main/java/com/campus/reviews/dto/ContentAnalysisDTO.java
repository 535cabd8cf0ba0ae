package com.campus.reviews.dto;

import com.campus.reviews.moderation.RiskAssessment;

import java.util.List;

/**
 * Dry run of the submission scorer. {@code triggeredRules} holds the rule keys
 * an ingested review with this text would be auto-flagged under.
 */
public record ContentAnalysisDTO(
        RiskAssessment assessment,
        boolean autoFlag,
        List<String> triggeredRules,
        double autoFlagThreshold
) {}
