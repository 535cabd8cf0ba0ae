package com.campus.reviews.moderation;

import java.util.List;

/**
 * Structured policy risk of a piece of review text.
 *
 * @param profanity      hard-rule hit; forces an auto flag on its own
 * @param spamLikelihood 0..1
 * @param sentiment      -1 (hostile) .. 1 (positive)
 * @param composite      0..1 weighted blend compared against the auto-flag threshold
 * @param reasons        human-readable notes for moderators
 * @param failedClosed   scoring did not complete and the worst case was assumed
 */
public record RiskAssessment(
        boolean profanity,
        double spamLikelihood,
        double sentiment,
        double composite,
        List<String> reasons,
        boolean failedClosed
) {

    public static RiskAssessment clean() {
        return new RiskAssessment(false, 0.0, 0.0, 0.0, List.of(), false);
    }

    public static RiskAssessment failClosed(String why) {
        return new RiskAssessment(false, 0.0, 0.0, 1.0, List.of("Scoring failed: " + why), true);
    }

    public boolean requiresAutoFlag(double threshold) {
        return profanity || composite >= threshold;
    }
}
