package com.campus.reviews.moderation;

import com.campus.reviews.config.ModerationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which auto-flag rules an assessment trips. A profanity hit flags
 * regardless of the composite score.
 */
@Component
@RequiredArgsConstructor
public class AutoFlagPolicy {

    private final ModerationProperties props;

    public boolean shouldFlag(RiskAssessment a) {
        return a.requiresAutoFlag(props.getAutoFlagThreshold());
    }

    public List<AutoFlagRule> triggeredRules(RiskAssessment a) {
        List<AutoFlagRule> rules = new ArrayList<>();
        if (a.failedClosed()) {
            rules.add(AutoFlagRule.SCORER_FAILURE);
            return rules;
        }
        if (a.profanity()) {
            rules.add(AutoFlagRule.PROFANITY);
        }
        if (a.composite() >= props.getAutoFlagThreshold()) {
            var scorer = props.getScorer();
            if (a.spamLikelihood() >= scorer.getSpamRuleThreshold()) rules.add(AutoFlagRule.SPAM);
            if (a.sentiment() <= scorer.getNegativityRuleThreshold()) rules.add(AutoFlagRule.NEGATIVITY);
            if (!rules.contains(AutoFlagRule.SPAM) && !rules.contains(AutoFlagRule.NEGATIVITY)) {
                rules.add(AutoFlagRule.COMPOSITE);
            }
        }
        return rules;
    }

    public double threshold() {
        return props.getAutoFlagThreshold();
    }
}
