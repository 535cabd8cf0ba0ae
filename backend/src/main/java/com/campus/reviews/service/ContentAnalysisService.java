package com.campus.reviews.service;

import com.campus.reviews.dto.ContentAnalysisDTO;
import com.campus.reviews.moderation.AutoFlagPolicy;
import com.campus.reviews.moderation.AutoFlagRule;
import com.campus.reviews.moderation.RiskAssessment;
import com.campus.reviews.moderation.RiskScorer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/** Scores arbitrary text the way ingestion would, without writing anything. */
@Service
@RequiredArgsConstructor
public class ContentAnalysisService {

    private final RiskScorer riskScorer;
    private final AutoFlagPolicy autoFlagPolicy;

    public ContentAnalysisDTO analyze(String text) {
        RiskAssessment assessment = riskScorer.score(text);
        boolean autoFlag = autoFlagPolicy.shouldFlag(assessment);
        List<String> rules = autoFlag
                ? autoFlagPolicy.triggeredRules(assessment).stream().map(AutoFlagRule::key).toList()
                : List.of();
        return new ContentAnalysisDTO(assessment, autoFlag, rules, autoFlagPolicy.threshold());
    }
}
