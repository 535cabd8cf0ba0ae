package com.campus.reviews.moderation;

import com.campus.reviews.config.ModerationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexiconRiskScorerTest {

    private ModerationProperties props;
    private LexiconRiskScorer scorer;

    @BeforeEach
    void setUp() {
        props = new ModerationProperties();
        scorer = new LexiconRiskScorer(props, new DefaultResourceLoader());
        scorer.init();
    }

    @Test
    void lexiconsAreLoadedFromClasspath() {
        assertTrue(scorer.profanityTermCount() > 0);
        assertTrue(scorer.sentimentTermCount() > 0);
        assertEquals(11, scorer.spamPatternCount());
    }

    @Test
    void missingOrBlankTextIsClean() {
        assertEquals(RiskAssessment.clean(), scorer.score(null));
        assertEquals(RiskAssessment.clean(), scorer.score("   "));
        assertFalse(scorer.score(null).requiresAutoFlag(props.getAutoFlagThreshold()));
    }

    @Test
    void ordinaryPositiveReviewDoesNotTripAutoFlag() {
        RiskAssessment a = scorer.score("Clear lectures and fair grading, I would recommend this class.");

        assertFalse(a.profanity());
        assertEquals(0.0, a.spamLikelihood());
        assertTrue(a.sentiment() > 0);
        assertEquals(0.0, a.composite());
        assertFalse(a.requiresAutoFlag(props.getAutoFlagThreshold()));
    }

    @Test
    void profanityFlagsRegardlessOfComposite() {
        RiskAssessment a = scorer.score("The labs were fine but the grading was shit.");

        assertTrue(a.profanity());
        assertTrue(a.composite() < props.getAutoFlagThreshold());
        assertTrue(a.requiresAutoFlag(props.getAutoFlagThreshold()));
        assertTrue(a.reasons().stream().anyMatch(r -> r.startsWith("Contains profanity")));
    }

    @Test
    void promotionalTextScoresAsSpam() {
        RiskAssessment a = scorer.score(
                "BUY NOW!!!!! Cheap essay writing service, visit www.example.com or email us, call call call");

        // 9 of 11 patterns, no ratio bonus: 9 / 14
        assertEquals(9.0 / 14.0, a.spamLikelihood(), 1e-9);
        assertTrue(a.composite() >= a.spamLikelihood());
    }

    @Test
    void negationFlipsPolarity() {
        assertEquals(0.5, scorer.sentiment(List.of("good")), 1e-9);
        assertEquals(-0.5, scorer.sentiment(List.of("not", "good")), 1e-9);
        assertEquals(0.0, scorer.sentiment(List.of("the", "room")), 1e-9);
    }

    @Test
    void hostileTextIsReportedAsNegative() {
        RiskAssessment a = scorer.score("worst terrible awful");

        assertTrue(a.sentiment() <= props.getScorer().getNegativityRuleThreshold());
        assertTrue(a.reasons().stream().anyMatch(r -> r.startsWith("Extremely negative")));
    }

    @Test
    void scoringIsDeterministic() {
        String text = "Never again. Boring and confusing lectures!!";
        assertEquals(scorer.score(text), scorer.score(text));
    }
}
