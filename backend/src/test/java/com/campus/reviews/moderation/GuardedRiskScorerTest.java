package com.campus.reviews.moderation;

import com.campus.reviews.config.ModerationProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GuardedRiskScorerTest {

    @Mock
    private RiskScorer delegate;

    private ModerationProperties props;
    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        props = new ModerationProperties();
        props.getScorer().setTimeout(Duration.ofMillis(100));
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("scorer-test-");
        executor.initialize();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void passesThroughDelegateResult() {
        RiskAssessment expected = new RiskAssessment(false, 0.1, 0.2, 0.1, List.of(), false);
        when(delegate.score("fine")).thenReturn(expected);

        assertEquals(expected, new GuardedRiskScorer(delegate, executor, props).score("fine"));
    }

    @Test
    void timeoutFailsClosed() {
        when(delegate.score("slow")).thenAnswer(inv -> {
            Thread.sleep(2_000);
            return RiskAssessment.clean();
        });

        RiskAssessment a = new GuardedRiskScorer(delegate, executor, props).score("slow");

        assertTrue(a.failedClosed());
        assertEquals(1.0, a.composite());
        assertTrue(a.requiresAutoFlag(props.getAutoFlagThreshold()));
    }

    @Test
    void timedOutDelegateIsInterruptedAndReleasesItsThread() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        RiskAssessment expected = new RiskAssessment(false, 0.1, 0.2, 0.1, List.of(), false);
        when(delegate.score("hang")).thenAnswer(inv -> {
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return RiskAssessment.clean();
        });
        when(delegate.score("fine")).thenReturn(expected);
        GuardedRiskScorer guarded = new GuardedRiskScorer(delegate, executor, props);

        assertTrue(guarded.score("hang").failedClosed());
        assertTrue(interrupted.await(5, TimeUnit.SECONDS));

        // the single pool thread is free again
        props.getScorer().setTimeout(Duration.ofSeconds(5));
        assertEquals(expected, guarded.score("fine"));
    }

    @Test
    void crashFailsClosed() {
        when(delegate.score("boom")).thenThrow(new IllegalStateException("lexicon gone"));

        RiskAssessment a = new GuardedRiskScorer(delegate, executor, props).score("boom");

        assertTrue(a.failedClosed());
        assertEquals(1.0, a.composite());
    }

    @Test
    void rejectedTaskFailsClosed() {
        executor.shutdown();
        GuardedRiskScorer guarded = new GuardedRiskScorer(delegate, executor, props);

        RiskAssessment a = guarded.score("anything");

        assertTrue(a.failedClosed());
        assertEquals(List.of("Scoring failed: scorer unavailable"), a.reasons());
    }
}
