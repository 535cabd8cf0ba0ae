package com.campus.reviews.moderation;

import com.campus.reviews.config.ModerationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.*;

/**
 * Runs the delegate scorer with a deadline. Timeouts, crashes and rejected
 * tasks fail closed (composite 1.0) so a broken classifier cannot wave content
 * through.
 */
@Slf4j
@Primary
@Component
public class GuardedRiskScorer implements RiskScorer {

    private final RiskScorer delegate;
    private final AsyncTaskExecutor executor;
    private final ModerationProperties props;

    public GuardedRiskScorer(
            @Qualifier("lexiconRiskScorer") RiskScorer delegate,
            @Qualifier("riskScorerExecutor") AsyncTaskExecutor executor,
            ModerationProperties props
    ) {
        this.delegate = delegate;
        this.executor = executor;
        this.props = props;
    }

    @Override
    public RiskAssessment score(String text) {
        long timeoutMs = props.getScorer().getTimeout().toMillis();
        Future<RiskAssessment> future;
        try {
            // cancel(true) on this future interrupts a hung delegate and frees its thread
            future = executor.submit(() -> delegate.score(text));
        } catch (RejectedExecutionException e) {
            log.warn("Risk scorer saturated, failing closed");
            return RiskAssessment.failClosed("scorer unavailable");
        }

        try {
            RiskAssessment result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return result != null ? result : RiskAssessment.failClosed("no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Risk scorer timed out after {} ms, failing closed", timeoutMs);
            return RiskAssessment.failClosed("timeout");
        } catch (ExecutionException e) {
            log.error("Risk scorer crashed, failing closed", e.getCause());
            return RiskAssessment.failClosed("error");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted while scoring, failing closed");
            return RiskAssessment.failClosed("interrupted");
        }
    }
}
