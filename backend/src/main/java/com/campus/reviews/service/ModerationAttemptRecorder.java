package com.campus.reviews.service;

import com.campus.reviews.entity.RejectedModerationAttempt;
import com.campus.reviews.entity.ReviewStatus;
import com.campus.reviews.moderation.ReviewTransition;
import com.campus.reviews.repository.RejectedModerationAttemptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Persists rejected moderator and author actions in their own transaction so
 * the record survives the rollback of the rejected request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModerationAttemptRecorder {

    private final RejectedModerationAttemptRepository repo;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(UUID reviewId, String actorId, ReviewTransition action, ReviewStatus current, String message) {
        RejectedModerationAttempt attempt = new RejectedModerationAttempt();
        attempt.setReviewId(reviewId);
        attempt.setActorId(actorId);
        attempt.setAction(action);
        attempt.setCurrentStatus(current);
        attempt.setMessage(message);
        repo.save(attempt);
        log.warn("Rejected {} on review {} by {} (status {}): {}", action, reviewId, actorId, current, message);
    }
}
