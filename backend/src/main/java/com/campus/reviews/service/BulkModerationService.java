package com.campus.reviews.service;

import com.campus.reviews.dto.BulkModerationResponse;
import com.campus.reviews.dto.BulkModerationResult;
import com.campus.reviews.dto.ModerationActionDTO;
import com.campus.reviews.exception.InvalidTransitionException;
import com.campus.reviews.exception.ReviewPipelineException;
import com.campus.reviews.exception.ValidationException;
import com.campus.reviews.moderation.ReviewTransition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

/**
 * Applies one moderator action to many reviews. Each review is moderated in
 * its own transaction through {@link ModerationService#moderate}, so a
 * rejected review does not undo the ones before it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BulkModerationService {

    private final ModerationService moderationService;

    public BulkModerationResponse moderateAll(List<UUID> reviewIds, ReviewTransition transition,
                                              String reason, Long moderatorId) {
        if (transition.actor() != ReviewTransition.Actor.MODERATOR) {
            throw new ValidationException(transition + " is not a moderator action");
        }

        List<BulkModerationResult> results = new ArrayList<>();
        for (UUID reviewId : new LinkedHashSet<>(reviewIds)) {
            results.add(moderateOne(reviewId, transition, reason, moderatorId));
        }

        BulkModerationResponse response = BulkModerationResponse.of(results);
        log.info("Bulk {} by moderator {}: {} applied, {} failed",
                transition, moderatorId, response.applied(), response.failed());
        return response;
    }

    private BulkModerationResult moderateOne(UUID reviewId, ReviewTransition transition,
                                             String reason, Long moderatorId) {
        try {
            ModerationActionDTO action = moderationService.moderate(reviewId, transition, reason, moderatorId);
            return new BulkModerationResult(reviewId, action, null, action.toStatus());
        } catch (InvalidTransitionException e) {
            return new BulkModerationResult(reviewId, null, e.getMessage(), e.getCurrentStatus());
        } catch (ReviewPipelineException e) {
            return new BulkModerationResult(reviewId, null, e.getMessage(), null);
        }
    }
}
