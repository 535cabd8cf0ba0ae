package com.campus.reviews.service;

import com.campus.reviews.entity.Review;
import com.campus.reviews.entity.ReviewStatus;
import com.campus.reviews.mapping.AuthorMappingStore;
import com.campus.reviews.repository.ReviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;

/**
 * Writes a new review across the content and mapping stores. There is no
 * shared transaction: the review row goes first in PENDING, then the mapping,
 * and a failed mapping write deletes the review again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReviewWriteSaga {

    private final ReviewRepository reviewRepository;
    private final AuthorMappingStore mappingStore;

    public SagaOutcome create(ReviewDraft draft, Long authorId) {
        Review review;
        try {
            review = reviewRepository.saveAndFlush(newReview(draft));
        } catch (RuntimeException e) {
            log.error("Review write failed before the mapping step", e);
            return SagaOutcome.rolledBack(e);
        }

        try {
            mappingStore.attach(review.getId(), authorId, draft.targetKind(), draft.targetId());
        } catch (DataIntegrityViolationException e) {
            log.warn("Review {} lost the one-per-target race for {} {}, deleting it",
                    review.getId(), draft.targetKind(), draft.targetId());
            compensate(review, e);
            return SagaOutcome.duplicate(e);
        } catch (RuntimeException e) {
            log.error("Author mapping write failed for review {}, deleting it", review.getId(), e);
            compensate(review, e);
            return SagaOutcome.rolledBack(e);
        }

        log.info("Review {} written for {} {}", review.getId(), draft.targetKind(), draft.targetId());
        return SagaOutcome.committed(review);
    }

    private void compensate(Review review, RuntimeException cause) {
        try {
            reviewRepository.deleteById(review.getId());
        } catch (RuntimeException e) {
            // the row stays PENDING and therefore hidden
            log.error("Compensating delete failed for review {}", review.getId(), e);
            cause.addSuppressed(e);
        }
    }

    private static Review newReview(ReviewDraft draft) {
        Review r = new Review();
        r.setTargetKind(draft.targetKind());
        r.setTargetId(draft.targetId());
        r.setBodyText(draft.bodyText());
        r.setRatings(new LinkedHashMap<>(draft.ratings()));
        r.setDisplayMode(draft.displayMode());
        r.setStatus(ReviewStatus.PENDING);
        return r;
    }
}
