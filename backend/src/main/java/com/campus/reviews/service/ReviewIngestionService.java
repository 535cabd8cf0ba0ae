package com.campus.reviews.service;

import com.campus.reviews.dto.ReviewView;
import com.campus.reviews.dto.SubmitReviewRequest;
import com.campus.reviews.entity.DisplayMode;
import com.campus.reviews.entity.Review;
import com.campus.reviews.entity.ReviewStatus;
import com.campus.reviews.entity.TargetKind;
import com.campus.reviews.exception.IngestionFailedException;
import com.campus.reviews.exception.RateLimitedException;
import com.campus.reviews.exception.ReviewLockedException;
import com.campus.reviews.exception.ReviewNotFoundException;
import com.campus.reviews.exception.ValidationException;
import com.campus.reviews.mapping.AuthorMappingStore;
import com.campus.reviews.moderation.AutoFlagPolicy;
import com.campus.reviews.moderation.AutoFlagRule;
import com.campus.reviews.moderation.ReviewTransition;
import com.campus.reviews.moderation.RiskAssessment;
import com.campus.reviews.moderation.RiskScorer;
import com.campus.reviews.ratelimit.ActionKind;
import com.campus.reviews.ratelimit.ActionRateLimiter;
import com.campus.reviews.ratelimit.RateDecision;
import com.campus.reviews.repository.ReviewRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.*;

/**
 * Entry point for new reviews and resubmissions. Validates, rate limits,
 * scores, writes through the saga (or edits in place) and finally routes the
 * review to publication or to the moderation queue.
 */
@Slf4j
@Service
public class ReviewIngestionService {

    private final ReviewRepository reviewRepository;
    private final AuthorMappingStore mappingStore;
    private final ReviewWriteSaga writeSaga;
    private final ReviewTargetResolver targetResolver;
    private final ActionRateLimiter rateLimiter;
    private final RiskScorer riskScorer;
    private final AutoFlagPolicy autoFlagPolicy;
    private final FlaggingService flaggingService;
    private final ModerationService moderationService;
    private final ReviewQueryService queryService;
    private final TransactionTemplate editTx;

    public ReviewIngestionService(ReviewRepository reviewRepository,
                                  AuthorMappingStore mappingStore,
                                  ReviewWriteSaga writeSaga,
                                  ReviewTargetResolver targetResolver,
                                  ActionRateLimiter rateLimiter,
                                  RiskScorer riskScorer,
                                  AutoFlagPolicy autoFlagPolicy,
                                  FlaggingService flaggingService,
                                  ModerationService moderationService,
                                  ReviewQueryService queryService,
                                  PlatformTransactionManager txManager) {
        this.reviewRepository = reviewRepository;
        this.mappingStore = mappingStore;
        this.writeSaga = writeSaga;
        this.targetResolver = targetResolver;
        this.rateLimiter = rateLimiter;
        this.riskScorer = riskScorer;
        this.autoFlagPolicy = autoFlagPolicy;
        this.flaggingService = flaggingService;
        this.moderationService = moderationService;
        this.queryService = queryService;
        this.editTx = new TransactionTemplate(txManager);
    }

    public ReviewView submitReview(Long authorId, SubmitReviewRequest request) {
        ReviewDraft draft = validate(request);

        RateDecision decision = rateLimiter.checkAndIncrement(authorId, ActionKind.REVIEW_SUBMIT);
        if (!decision.allowed()) {
            throw new RateLimitedException(ActionKind.REVIEW_SUBMIT, decision.retryAfter());
        }

        RiskAssessment assessment = riskScorer.score(draft.bodyText());

        Review review = mappingStore.findReviewId(authorId, draft.targetKind(), draft.targetId())
                .flatMap(existingId -> edit(existingId, draft))
                .orElseGet(() -> create(draft, authorId));

        route(review, assessment);

        Review current = reviewRepository.findById(review.getId())
                .orElseThrow(() -> new ReviewNotFoundException(review.getId()));
        return queryService.view(current);
    }

    ReviewDraft validate(SubmitReviewRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        TargetKind kind = request.targetKind();

        if (kind == null) {
            errors.put("targetKind", "is required");
        }
        if (request.targetId() == null) {
            errors.put("targetId", "is required");
        }

        Map<String, Integer> ratings = request.ratings() == null ? Map.of() : request.ratings();
        if (kind != null) {
            Set<String> expected = new HashSet<>(kind.ratingNames());
            if (!ratings.keySet().equals(expected)) {
                errors.put("ratings", "must be exactly " + kind.ratingNames());
            } else {
                for (Map.Entry<String, Integer> e : ratings.entrySet()) {
                    Integer v = e.getValue();
                    if (v == null || v < TargetKind.MIN_RATING || v > TargetKind.MAX_RATING) {
                        errors.put("ratings." + e.getKey(),
                                "must be between " + TargetKind.MIN_RATING + " and " + TargetKind.MAX_RATING);
                    }
                }
            }
        }

        String body = request.bodyText() == null || request.bodyText().isBlank() ? null : request.bodyText().trim();
        if (body != null && body.length() > Review.MAX_BODY_LENGTH) {
            errors.put("bodyText", "must be at most " + Review.MAX_BODY_LENGTH + " characters");
        }

        if (errors.isEmpty() && !targetResolver.exists(kind, request.targetId())) {
            errors.put("targetId", "unknown " + kind.name().toLowerCase(Locale.ROOT));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid review submission", errors);
        }

        Map<String, Integer> ordered = new LinkedHashMap<>();
        kind.ratingNames().forEach(name -> ordered.put(name, ratings.get(name)));
        DisplayMode mode = request.displayMode() == null ? DisplayMode.ANONYMOUS : request.displayMode();
        return new ReviewDraft(kind, request.targetId(), body, ordered, mode);
    }

    private Review create(ReviewDraft draft, Long authorId) {
        SagaOutcome outcome = writeSaga.create(draft, authorId);
        if (outcome.committed()) {
            return outcome.review();
        }
        if (outcome.duplicateTarget()) {
            // a parallel submission for the same target won; this one becomes its edit
            Optional<Review> edited = mappingStore.findReviewId(authorId, draft.targetKind(), draft.targetId())
                    .flatMap(existingId -> edit(existingId, draft));
            if (edited.isPresent()) {
                return edited.get();
            }
        }
        throw new IngestionFailedException(outcome.failure());
    }

    /**
     * Replaces the content of an existing review. Empty when the mapping
     * points at a review that no longer exists; the stale mapping is dropped.
     */
    private Optional<Review> edit(UUID reviewId, ReviewDraft draft) {
        Review edited = editTx.execute(status -> {
            Review r = reviewRepository.findForUpdate(reviewId).orElse(null);
            if (r == null) {
                return null;
            }
            if (!r.getStatus().isEditable()) {
                throw new ReviewLockedException(r.getStatus());
            }
            r.setBodyText(draft.bodyText());
            r.getRatings().clear();
            r.getRatings().putAll(draft.ratings());
            r.setDisplayMode(draft.displayMode());
            r.setUpdatedAt(Instant.now());
            return reviewRepository.save(r);
        });

        if (edited == null) {
            mappingStore.detach(reviewId);
            return Optional.empty();
        }
        log.info("Review {} edited", reviewId);
        return Optional.of(edited);
    }

    private void route(Review review, RiskAssessment assessment) {
        UUID id = review.getId();
        try {
            if (autoFlagPolicy.shouldFlag(assessment)) {
                String notes = String.join("; ", assessment.reasons());
                for (AutoFlagRule rule : autoFlagPolicy.triggeredRules(assessment)) {
                    flaggingService.autoFlag(id, rule, notes);
                }
                log.info("Review {} auto-flagged (composite={}, profanity={})",
                        id, assessment.composite(), assessment.profanity());
            } else if (review.getStatus() == ReviewStatus.PENDING) {
                moderationService.systemTransition(id, ReviewTransition.AUTO_CLEAR, null);
            }
        } catch (RuntimeException e) {
            // the review stays PENDING and hidden; resubmitting re-routes it as an edit
            log.error("Routing failed for review {}", id, e);
            throw new IngestionFailedException(e);
        }
    }
}
