package com.campus.reviews.service;

import com.campus.reviews.config.ModerationProperties;
import com.campus.reviews.dto.ModerationActionDTO;
import com.campus.reviews.dto.QueueItemDTO;
import com.campus.reviews.dto.RejectedAttemptDTO;
import com.campus.reviews.dto.ScorerStatsDTO;
import com.campus.reviews.entity.*;
import com.campus.reviews.exception.InvalidTransitionException;
import com.campus.reviews.exception.ReviewNotFoundException;
import com.campus.reviews.exception.ValidationException;
import com.campus.reviews.mapper.ReviewMapper;
import com.campus.reviews.mapping.AuthorMappingStore;
import com.campus.reviews.moderation.LexiconRiskScorer;
import com.campus.reviews.moderation.ReviewTransition;
import com.campus.reviews.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Owner of review status. Every change is a compare-and-set on the status
 * column plus exactly one audit row, in one content-store transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModerationService {

    private final ReviewRepository reviewRepo;
    private final ModerationActionRepository auditRepo;
    private final RejectedModerationAttemptRepository attemptRepo;
    private final FlagRepository flagRepo;
    private final ModerationAttemptRecorder attemptRecorder;
    private final AuthorMappingStore mappingStore;
    private final ReviewQueryService queryService;
    private final ReviewMapper mapper;
    private final ModerationProperties props;
    private final LexiconRiskScorer lexiconScorer;

    /**
     * Policy-driven transition. Returns empty when the review is not in a
     * source state for the action, which for system callers means "someone
     * already did it".
     */
    @Transactional
    public Optional<ModerationAction> systemTransition(UUID reviewId, ReviewTransition transition, String reason) {
        if (transition.actor() != ReviewTransition.Actor.SYSTEM) {
            throw new IllegalArgumentException(transition + " is not a system transition");
        }
        Review review = reviewRepo.findById(reviewId)
                .orElseThrow(() -> new ReviewNotFoundException(reviewId));
        if (!transition.allowsFrom(review.getStatus())) {
            log.debug("Skipping {} on review {}: already {}", transition, reviewId, review.getStatus());
            return Optional.empty();
        }
        return apply(review, transition, ModerationAction.SYSTEM_ACTOR, reason);
    }

    @Transactional
    public ModerationActionDTO moderate(UUID reviewId, ReviewTransition transition, String reason, Long moderatorId) {
        String actor = ModerationAction.moderatorActor(moderatorId);
        if (transition.actor() != ReviewTransition.Actor.MODERATOR) {
            ReviewStatus current = reviewRepo.findById(reviewId).map(Review::getStatus).orElse(null);
            attemptRecorder.record(reviewId, actor, transition, current, "not a moderator action");
            throw new ValidationException(transition + " is not a moderator action");
        }
        return mapper.toDto(transitionOrReject(reviewId, transition, actor, reason));
    }

    /** Author-initiated appeal. Ownership is checked against the mapping store. */
    @Transactional
    public ModerationActionDTO appeal(UUID reviewId, Long authorId, String reason) {
        if (!mappingStore.isAuthor(reviewId, authorId)) {
            throw new ReviewNotFoundException(reviewId);
        }
        return mapper.toDto(transitionOrReject(reviewId, ReviewTransition.APPEAL, ModerationAction.AUTHOR_ACTOR, reason));
    }

    @Transactional(readOnly = true)
    public Page<QueueItemDTO> queue(ReviewStatus status, TargetKind kind, Pageable pageable) {
        Set<ReviewStatus> statuses = status == null ? ReviewStatus.QUEUE : EnumSet.of(status);
        Specification<Review> spec = ReviewSpecs.hasStatusIn(statuses).and(ReviewSpecs.hasTargetKind(kind));
        return reviewRepo.findAll(spec, pageable).map(this::toQueueItem);
    }

    @Transactional(readOnly = true)
    public List<ModerationActionDTO> auditLog(UUID reviewId) {
        return auditRepo.findByReviewIdOrderByIdAsc(reviewId).stream().map(mapper::toDto).toList();
    }

    @Transactional(readOnly = true)
    public List<RejectedAttemptDTO> attempts(UUID reviewId) {
        return attemptRepo.findByReviewIdOrderByIdAsc(reviewId).stream().map(mapper::toDto).toList();
    }

    public ScorerStatsDTO scorerStats() {
        ModerationProperties.Scorer scorer = props.getScorer();
        return new ScorerStatsDTO(
                props.getAutoFlagThreshold(),
                props.getUserFlagThreshold(),
                props.getAutoFlagCountThreshold(),
                scorer.getSpamWeight(),
                scorer.getNegativityWeight(),
                scorer.getProfanityWeight(),
                scorer.getTimeout().toMillis(),
                lexiconScorer.profanityTermCount(),
                lexiconScorer.sentimentTermCount(),
                lexiconScorer.spamPatternCount());
    }

    private ModerationAction transitionOrReject(UUID reviewId, ReviewTransition transition, String actor, String reason) {
        Review review = reviewRepo.findById(reviewId)
                .orElseThrow(() -> new ReviewNotFoundException(reviewId));

        Optional<ModerationAction> replay = findReplay(review, transition, actor);
        if (replay.isPresent()) {
            log.info("Replayed {} on review {} by {}; no new audit row", transition, reviewId, actor);
            return replay.get();
        }

        boolean secondAppeal = transition == ReviewTransition.APPEAL && review.isAppealed();
        if (!transition.allowsFrom(review.getStatus()) || secondAppeal) {
            attemptRecorder.record(reviewId, actor, transition, review.getStatus(),
                    secondAppeal ? "appeal already used" : "invalid transition");
            throw new InvalidTransitionException(reviewId, review.getStatus(), transition);
        }

        if (transition.requiresReason() && (reason == null || reason.isBlank())) {
            attemptRecorder.record(reviewId, actor, transition, review.getStatus(), "missing reason");
            throw new ValidationException("A reason is required for " + transition);
        }

        return apply(review, transition, actor, reason.trim()).orElseThrow(() -> {
            ReviewStatus now = reviewRepo.findById(reviewId).map(Review::getStatus).orElse(null);
            attemptRecorder.record(reviewId, actor, transition, now, "lost concurrent update");
            return new InvalidTransitionException(reviewId, now, transition);
        });
    }

    // Same action by the same actor, still in effect and recent enough: a client retry.
    private Optional<ModerationAction> findReplay(Review review, ReviewTransition transition, String actor) {
        Instant cutoff = Instant.now().minus(props.getIdempotencyWindow());
        return auditRepo.findFirstByReviewIdOrderByIdDesc(review.getId())
                .filter(last -> last.getAction() == transition)
                .filter(last -> last.getActorId().equals(actor))
                .filter(last -> last.getCreatedAt().isAfter(cutoff))
                .filter(last -> review.getStatus() == transition.to());
    }

    private Optional<ModerationAction> apply(Review review, ReviewTransition transition, String actor, String reason) {
        ReviewStatus from = review.getStatus();
        Instant now = Instant.now();
        if (reviewRepo.compareAndSetStatus(review.getId(), from, transition.to(), now) == 0) {
            return Optional.empty();
        }
        if (transition.to().isPublishing()) {
            reviewRepo.markPublished(review.getId(), now);
        }
        if (transition == ReviewTransition.APPEAL) {
            reviewRepo.markAppealed(review.getId());
        }

        ModerationAction action = new ModerationAction();
        action.setReviewId(review.getId());
        action.setActorId(actor);
        action.setAction(transition);
        action.setFromStatus(from);
        action.setToStatus(transition.to());
        action.setReasonText(reason);
        ModerationAction saved = auditRepo.save(action);

        log.info("Review {} {} -> {} ({} by {})", review.getId(), from, transition.to(), transition, actor);
        return Optional.of(saved);
    }

    private QueueItemDTO toQueueItem(Review review) {
        List<Flag> flags = flagRepo.findByReviewIdOrderByCreatedAtAsc(review.getId());
        Map<FlagReason, Long> reasons = flags.stream()
                .collect(Collectors.groupingBy(Flag::getReason, () -> new EnumMap<>(FlagReason.class), Collectors.counting()));
        List<String> autoNotes = flags.stream()
                .filter(f -> f.getSource() == FlagSource.AUTO)
                .map(Flag::getDescription)
                .filter(Objects::nonNull)
                .toList();
        return new QueueItemDTO(queryService.view(review), reasons,
                review.getUserFlagCount(), review.getAutoFlagCount(), autoNotes);
    }
}
