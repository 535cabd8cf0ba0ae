package com.campus.reviews.service;

import com.campus.reviews.config.ModerationProperties;
import com.campus.reviews.dto.FlagRequest;
import com.campus.reviews.entity.Flag;
import com.campus.reviews.entity.FlagSource;
import com.campus.reviews.entity.Review;
import com.campus.reviews.exception.RateLimitedException;
import com.campus.reviews.exception.ReviewNotFoundException;
import com.campus.reviews.moderation.AutoFlagRule;
import com.campus.reviews.moderation.ReviewTransition;
import com.campus.reviews.ratelimit.ActionKind;
import com.campus.reviews.ratelimit.ActionRateLimiter;
import com.campus.reviews.ratelimit.RateDecision;
import com.campus.reviews.repository.FlagRepository;
import com.campus.reviews.repository.ReviewRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Records user and automatic flags and moves a review into the moderation
 * queue once its flags cross the configured threshold.
 */
@Slf4j
@Service
public class FlaggingService {

    private static final int MAX_DESCRIPTION = 500;

    private record Recorded(Flag flag, Review review) {}

    private final FlagRepository flagRepository;
    private final ReviewRepository reviewRepository;
    private final ReviewQueryService queryService;
    private final ModerationService moderationService;
    private final ActionRateLimiter rateLimiter;
    private final ModerationProperties props;
    private final TransactionTemplate flagTx;

    public FlaggingService(FlagRepository flagRepository,
                           ReviewRepository reviewRepository,
                           ReviewQueryService queryService,
                           ModerationService moderationService,
                           ActionRateLimiter rateLimiter,
                           ModerationProperties props,
                           PlatformTransactionManager txManager) {
        this.flagRepository = flagRepository;
        this.reviewRepository = reviewRepository;
        this.queryService = queryService;
        this.moderationService = moderationService;
        this.rateLimiter = rateLimiter;
        this.props = props;
        this.flagTx = new TransactionTemplate(txManager);
    }

    public FlagOutcome flagByUser(UUID reviewId, Long reporterId, FlagRequest request) {
        if (reporterId == null) {
            throw new IllegalArgumentException("User flags need a reporter");
        }
        queryService.requireVisible(reviewId);

        Optional<Flag> existing = flagRepository.findByReviewIdAndReporterId(reviewId, reporterId);
        if (existing.isPresent()) {
            return unchanged(reviewId, existing.get());
        }

        RateDecision decision = rateLimiter.checkAndIncrement(reporterId, ActionKind.FLAG_SUBMIT);
        if (!decision.allowed()) {
            throw new RateLimitedException(ActionKind.FLAG_SUBMIT, decision.retryAfter());
        }

        Flag flag = new Flag();
        flag.setReviewId(reviewId);
        flag.setReporterId(reporterId);
        flag.setSource(FlagSource.USER);
        flag.setReason(request.reason());
        flag.setDescription(trim(request.description()));
        return record(flag, () -> flagRepository.findByReviewIdAndReporterId(reviewId, reporterId));
    }

    /** System flag raised by the risk scorer. One row per rule and review. */
    public FlagOutcome autoFlag(UUID reviewId, AutoFlagRule rule, String description) {
        Optional<Flag> existing = flagRepository.findByReviewIdAndRuleKey(reviewId, rule.key());
        if (existing.isPresent()) {
            return unchanged(reviewId, existing.get());
        }

        Flag flag = new Flag();
        flag.setReviewId(reviewId);
        flag.setSource(FlagSource.AUTO);
        flag.setReason(rule.reason());
        flag.setRuleKey(rule.key());
        flag.setDescription(trim(description));
        return record(flag, () -> flagRepository.findByReviewIdAndRuleKey(reviewId, rule.key()));
    }

    private FlagOutcome record(Flag flag, Supplier<Optional<Flag>> onDuplicate) {
        UUID reviewId = flag.getReviewId();
        boolean user = flag.getSource() == FlagSource.USER;

        Recorded result;
        try {
            result = flagTx.execute(status -> {
                // increment first: its row lock orders concurrent flaggers of the same review
                if (reviewRepository.incrementFlagCount(reviewId, user ? 1 : 0, Instant.now()) == 0) {
                    throw new ReviewNotFoundException(reviewId);
                }
                Flag f = flagRepository.saveAndFlush(flag);
                Review r = reviewRepository.findById(reviewId)
                        .orElseThrow(() -> new ReviewNotFoundException(reviewId));
                return new Recorded(f, r);
            });
        } catch (DataIntegrityViolationException e) {
            log.debug("Duplicate flag on review {} resolved to the existing row", reviewId);
            Flag winner = onDuplicate.get().orElseThrow(() -> e);
            return unchanged(reviewId, winner);
        }
        Flag saved = result.flag();
        Review review = result.review();

        log.info("{} flag {} on review {} ({}), flagCount={}", flag.getSource(), saved.getReason(),
                reviewId, saved.getRuleKey() == null ? "user" : saved.getRuleKey(), review.getFlagCount());

        boolean transitioned = false;
        if (thresholdMet(review, user) && ReviewTransition.FLAG_THRESHOLD.allowsFrom(review.getStatus())) {
            String reason = user
                    ? "User flags reached " + review.getUserFlagCount()
                    : "Auto flag: " + saved.getRuleKey();
            transitioned = moderationService.systemTransition(reviewId, ReviewTransition.FLAG_THRESHOLD, reason)
                    .isPresent();
        }
        return new FlagOutcome(saved, true, review.getFlagCount(), transitioned);
    }

    private boolean thresholdMet(Review review, boolean user) {
        return user
                ? review.getUserFlagCount() >= props.getUserFlagThreshold()
                : review.getAutoFlagCount() >= props.getAutoFlagCountThreshold();
    }

    private FlagOutcome unchanged(UUID reviewId, Flag existing) {
        int count = reviewRepository.findById(reviewId).map(Review::getFlagCount).orElse(0);
        return new FlagOutcome(existing, false, count, false);
    }

    private static String trim(String text) {
        if (text == null || text.isBlank()) return null;
        String t = text.trim();
        return t.length() > MAX_DESCRIPTION ? t.substring(0, MAX_DESCRIPTION) : t;
    }
}
