package com.campus.reviews.service;

import com.campus.reviews.dto.VoteResponse;
import com.campus.reviews.entity.ReviewVote;
import com.campus.reviews.entity.VoteType;
import com.campus.reviews.exception.RateLimitedException;
import com.campus.reviews.ratelimit.ActionKind;
import com.campus.reviews.ratelimit.ActionRateLimiter;
import com.campus.reviews.ratelimit.RateDecision;
import com.campus.reviews.repository.ReviewVoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

// One vote per user and review; re-voting switches the type.
@Slf4j
@Service
@RequiredArgsConstructor
public class VoteService {

    private final ReviewVoteRepository voteRepository;
    private final ReviewQueryService queryService;
    private final ActionRateLimiter rateLimiter;

    public VoteResponse castVote(UUID reviewId, Long userId, VoteType voteType) {
        queryService.requireVisible(reviewId);

        Optional<ReviewVote> existing = voteRepository.findByReviewIdAndUserId(reviewId, userId);
        if (existing.isPresent() && existing.get().getVoteType() == voteType) {
            return response(reviewId, voteType, false);
        }

        RateDecision decision = rateLimiter.checkAndIncrement(userId, ActionKind.VOTE_CAST);
        if (!decision.allowed()) {
            throw new RateLimitedException(ActionKind.VOTE_CAST, decision.retryAfter());
        }

        ReviewVote vote = existing.orElseGet(ReviewVote::new);
        vote.setReviewId(reviewId);
        vote.setUserId(userId);
        vote.setVoteType(voteType);
        try {
            voteRepository.saveAndFlush(vote);
        } catch (DataIntegrityViolationException e) {
            // a parallel request from the same user inserted first
            log.debug("Concurrent vote on review {} kept the first row", reviewId);
            return response(reviewId, voteType, false);
        }
        return response(reviewId, voteType, true);
    }

    private VoteResponse response(UUID reviewId, VoteType voteType, boolean changed) {
        return new VoteResponse(reviewId, voteType, changed,
                voteRepository.countByReviewIdAndVoteType(reviewId, VoteType.HELPFUL),
                voteRepository.countByReviewIdAndVoteType(reviewId, VoteType.NOT_HELPFUL));
    }
}
