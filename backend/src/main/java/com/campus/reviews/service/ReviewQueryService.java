package com.campus.reviews.service;

import com.campus.reviews.dto.ReviewView;
import com.campus.reviews.entity.Review;
import com.campus.reviews.entity.TargetKind;
import com.campus.reviews.entity.VoteType;
import com.campus.reviews.exception.ReviewNotFoundException;
import com.campus.reviews.mapper.ReviewMapper;
import com.campus.reviews.repository.ReviewRepository;
import com.campus.reviews.repository.ReviewSpecs;
import com.campus.reviews.repository.ReviewVoteRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Public read path. Never touches the author mapping store.
 */
@Service
@RequiredArgsConstructor
public class ReviewQueryService {

    private final ReviewRepository reviewRepository;
    private final ReviewVoteRepository voteRepository;
    private final ReviewMapper mapper;

    @Transactional(readOnly = true)
    public ReviewView publicView(UUID reviewId) {
        return view(requireVisible(reviewId));
    }

    @Transactional(readOnly = true)
    public Page<ReviewView> publicReviews(TargetKind kind, UUID targetId, Pageable pageable) {
        Specification<Review> spec = ReviewSpecs.publiclyVisible()
                .and(ReviewSpecs.hasTargetKind(kind))
                .and(ReviewSpecs.forTarget(targetId));
        return reviewRepository.findAll(spec, pageable).map(this::view);
    }

    /** Hidden reviews are reported as missing so their existence does not leak. */
    @Transactional(readOnly = true)
    public Review requireVisible(UUID reviewId) {
        return reviewRepository.findById(reviewId)
                .filter(Review::isPubliclyVisible)
                .orElseThrow(() -> new ReviewNotFoundException(reviewId));
    }

    public ReviewView view(Review review) {
        UUID id = review.getId();
        return mapper.toView(review,
                voteRepository.countByReviewIdAndVoteType(id, VoteType.HELPFUL),
                voteRepository.countByReviewIdAndVoteType(id, VoteType.NOT_HELPFUL));
    }
}
