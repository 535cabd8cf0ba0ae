package com.campus.reviews.repository;

import com.campus.reviews.entity.ReviewVote;
import com.campus.reviews.entity.VoteType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface ReviewVoteRepository extends JpaRepository<ReviewVote, Long> {

    Optional<ReviewVote> findByReviewIdAndUserId(UUID reviewId, Long userId);

    long countByReviewIdAndVoteType(UUID reviewId, VoteType voteType);
}
