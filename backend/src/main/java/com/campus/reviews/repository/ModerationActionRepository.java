package com.campus.reviews.repository;

import com.campus.reviews.entity.ModerationAction;
import com.campus.reviews.moderation.ReviewTransition;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

// Append-only: rows are inserted and read, never modified.
public interface ModerationActionRepository extends JpaRepository<ModerationAction, Long> {

    List<ModerationAction> findByReviewIdOrderByIdAsc(UUID reviewId);

    Optional<ModerationAction> findFirstByReviewIdOrderByIdDesc(UUID reviewId);

    long countByReviewId(UUID reviewId);

    long countByReviewIdAndAction(UUID reviewId, ReviewTransition action);
}
