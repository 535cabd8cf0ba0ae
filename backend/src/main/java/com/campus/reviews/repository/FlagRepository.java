package com.campus.reviews.repository;

import com.campus.reviews.entity.Flag;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FlagRepository extends JpaRepository<Flag, UUID> {

    Optional<Flag> findByReviewIdAndReporterId(UUID reviewId, Long reporterId);

    Optional<Flag> findByReviewIdAndRuleKey(UUID reviewId, String ruleKey);

    List<Flag> findByReviewIdOrderByCreatedAtAsc(UUID reviewId);

    long countByReviewId(UUID reviewId);
}
