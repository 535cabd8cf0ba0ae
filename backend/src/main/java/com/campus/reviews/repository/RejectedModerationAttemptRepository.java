package com.campus.reviews.repository;

import com.campus.reviews.entity.RejectedModerationAttempt;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface RejectedModerationAttemptRepository extends JpaRepository<RejectedModerationAttempt, Long> {

    List<RejectedModerationAttempt> findByReviewIdOrderByIdAsc(UUID reviewId);
}
