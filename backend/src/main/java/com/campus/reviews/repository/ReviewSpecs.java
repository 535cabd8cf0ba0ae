package com.campus.reviews.repository;

import com.campus.reviews.entity.Review;
import com.campus.reviews.entity.ReviewStatus;
import com.campus.reviews.entity.TargetKind;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Root;
import org.springframework.data.jpa.domain.Specification;

import java.util.Arrays;
import java.util.Collection;
import java.util.UUID;

public class ReviewSpecs {

    public static Specification<Review> hasStatusIn(Collection<ReviewStatus> statuses) {
        return (Root<Review> r, CriteriaQuery<?> q, CriteriaBuilder cb) -> {
            if (statuses == null || statuses.isEmpty()) {
                return cb.conjunction();
            }
            return r.get("status").in(statuses);
        };
    }

    public static Specification<Review> hasTargetKind(TargetKind kind) {
        return (Root<Review> r, CriteriaQuery<?> q, CriteriaBuilder cb) -> {
            if (kind == null) {
                return cb.conjunction();
            }
            return cb.equal(r.get("targetKind"), kind);
        };
    }

    public static Specification<Review> forTarget(UUID targetId) {
        return (Root<Review> r, CriteriaQuery<?> q, CriteriaBuilder cb) -> {
            if (targetId == null) {
                return cb.conjunction();
            }
            return cb.equal(r.get("targetId"), targetId);
        };
    }

    // Mirrors Review#isPubliclyVisible
    public static Specification<Review> publiclyVisible() {
        return (Root<Review> r, CriteriaQuery<?> q, CriteriaBuilder cb) -> {
            var publishing = Arrays.stream(ReviewStatus.values()).filter(ReviewStatus::isPublishing).toList();
            return cb.or(
                    r.get("status").in(publishing),
                    cb.and(r.get("status").in(ReviewStatus.QUEUE), cb.isNotNull(r.get("publishedAt")))
            );
        };
    }
}
