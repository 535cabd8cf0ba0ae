package com.campus.reviews.mapping;

import com.campus.reviews.entity.TargetKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface AuthorMappingRepository extends JpaRepository<AuthorMapping, Long> {

    Optional<AuthorMapping> findByReviewId(UUID reviewId);

    Optional<AuthorMapping> findByAuthorIdAndTargetKindAndTargetId(Long authorId, TargetKind targetKind, UUID targetId);

    @Modifying
    @Query("delete from AuthorMapping m where m.reviewId = :reviewId")
    int deleteByReviewId(@Param("reviewId") UUID reviewId);
}
