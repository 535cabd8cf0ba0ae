package com.campus.reviews.repository;

import com.campus.reviews.entity.Review;
import com.campus.reviews.entity.ReviewStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface ReviewRepository extends JpaRepository<Review, UUID>, JpaSpecificationExecutor<Review> {

    // edits hold the row so a concurrent moderation step cannot slip in between check and write
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Review r where r.id = :id")
    Optional<Review> findForUpdate(@Param("id") UUID id);

    /**
     * Single-statement increment; the row lock it takes serializes concurrent flaggers.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Review r set r.flagCount = r.flagCount + 1, " +
            "r.userFlagCount = r.userFlagCount + :userIncrement, r.updatedAt = :now " +
            "where r.id = :id")
    int incrementFlagCount(@Param("id") UUID id, @Param("userIncrement") int userIncrement, @Param("now") Instant now);

    /**
     * Compare-and-set on status. Returns 0 when another caller moved the review first.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Review r set r.status = :to, r.updatedAt = :now where r.id = :id and r.status = :from")
    int compareAndSetStatus(@Param("id") UUID id,
                            @Param("from") ReviewStatus from,
                            @Param("to") ReviewStatus to,
                            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Review r set r.publishedAt = :now where r.id = :id and r.publishedAt is null")
    int markPublished(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Review r set r.appealed = true where r.id = :id")
    int markAppealed(@Param("id") UUID id);
}
