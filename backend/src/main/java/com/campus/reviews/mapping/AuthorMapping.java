package com.campus.reviews.mapping;

import com.campus.reviews.entity.TargetKind;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * The only link between a review and the account that wrote it. The target
 * columns let the store itself enforce one review per author and target.
 */
@Entity
@Data
@Table(
        name = "review_author_mappings",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_mapping_review", columnNames = {"review_id"}),
                @UniqueConstraint(name = "uq_mapping_author_target", columnNames = {"author_id", "target_kind", "target_id"})
        },
        indexes = {
                @Index(columnList = "author_id")
        }
)
public class AuthorMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "review_id", nullable = false, updatable = false)
    private UUID reviewId;

    @Column(name = "author_id", nullable = false, updatable = false)
    private Long authorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_kind", nullable = false, updatable = false, length = 16)
    private TargetKind targetKind;

    @Column(name = "target_id", nullable = false, updatable = false)
    private UUID targetId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
