package com.campus.reviews.entity;

import com.campus.reviews.moderation.ReviewTransition;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit log row. One per review status change; never updated or deleted.
 */
@Entity
@Data
@Table(
        name = "moderation_actions",
        indexes = {
                @Index(columnList = "review_id,created_at")
        }
)
public class ModerationAction {

    public static final String SYSTEM_ACTOR = "system";
    public static final String AUTHOR_ACTOR = "author";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "review_id", nullable = false, updatable = false)
    private UUID reviewId;

    @Column(name = "actor_id", nullable = false, updatable = false, length = 64)
    private String actorId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private ReviewTransition action;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", nullable = false, updatable = false, length = 16)
    private ReviewStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false, updatable = false, length = 16)
    private ReviewStatus toStatus;

    @Column(name = "reason_text", updatable = false, length = 1000)
    private String reasonText;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static String moderatorActor(Long userId) {
        return "admin:" + userId;
    }
}
