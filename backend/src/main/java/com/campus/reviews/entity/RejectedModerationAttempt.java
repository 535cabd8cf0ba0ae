package com.campus.reviews.entity;

import com.campus.reviews.moderation.ReviewTransition;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

// Kept apart from moderation_actions so a rejected action never shows up as a status change.
@Entity
@Data
@Table(
        name = "moderation_attempts",
        indexes = {
                @Index(columnList = "review_id,created_at")
        }
)
public class RejectedModerationAttempt {

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
    @Column(name = "current_status", updatable = false, length = 16)
    private ReviewStatus currentStatus;

    @Column(updatable = false, length = 500)
    private String message;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
