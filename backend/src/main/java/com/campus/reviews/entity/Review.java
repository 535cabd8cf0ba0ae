package com.campus.reviews.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Public review content. Carries no reference to its author: attribution lives
 * only in the author mapping store.
 */
@Entity
@Data
@Table(
        name = "reviews",
        indexes = {
                @Index(columnList = "target_kind,target_id"),
                @Index(columnList = "status")
        }
)
public class Review {

    public static final int MAX_BODY_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "target_id", nullable = false)
    private UUID targetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_kind", nullable = false, length = 16)
    private TargetKind targetKind;

    @Column(name = "body_text", length = MAX_BODY_LENGTH)
    private String bodyText;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "review_ratings", joinColumns = @JoinColumn(name = "review_id"))
    @MapKeyColumn(name = "rating_name", length = 32)
    @Column(name = "score", nullable = false)
    private Map<String, Integer> ratings = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "display_mode", nullable = false, length = 16)
    private DisplayMode displayMode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ReviewStatus status = ReviewStatus.PENDING;

    @Column(name = "flag_count", nullable = false)
    private int flagCount = 0;

    @Column(name = "user_flag_count", nullable = false)
    private int userFlagCount = 0;

    // one appeal per review; a denied appeal is final
    @Column(nullable = false)
    private boolean appealed = false;

    @Column(name = "published_at")
    private Instant publishedAt;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    // written explicitly: status changes go through bulk updates
    @Column(nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        if (updatedAt == null) updatedAt = Instant.now();
        if (status == null) status = ReviewStatus.PENDING;
    }

    public int getAutoFlagCount() {
        return flagCount - userFlagCount;
    }

    /**
     * Whether non-privileged callers may read this review. Flagged content stays
     * visible while under review only if it had been published before.
     */
    public boolean isPubliclyVisible() {
        if (status.isPublishing()) return true;
        return ReviewStatus.QUEUE.contains(status) && publishedAt != null;
    }
}
