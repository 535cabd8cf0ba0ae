package com.campus.reviews.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Data
@Table(
        name = "review_flags",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_flag_reporter", columnNames = {"review_id", "reporter_id"}),
                @UniqueConstraint(name = "uq_flag_rule", columnNames = {"review_id", "rule_key"})
        },
        indexes = {
                @Index(columnList = "review_id,created_at")
        }
)
public class Flag {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "review_id", nullable = false)
    private UUID reviewId;

    // null for system flags
    @Column(name = "reporter_id")
    private Long reporterId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private FlagSource source;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private FlagReason reason;

    // auto flags collapse to one row per rule
    @Column(name = "rule_key", length = 32)
    private String ruleKey;

    @Column(length = 500)
    private String description;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
