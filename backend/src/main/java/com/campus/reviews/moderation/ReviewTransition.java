package com.campus.reviews.moderation;

import com.campus.reviews.entity.ReviewStatus;

import java.util.EnumSet;
import java.util.Set;

import static com.campus.reviews.entity.ReviewStatus.*;

/**
 * Legal moving parts of the review lifecycle. Anything not listed here is an
 * invalid transition.
 */
public enum ReviewTransition {

    AUTO_CLEAR(Actor.SYSTEM, EnumSet.of(PENDING), PUBLISHED),
    FLAG_THRESHOLD(Actor.SYSTEM, EnumSet.of(PENDING, PUBLISHED), FLAGGED),
    BEGIN_REVIEW(Actor.MODERATOR, EnumSet.of(FLAGGED), UNDER_REVIEW),
    APPROVE(Actor.MODERATOR, EnumSet.of(UNDER_REVIEW), APPROVED),
    REMOVE(Actor.MODERATOR, EnumSet.of(UNDER_REVIEW), REMOVED),
    APPEAL(Actor.AUTHOR, EnumSet.of(REMOVED), APPEALED),
    REINSTATE(Actor.MODERATOR, EnumSet.of(APPEALED), REINSTATED),
    DENY(Actor.MODERATOR, EnumSet.of(APPEALED), REMOVED);

    public enum Actor { SYSTEM, MODERATOR, AUTHOR }

    private final Actor actor;
    private final Set<ReviewStatus> from;
    private final ReviewStatus to;

    ReviewTransition(Actor actor, Set<ReviewStatus> from, ReviewStatus to) {
        this.actor = actor;
        this.from = from;
        this.to = to;
    }

    public Actor actor() {
        return actor;
    }

    public ReviewStatus to() {
        return to;
    }

    public boolean allowsFrom(ReviewStatus current) {
        return from.contains(current);
    }

    /** System transitions are policy-driven and need no written rationale. */
    public boolean requiresReason() {
        return actor != Actor.SYSTEM;
    }
}
