package com.campus.reviews.service;

import com.campus.reviews.entity.Review;

/**
 * Result of the two-store write. Either both rows exist ({@link #committed()})
 * or neither does and {@code failure} says why.
 *
 * @param review          the persisted review, only when committed
 * @param failure         root cause when the saga rolled back
 * @param duplicateTarget the mapping write lost the one-review-per-target race
 */
public record SagaOutcome(Review review, Throwable failure, boolean duplicateTarget) {

    public static SagaOutcome committed(Review review) {
        return new SagaOutcome(review, null, false);
    }

    public static SagaOutcome rolledBack(Throwable failure) {
        return new SagaOutcome(null, failure, false);
    }

    public static SagaOutcome duplicate(Throwable failure) {
        return new SagaOutcome(null, failure, true);
    }

    public boolean committed() {
        return review != null;
    }
}
