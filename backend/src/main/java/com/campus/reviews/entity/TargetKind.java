package com.campus.reviews.entity;

import java.util.List;

public enum TargetKind {
    PROFESSOR(List.of("clarity", "helpfulness", "workload", "engagement")),
    COLLEGE(List.of("food", "internet", "clubs", "opportunities", "facilities", "teaching", "overall"));

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    private final List<String> ratingNames;

    TargetKind(List<String> ratingNames) {
        this.ratingNames = ratingNames;
    }

    /** Sub-score names every review of this kind must carry. */
    public List<String> ratingNames() {
        return ratingNames;
    }
}
