package com.campus.reviews.dto;

import java.util.List;

public record BulkModerationResponse(
        int requested,
        int applied,
        int failed,
        List<BulkModerationResult> results
) {

    public static BulkModerationResponse of(List<BulkModerationResult> results) {
        int applied = (int) results.stream().filter(BulkModerationResult::applied).count();
        return new BulkModerationResponse(results.size(), applied, results.size() - applied, results);
    }
}
