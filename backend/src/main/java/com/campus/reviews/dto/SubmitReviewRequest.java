package com.campus.reviews.dto;

import com.campus.reviews.entity.DisplayMode;
import com.campus.reviews.entity.TargetKind;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.Map;
import java.util.UUID;

public record SubmitReviewRequest(
        @NotNull UUID targetId,
        @NotNull TargetKind targetKind,
        String bodyText,
        @NotEmpty Map<String, Integer> ratings,
        DisplayMode displayMode // null -> ANONYMOUS
) {}
