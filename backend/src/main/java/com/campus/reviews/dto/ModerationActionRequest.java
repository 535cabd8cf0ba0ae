package com.campus.reviews.dto;

import com.campus.reviews.moderation.ReviewTransition;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ModerationActionRequest(
        @NotNull ReviewTransition action,
        @Size(max = 1000) String reason
) {}
