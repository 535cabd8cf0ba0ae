package com.campus.reviews.dto;

import com.campus.reviews.moderation.ReviewTransition;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public record BulkModerationRequest(
        @NotEmpty @Size(max = 100) List<@NotNull UUID> reviewIds,
        @NotNull ReviewTransition action,
        @Size(max = 1000) String reason
) {}
