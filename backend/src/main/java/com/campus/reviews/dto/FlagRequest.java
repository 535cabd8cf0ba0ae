package com.campus.reviews.dto;

import com.campus.reviews.entity.FlagReason;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record FlagRequest(
        @NotNull FlagReason reason,
        @Size(max = 500) String description
) {}
