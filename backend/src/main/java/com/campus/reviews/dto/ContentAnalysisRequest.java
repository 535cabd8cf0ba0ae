package com.campus.reviews.dto;

import com.campus.reviews.entity.Review;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ContentAnalysisRequest(
        @NotNull @Size(max = Review.MAX_BODY_LENGTH) String text
) {}
