package com.campus.reviews.dto;

import java.time.Instant;
import java.util.UUID;

public record AuthorOfResponse(UUID reviewId, Long authorId, Instant mappedAt) {}
