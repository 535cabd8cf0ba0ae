package com.campus.reviews.dto;

import java.time.Instant;

public record ElevationResponse(String elevatedToken, Instant expiresAt) {}
