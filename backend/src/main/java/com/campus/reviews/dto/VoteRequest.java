package com.campus.reviews.dto;

import com.campus.reviews.entity.VoteType;
import jakarta.validation.constraints.NotNull;

public record VoteRequest(@NotNull VoteType voteType) {}
