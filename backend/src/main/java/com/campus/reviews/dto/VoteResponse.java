package com.campus.reviews.dto;

import com.campus.reviews.entity.VoteType;

import java.util.UUID;

public record VoteResponse(
        UUID reviewId,
        VoteType voteType,
        boolean changed,
        long helpfulCount,
        long notHelpfulCount
) {}
