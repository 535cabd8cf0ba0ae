package com.campus.reviews.dto;

import com.campus.reviews.entity.FlagReason;

import java.util.List;
import java.util.Map;

public record QueueItemDTO(
        ReviewView review,
        Map<FlagReason, Long> flagReasons,
        int userFlagCount,
        int autoFlagCount,
        List<String> autoFlagNotes
) {}
