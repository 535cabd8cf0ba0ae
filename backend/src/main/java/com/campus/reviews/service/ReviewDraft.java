package com.campus.reviews.service;

import com.campus.reviews.entity.DisplayMode;
import com.campus.reviews.entity.TargetKind;

import java.util.Map;
import java.util.UUID;

/** Validated submission, ready to be written. */
public record ReviewDraft(
        TargetKind targetKind,
        UUID targetId,
        String bodyText,
        Map<String, Integer> ratings,
        DisplayMode displayMode
) {}
