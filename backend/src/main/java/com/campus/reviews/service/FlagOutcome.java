package com.campus.reviews.service;

import com.campus.reviews.entity.Flag;

/**
 * @param created      false when an identical flag already existed
 * @param flagCount    review flag count after this call
 * @param transitioned this call moved the review into the moderation queue
 */
public record FlagOutcome(Flag flag, boolean created, int flagCount, boolean transitioned) {}
