package com.campus.reviews.mapper;

import com.campus.reviews.dto.ModerationActionDTO;
import com.campus.reviews.dto.RejectedAttemptDTO;
import com.campus.reviews.dto.ReviewView;
import com.campus.reviews.entity.ModerationAction;
import com.campus.reviews.entity.RejectedModerationAttempt;
import com.campus.reviews.entity.Review;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface ReviewMapper {

    // Review -> public view; vote tallies come from the vote table
    @Mapping(target = "helpfulCount", source = "helpfulCount")
    @Mapping(target = "notHelpfulCount", source = "notHelpfulCount")
    ReviewView toView(Review review, long helpfulCount, long notHelpfulCount);

    ModerationActionDTO toDto(ModerationAction action);

    RejectedAttemptDTO toDto(RejectedModerationAttempt attempt);
}
