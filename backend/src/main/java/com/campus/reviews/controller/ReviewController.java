package com.campus.reviews.controller;

import com.campus.reviews.dto.*;
import com.campus.reviews.entity.TargetKind;
import com.campus.reviews.service.*;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/reviews")
@RequiredArgsConstructor
public class ReviewController {

    private final ReviewIngestionService ingestionService;
    private final ReviewQueryService queryService;
    private final FlaggingService flaggingService;
    private final VoteService voteService;
    private final ModerationService moderationService;

    @PostMapping
    public ResponseEntity<ReviewView> submit(@Valid @RequestBody SubmitReviewRequest request,
                                             Authentication authentication) {
        ReviewView view = ingestionService.submitReview(CurrentUser.id(authentication), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    @GetMapping("/{id}")
    public ReviewView get(@PathVariable UUID id) {
        return queryService.publicView(id);
    }

    // Only publicly visible reviews; ?targetKind=&targetId= narrow the list
    @GetMapping
    public Page<ReviewView> list(
            @RequestParam(required = false) TargetKind targetKind,
            @RequestParam(required = false) UUID targetId,
            Pageable pageable
    ) {
        return queryService.publicReviews(targetKind, targetId, pageable);
    }

    @PostMapping("/{id}/votes")
    public VoteResponse vote(@PathVariable UUID id, @Valid @RequestBody VoteRequest request,
                             Authentication authentication) {
        return voteService.castVote(id, CurrentUser.id(authentication), request.voteType());
    }

    @PostMapping("/{id}/flags")
    public ResponseEntity<FlagResponse> flag(@PathVariable UUID id, @Valid @RequestBody FlagRequest request,
                                             Authentication authentication) {
        FlagOutcome outcome = flaggingService.flagByUser(id, CurrentUser.id(authentication), request);
        FlagResponse body = new FlagResponse(outcome.flag().getId(), id, outcome.flag().getReason(),
                outcome.created(), outcome.flag().getCreatedAt());
        return ResponseEntity.status(outcome.created() ? HttpStatus.CREATED : HttpStatus.OK).body(body);
    }

    @PostMapping("/{id}/appeal")
    public ModerationActionDTO appeal(@PathVariable UUID id, @Valid @RequestBody AppealRequest request,
                                      Authentication authentication) {
        return moderationService.appeal(id, CurrentUser.id(authentication), request.reason());
    }
}
