package com.campus.reviews.controller;

import com.campus.reviews.dto.*;
import com.campus.reviews.entity.ReviewStatus;
import com.campus.reviews.entity.TargetKind;
import com.campus.reviews.service.BulkModerationService;
import com.campus.reviews.service.ContentAnalysisService;
import com.campus.reviews.service.ModerationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/admin/moderation")
@RequiredArgsConstructor
public class ModerationController {

    private final ModerationService moderationService;
    private final BulkModerationService bulkModerationService;
    private final ContentAnalysisService contentAnalysisService;

    // Defaults to FLAGGED and UNDER_REVIEW, oldest change first
    @GetMapping("/queue")
    public Page<QueueItemDTO> queue(
            @RequestParam(required = false) ReviewStatus status,
            @RequestParam(required = false) TargetKind targetKind,
            @PageableDefault(sort = "updatedAt", direction = Sort.Direction.ASC) Pageable pageable
    ) {
        return moderationService.queue(status, targetKind, pageable);
    }

    @PostMapping("/reviews/{id}/actions")
    public ModerationActionDTO act(@PathVariable UUID id, @Valid @RequestBody ModerationActionRequest request,
                                   Authentication authentication) {
        return moderationService.moderate(id, request.action(), request.reason(), CurrentUser.id(authentication));
    }

    // 200 even when some reviews were rejected; see the per-review results
    @PostMapping("/bulk-actions")
    public BulkModerationResponse bulk(@Valid @RequestBody BulkModerationRequest request,
                                       Authentication authentication) {
        return bulkModerationService.moderateAll(request.reviewIds(), request.action(), request.reason(),
                CurrentUser.id(authentication));
    }

    @PostMapping("/analyze")
    public ContentAnalysisDTO analyze(@Valid @RequestBody ContentAnalysisRequest request) {
        return contentAnalysisService.analyze(request.text());
    }

    @GetMapping("/reviews/{id}/audit")
    public List<ModerationActionDTO> audit(@PathVariable UUID id) {
        return moderationService.auditLog(id);
    }

    @GetMapping("/reviews/{id}/attempts")
    public List<RejectedAttemptDTO> attempts(@PathVariable UUID id) {
        return moderationService.attempts(id);
    }

    @GetMapping("/scorer")
    public ScorerStatsDTO scorer() {
        return moderationService.scorerStats();
    }
}
