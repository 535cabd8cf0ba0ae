package com.campus.reviews.controller;

import com.campus.reviews.dto.RateLimitStatus;
import com.campus.reviews.ratelimit.ActionRateLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/limits")
@RequiredArgsConstructor
public class LimitsController {

    private final ActionRateLimiter rateLimiter;

    @GetMapping("/me")
    public List<RateLimitStatus> mine(Authentication authentication) {
        return rateLimiter.remaining(CurrentUser.id(authentication));
    }
}
