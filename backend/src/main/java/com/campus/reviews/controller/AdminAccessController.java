package com.campus.reviews.controller;

import com.campus.reviews.dto.AuthorOfResponse;
import com.campus.reviews.dto.ElevationResponse;
import com.campus.reviews.service.AuthorLookupService;
import com.campus.reviews.service.ElevatedCredential;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminAccessController {

    static final String ELEVATED_HEADER = "X-Elevated-Token";

    private final AuthorLookupService authorLookupService;

    @PostMapping("/elevate")
    public ElevationResponse elevate(Authentication authentication) {
        return authorLookupService.elevate(CurrentUser.id(authentication));
    }

    @GetMapping("/reviews/{id}/author")
    public AuthorOfResponse authorOf(@PathVariable UUID id,
                                     @RequestHeader(value = ELEVATED_HEADER, required = false) String elevatedToken,
                                     Authentication authentication) {
        return authorLookupService.authorOf(id, ElevatedCredential.of(elevatedToken), CurrentUser.id(authentication));
    }
}
