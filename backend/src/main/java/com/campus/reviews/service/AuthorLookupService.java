package com.campus.reviews.service;

import com.campus.reviews.dto.AuthorOfResponse;
import com.campus.reviews.dto.ElevationResponse;
import com.campus.reviews.exception.ElevationRequiredException;
import com.campus.reviews.exception.ReviewNotFoundException;
import com.campus.reviews.mapping.AuthorMapping;
import com.campus.reviews.mapping.AuthorMappingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Administrative de-anonymization. Each read needs an elevated credential that
 * was issued to the same administrator who presents it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthorLookupService {

    private final JwtService jwtService;
    private final AuthorMappingStore mappingStore;

    public ElevationResponse elevate(Long adminId) {
        JwtService.IssuedElevation issued = jwtService.generateElevatedToken(adminId);
        log.info("Elevated credential issued to admin {} until {}", adminId, issued.expiresAt());
        return new ElevationResponse(issued.token(), issued.expiresAt());
    }

    public AuthorOfResponse authorOf(UUID reviewId, ElevatedCredential credential, Long adminId) {
        Long issuedTo = jwtService.verifyElevated(credential)
                .orElseThrow(() -> new ElevationRequiredException("A valid elevated credential is required"));
        if (!issuedTo.equals(adminId)) {
            log.warn("Admin {} presented an elevated credential issued to admin {}", adminId, issuedTo);
            throw new ElevationRequiredException("Elevated credential was issued to another administrator");
        }

        AuthorMapping mapping = mappingStore.findByReviewId(reviewId)
                .orElseThrow(() -> new ReviewNotFoundException(reviewId));
        log.info("Author mapping of review {} read by admin {}", reviewId, adminId);
        return new AuthorOfResponse(reviewId, mapping.getAuthorId(), mapping.getCreatedAt());
    }
}
