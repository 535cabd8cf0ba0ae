package com.campus.reviews.controller;

import org.springframework.security.core.Authentication;

// JwtAuthFilter stores the user id as the principal name.
final class CurrentUser {

    private CurrentUser() {
    }

    static Long id(Authentication authentication) {
        return Long.valueOf(authentication.getName());
    }
}
