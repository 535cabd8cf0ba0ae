package com.campus.reviews.service;

/**
 * Short-lived token that unlocks author mapping reads. Always handed to the
 * service explicitly; never taken from the security context.
 */
public record ElevatedCredential(String token) {

    public static ElevatedCredential of(String token) {
        return token == null || token.isBlank() ? null : new ElevatedCredential(token.trim());
    }
}
