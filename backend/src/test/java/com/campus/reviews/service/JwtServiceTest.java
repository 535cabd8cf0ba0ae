package com.campus.reviews.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JwtServiceTest {

    private static final String SECRET = "dGVzdC1zZWNyZXQtZm9yLWNhbXB1cy1yZXZpZXdzLWludGVncmF0aW9uLXRlc3Rz";

    private JwtService jwt;

    @BeforeEach
    void setUp() {
        jwt = new JwtService();
        ReflectionTestUtils.setField(jwt, "secretBase64", SECRET);
        ReflectionTestUtils.setField(jwt, "expMinutes", 60L);
        ReflectionTestUtils.setField(jwt, "elevatedTtlMinutes", 5L);
        jwt.init();
    }

    @Test
    void accessTokenCarriesUserAndRole() {
        String token = jwt.generateToken(42L, "ADMIN");

        assertTrue(jwt.validate(token));
        assertEquals("42", jwt.extractUserId(token));
        assertEquals("ADMIN", jwt.extractRole(token));
    }

    @Test
    void elevatedTokenNamesItsAdministrator() {
        JwtService.IssuedElevation issued = jwt.generateElevatedToken(7L);

        assertEquals(Optional.of(7L), jwt.verifyElevated(ElevatedCredential.of(issued.token())));
        assertFalse(jwt.validate(issued.token()));
    }

    @Test
    void accessTokenDoesNotElevate() {
        assertEquals(Optional.empty(), jwt.verifyElevated(ElevatedCredential.of(jwt.generateToken(7L, "ADMIN"))));
        assertEquals(Optional.empty(), jwt.verifyElevated(ElevatedCredential.of("  ")));
        assertEquals(Optional.empty(), jwt.verifyElevated(null));
    }

    @Test
    void expiredElevationIsRefused() {
        ReflectionTestUtils.setField(jwt, "elevatedTtlMinutes", -1L);
        String token = jwt.generateElevatedToken(7L).token();

        assertEquals(Optional.empty(), jwt.verifyElevated(ElevatedCredential.of(token)));
    }

    @Test
    void tamperedTokenIsRejected() {
        String token = jwt.generateToken(42L, "USER");
        String tampered = token.substring(0, token.length() - 2) + (token.endsWith("AA") ? "BB" : "AA");

        assertFalse(jwt.validate(tampered));
        assertFalse(jwt.validate("not-a-jwt"));
    }
}
