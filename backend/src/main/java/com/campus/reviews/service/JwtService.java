package com.campus.reviews.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class JwtService {

    static final String ROLE_CLAIM = "role";
    static final String SCOPE_CLAIM = "scope";
    static final String ELEVATED_SCOPE = "author-mapping:read";

    @Value("${JWT_SECRET}")
    private String secretBase64;

    @Value("${JWT_EXP_MIN:60}")
    private long expMinutes;

    @Value("${app.security.elevated-ttl-minutes:5}")
    private long elevatedTtlMinutes;

    private SecretKey key;

    @PostConstruct
    void init() {
        byte[] bytes = Decoders.BASE64.decode(secretBase64);
        this.key = Keys.hmacShaKeyFor(bytes);
    }

    public String generateToken(Long userId, String role) {
        Instant now = Instant.now();
        Instant exp = now.plusSeconds(expMinutes * 60);
        return Jwts.builder()
                .setSubject(String.valueOf(userId))
                .addClaims(Map.of(ROLE_CLAIM, role))
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(exp))
                .signWith(key)
                .compact();
    }

    /** Issues an elevated credential bound to one administrator. */
    public IssuedElevation generateElevatedToken(Long adminId) {
        Instant now = Instant.now();
        Instant exp = now.plusSeconds(elevatedTtlMinutes * 60);
        String token = Jwts.builder()
                .setSubject(String.valueOf(adminId))
                .addClaims(Map.of(SCOPE_CLAIM, ELEVATED_SCOPE))
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(exp))
                .signWith(key)
                .compact();
        return new IssuedElevation(token, exp);
    }

    public record IssuedElevation(String token, Instant expiresAt) {}

    /**
     * Valid signed access token. Elevated credentials are not access tokens and
     * are refused here.
     */
    public boolean validate(String token) {
        return parse(token).map(c -> c.get(SCOPE_CLAIM) == null).orElse(false);
    }

    /** Returns the administrator the credential was issued to, if it is valid and elevated. */
    public Optional<Long> verifyElevated(ElevatedCredential credential) {
        if (credential == null) return Optional.empty();
        return parse(credential.token())
                .filter(c -> ELEVATED_SCOPE.equals(c.get(SCOPE_CLAIM)))
                .map(c -> Long.valueOf(c.getSubject()));
    }

    public String extractUserId(String token) {
        return getAllClaims(token).getSubject();
    }

    public String extractRole(String token) {
        Object r = getAllClaims(token).get(ROLE_CLAIM);
        return r == null ? null : r.toString();
    }

    private Optional<Claims> parse(String token) {
        try {
            return Optional.of(getAllClaims(token));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Claims getAllClaims(String token) {
        return Jwts.parserBuilder().setSigningKey(key).build()
                .parseClaimsJws(token).getBody();
    }
}
