package com.campus.reviews.controller;

import com.campus.reviews.config.LoginRateLimiter;
import com.campus.reviews.dto.LoginRequest;
import com.campus.reviews.dto.LoginResponse;
import com.campus.reviews.service.AuthService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;
    private final LoginRateLimiter limiter;

    @PostMapping("/login")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest request, HttpServletRequest http) {
        String key = http.getRemoteAddr();
        if (!limiter.allow(key)) {
            log.warn("Login throttled for {}", key);
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(Map.of("error", "rate_limited", "message", "Too many login attempts"));
        }

        LoginResponse resp = authService.login(request);
        return ResponseEntity.ok(resp);
    }
}
