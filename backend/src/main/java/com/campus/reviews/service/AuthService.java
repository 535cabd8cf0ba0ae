package com.campus.reviews.service;

import com.campus.reviews.dto.LoginRequest;
import com.campus.reviews.dto.LoginResponse;
import com.campus.reviews.entity.User;
import com.campus.reviews.exception.InvalidCredentialsException;
import com.campus.reviews.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;

    public LoginResponse login(LoginRequest request) {
        User user = userRepository.findByEmail(request.getEmail().trim())
                .filter(u -> passwordEncoder.matches(request.getPassword(), u.getPasswordHash()))
                .orElseThrow(InvalidCredentialsException::new);

        String token = jwtService.generateToken(user.getId(), user.getRole().name());
        log.info("User {} logged in as {}", user.getId(), user.getRole());
        return new LoginResponse(user.getId(), user.getRole().name(), token);
    }
}
