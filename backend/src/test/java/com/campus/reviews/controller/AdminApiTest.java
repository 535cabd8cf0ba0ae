package com.campus.reviews.controller;

import com.campus.reviews.IntegrationTestSupport;
import com.campus.reviews.entity.Role;
import com.campus.reviews.entity.User;
import com.campus.reviews.repository.UserRepository;
import com.campus.reviews.service.JwtService;
import com.campus.reviews.service.ReviewIngestionService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class AdminApiTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JwtService jwtService;

    @Autowired
    private ReviewIngestionService ingestionService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private PasswordEncoder passwordEncoder;

    private String admin(Long adminId) {
        return "Bearer " + jwtService.generateToken(adminId, "ADMIN");
    }

    private String user(Long userId) {
        return "Bearer " + jwtService.generateToken(userId, "USER");
    }

    private String elevate(Long adminId) throws Exception {
        String response = mvc.perform(post("/api/admin/elevate").header("Authorization", admin(adminId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.expiresAt").exists())
                .andReturn().getResponse().getContentAsString();
        JsonNode node = objectMapper.readTree(response);
        return node.get("elevatedToken").asText();
    }

    @Test
    void ordinaryUsersCannotReachAdminRoutes() throws Exception {
        Long userId = newUserId();
        mvc.perform(get("/api/admin/moderation/queue").header("Authorization", user(userId)))
                .andExpect(status().isForbidden());
        mvc.perform(post("/api/admin/elevate").header("Authorization", user(userId)))
                .andExpect(status().isForbidden());
    }

    @Test
    void authorLookupNeedsAnElevatedCredential() throws Exception {
        Long author = newUserId();
        Long adminId = newUserId();
        UUID id = ingestionService.submitReview(author, professorReview(newProfessor(), CLEAN_TEXT)).id();

        mvc.perform(get("/api/admin/reviews/{id}/author", id).header("Authorization", admin(adminId)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("elevation_required"));

        String elevated = elevate(adminId);
        mvc.perform(get("/api/admin/reviews/{id}/author", id)
                        .header("Authorization", admin(adminId))
                        .header(AdminAccessController.ELEVATED_HEADER, elevated))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authorId").value(author));
    }

    @Test
    void elevatedCredentialIsBoundToItsAdministrator() throws Exception {
        UUID id = ingestionService.submitReview(newUserId(), professorReview(newProfessor(), CLEAN_TEXT)).id();
        String elevated = elevate(newUserId());

        mvc.perform(get("/api/admin/reviews/{id}/author", id)
                        .header("Authorization", admin(newUserId()))
                        .header(AdminAccessController.ELEVATED_HEADER, elevated))
                .andExpect(status().isForbidden());
    }

    @Test
    void elevatedCredentialIsNotAnAccessToken() throws Exception {
        String elevated = elevate(newUserId());

        mvc.perform(get("/api/admin/moderation/queue").header("Authorization", "Bearer " + elevated))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void accessTokenIsNotAnElevatedCredential() throws Exception {
        Long adminId = newUserId();
        UUID id = ingestionService.submitReview(newUserId(), professorReview(newProfessor(), CLEAN_TEXT)).id();

        mvc.perform(get("/api/admin/reviews/{id}/author", id)
                        .header("Authorization", admin(adminId))
                        .header(AdminAccessController.ELEVATED_HEADER, jwtService.generateToken(adminId, "ADMIN")))
                .andExpect(status().isForbidden());
    }

    @Test
    void invalidModerationActionConflicts() throws Exception {
        UUID id = ingestionService.submitReview(newUserId(), professorReview(newProfessor(), CLEAN_TEXT)).id();

        mvc.perform(post("/api/admin/moderation/reviews/{id}/actions", id)
                        .header("Authorization", admin(newUserId()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"APPROVE\",\"reason\":\"fine\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("invalid_transition"))
                .andExpect(jsonPath("$.currentStatus").value("PUBLISHED"))
                .andExpect(jsonPath("$.attemptedAction").value("APPROVE"));

        mvc.perform(get("/api/admin/moderation/reviews/{id}/attempts", id).header("Authorization", admin(newUserId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));

        mvc.perform(get("/api/admin/moderation/reviews/{id}/audit", id).header("Authorization", admin(newUserId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].action").value("AUTO_CLEAR"));
    }

    @Test
    void scorerStatsAreAvailableToAdmins() throws Exception {
        mvc.perform(get("/api/admin/moderation/scorer").header("Authorization", admin(newUserId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.autoFlagThreshold").value(0.8))
                .andExpect(jsonPath("$.spamPatterns").value(11));
    }

    @Test
    void loginIssuesATokenCarryingTheRole() throws Exception {
        User u = new User();
        u.setEmail("mod-" + UUID.randomUUID() + "@campus.edu");
        u.setPasswordHash(passwordEncoder.encode("correct horse"));
        u.setRole(Role.ADMIN);
        u = userRepository.save(u);

        String response = mvc.perform(post("/api/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + u.getEmail() + "\",\"password\":\"correct horse\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("ADMIN"))
                .andReturn().getResponse().getContentAsString();

        String token = objectMapper.readTree(response).get("token").asText();
        mvc.perform(get("/api/admin/moderation/scorer").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk());

        mvc.perform(post("/api/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + u.getEmail() + "\",\"password\":\"wrong\"}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void failedLoginsShareOneErrorShape() throws Exception {
        User u = new User();
        u.setEmail("mod-" + UUID.randomUUID() + "@campus.edu");
        u.setPasswordHash(passwordEncoder.encode("correct horse"));
        u.setRole(Role.USER);
        userRepository.save(u);

        mvc.perform(post("/api/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + u.getEmail() + "\",\"password\":\"wrong\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("invalid_credentials"))
                .andExpect(jsonPath("$.message").value("Invalid credentials"));

        mvc.perform(post("/api/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"nobody-" + UUID.randomUUID() + "@campus.edu\",\"password\":\"x\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("invalid_credentials"));

        mvc.perform(post("/api/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"\",\"password\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.email").exists());
    }

    @Test
    void contentAnalysisScoresWithoutSubmitting() throws Exception {
        mvc.perform(post("/api/admin/moderation/analyze")
                        .header("Authorization", admin(newUserId()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"The labs were fine but the grading was shit.\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assessment.profanity").value(true))
                .andExpect(jsonPath("$.autoFlag").value(true))
                .andExpect(jsonPath("$.triggeredRules[0]").value("profanity"))
                .andExpect(jsonPath("$.autoFlagThreshold").value(0.8));

        mvc.perform(post("/api/admin/moderation/analyze")
                        .header("Authorization", admin(newUserId()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("text", CLEAN_TEXT))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.autoFlag").value(false))
                .andExpect(jsonPath("$.triggeredRules.length()").value(0));

        mvc.perform(post("/api/admin/moderation/analyze")
                        .header("Authorization", user(newUserId()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"anything\"}"))
                .andExpect(status().isForbidden());
    }

    @Test
    void bulkActionReportsEachReview() throws Exception {
        UUID flagged = ingestionService.submitReview(newUserId(),
                professorReview(newProfessor(), "The labs were fine but the grading was shit.")).id();
        UUID published = ingestionService.submitReview(newUserId(), professorReview(newProfessor(), CLEAN_TEXT)).id();

        String body = objectMapper.writeValueAsString(Map.of(
                "reviewIds", List.of(flagged, published),
                "action", "BEGIN_REVIEW",
                "reason", "weekly triage"));

        mvc.perform(post("/api/admin/moderation/bulk-actions")
                        .header("Authorization", admin(newUserId()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requested").value(2))
                .andExpect(jsonPath("$.applied").value(1))
                .andExpect(jsonPath("$.failed").value(1))
                .andExpect(jsonPath("$.results[0].currentStatus").value("UNDER_REVIEW"))
                .andExpect(jsonPath("$.results[0].action.action").value("BEGIN_REVIEW"))
                .andExpect(jsonPath("$.results[1].currentStatus").value("PUBLISHED"))
                .andExpect(jsonPath("$.results[1].error").exists());

        mvc.perform(post("/api/admin/moderation/bulk-actions")
                        .header("Authorization", admin(newUserId()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewIds\":[],\"action\":\"APPROVE\",\"reason\":\"x\"}"))
                .andExpect(status().isBadRequest());
    }
}
