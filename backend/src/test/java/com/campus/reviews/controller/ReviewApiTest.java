package com.campus.reviews.controller;

import com.campus.reviews.IntegrationTestSupport;
import com.campus.reviews.entity.ReviewStatus;
import com.campus.reviews.moderation.AutoFlagRule;
import com.campus.reviews.service.FlaggingService;
import com.campus.reviews.service.JwtService;
import com.campus.reviews.service.ReviewIngestionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class ReviewApiTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JwtService jwtService;

    @Autowired
    private ReviewIngestionService ingestionService;

    @Autowired
    private FlaggingService flaggingService;

    private String bearer(Long userId) {
        return "Bearer " + jwtService.generateToken(userId, "USER");
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    @Test
    void submittingRequiresAToken() throws Exception {
        mvc.perform(post("/api/v1/reviews").contentType(MediaType.APPLICATION_JSON)
                        .content(json(professorReview(newProfessor(), CLEAN_TEXT))))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void submittedReviewCarriesNoAuthor() throws Exception {
        UUID professor = newProfessor();

        mvc.perform(post("/api/v1/reviews").header("Authorization", bearer(newUserId()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(professorReview(professor, CLEAN_TEXT))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PUBLISHED"))
                .andExpect(jsonPath("$.targetId").value(professor.toString()))
                .andExpect(jsonPath("$.authorId").doesNotExist())
                .andExpect(jsonPath("$.userId").doesNotExist());
    }

    @Test
    void publicReadsNeedNoToken() throws Exception {
        UUID professor = newProfessor();
        UUID id = ingestionService.submitReview(newUserId(), professorReview(professor, CLEAN_TEXT)).id();

        mvc.perform(get("/api/v1/reviews/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id.toString()));

        mvc.perform(get("/api/v1/reviews").param("targetKind", "PROFESSOR").param("targetId", professor.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[*].id", hasItem(id.toString())));
    }

    @Test
    void hiddenReviewIsNotFound() throws Exception {
        UUID id = ingestionService.submitReview(newUserId(),
                professorReview(newProfessor(), "The labs were fine but the grading was shit.")).id();

        mvc.perform(get("/api/v1/reviews/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void invalidSubmissionReturnsDetails() throws Exception {
        String body = json(Map.of(
                "targetId", newProfessor().toString(),
                "targetKind", "PROFESSOR",
                "ratings", Map.of("clarity", 9)));

        mvc.perform(post("/api/v1/reviews").header("Authorization", bearer(newUserId()))
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"))
                .andExpect(jsonPath("$.details.ratings").exists());
    }

    @Test
    void resubmittingLockedReviewConflicts() throws Exception {
        UUID professor = newProfessor();
        Long author = newUserId();
        UUID id = ingestionService.submitReview(author, professorReview(professor, CLEAN_TEXT)).id();
        flaggingService.autoFlag(id, AutoFlagRule.SPAM, "spam");

        mvc.perform(post("/api/v1/reviews").header("Authorization", bearer(author))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(professorReview(professor, "Good course overall"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("review_locked"))
                .andExpect(jsonPath("$.currentStatus").value(ReviewStatus.FLAGGED.name()));
    }

    @Test
    void flaggingTwiceReturnsTheSameFlag() throws Exception {
        UUID id = ingestionService.submitReview(newUserId(), professorReview(newProfessor(), CLEAN_TEXT)).id();
        String reporter = bearer(newUserId());
        String body = json(Map.of("reason", "SPAM", "description", "advert"));

        mvc.perform(post("/api/v1/reviews/{id}/flags", id).header("Authorization", reporter)
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.created").value(true));

        mvc.perform(post("/api/v1/reviews/{id}/flags", id).header("Authorization", reporter)
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(false));
    }

    @Test
    void votesSwitchButNeverDuplicate() throws Exception {
        UUID id = ingestionService.submitReview(newUserId(), professorReview(newProfessor(), CLEAN_TEXT)).id();
        String voter = bearer(newUserId());

        mvc.perform(post("/api/v1/reviews/{id}/votes", id).header("Authorization", voter)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"voteType\":\"HELPFUL\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed").value(true))
                .andExpect(jsonPath("$.helpfulCount").value(1));

        mvc.perform(post("/api/v1/reviews/{id}/votes", id).header("Authorization", voter)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"voteType\":\"HELPFUL\"}"))
                .andExpect(jsonPath("$.changed").value(false))
                .andExpect(jsonPath("$.helpfulCount").value(1));

        mvc.perform(post("/api/v1/reviews/{id}/votes", id).header("Authorization", voter)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"voteType\":\"NOT_HELPFUL\"}"))
                .andExpect(jsonPath("$.changed").value(true))
                .andExpect(jsonPath("$.helpfulCount").value(0))
                .andExpect(jsonPath("$.notHelpfulCount").value(1));
    }

    @Test
    void limitsReportEveryActionKind() throws Exception {
        mvc.perform(get("/api/v1/limits/me").header("Authorization", bearer(newUserId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3))
                .andExpect(jsonPath("$[0].currentCount").value(0));
    }
}
