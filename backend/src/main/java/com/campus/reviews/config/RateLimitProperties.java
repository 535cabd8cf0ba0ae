package com.campus.reviews.config;

import com.campus.reviews.ratelimit.ActionKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.rate-limits")
public class RateLimitProperties {

    private Policy reviewSubmit = new Policy(10, Duration.ofHours(24));
    private Policy flagSubmit = new Policy(20, Duration.ofHours(1));
    private Policy voteCast = new Policy(100, Duration.ofHours(1));

    public Policy policyFor(ActionKind kind) {
        return switch (kind) {
            case REVIEW_SUBMIT -> reviewSubmit;
            case FLAG_SUBMIT -> flagSubmit;
            case VOTE_CAST -> voteCast;
        };
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Policy {
        private int limit;
        private Duration window;
    }
}
