package com.campus.reviews.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.moderation")
public class ModerationProperties {

    /** composite >= this value raises an auto flag */
    private double autoFlagThreshold = 0.8;

    /** accumulated user flags that move a review into the queue */
    private int userFlagThreshold = 3;

    /** auto flags that move a review into the queue */
    private int autoFlagCountThreshold = 1;

    /** identical moderator retries inside this window are replays, not new actions */
    private Duration idempotencyWindow = Duration.ofSeconds(30);

    private Scorer scorer = new Scorer();

    @Data
    public static class Scorer {

        private Duration timeout = Duration.ofSeconds(2);

        private double spamWeight = 1.0;
        private double negativityWeight = 0.5;
        private double profanityWeight = 0.5;

        /** spam likelihood that names spam as the triggering rule */
        private double spamRuleThreshold = 0.7;

        /** sentiment at or below this names negativity as the triggering rule */
        private double negativityRuleThreshold = -0.8;

        private String profanityList = "classpath:moderation/profanity.txt";
        private String sentimentLexicon = "classpath:moderation/sentiment-lexicon.txt";
    }
}
