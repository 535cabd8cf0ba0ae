package com.campus.reviews;

import com.campus.reviews.config.ModerationProperties;
import com.campus.reviews.config.RateLimitProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import java.util.Locale;

@SpringBootApplication
@EnableConfigurationProperties({ModerationProperties.class, RateLimitProperties.class})
public class ReviewsApplication {

	public static void main(String[] args) {

        Locale.setDefault(Locale.US);

        SpringApplication.run(ReviewsApplication.class, args);
	}
}
