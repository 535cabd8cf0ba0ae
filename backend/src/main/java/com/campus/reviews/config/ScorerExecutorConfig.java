package com.campus.reviews.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ScorerExecutorConfig {

    // Bounded: a saturated pool rejects, and rejection scores as worst case.
    @Bean(name = "riskScorerExecutor")
    public ThreadPoolTaskExecutor riskScorerExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(2);
        ex.setMaxPoolSize(8);
        ex.setQueueCapacity(200);
        ex.setKeepAliveSeconds(60);
        ex.setThreadNamePrefix("risk-scorer-");
        ex.setAwaitTerminationSeconds(5);
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.initialize();
        return ex;
    }
}
