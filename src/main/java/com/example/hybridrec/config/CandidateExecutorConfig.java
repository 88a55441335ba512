package com.example.hybridrec.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 候选召回线程池 - 三路召回并行执行
 */
@Configuration
public class CandidateExecutorConfig {

    @Bean(name = "candidateSourceExecutor")
    public ThreadPoolTaskExecutor candidateSourceExecutor(RecommendationProperties properties) {
        int poolSize = properties.getCandidate().getExecutorPoolSize();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize * 2);
        executor.setQueueCapacity(256);
        executor.setThreadNamePrefix("candidate-source-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
