package com.ai.salon.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

/**
 * Worker pools and the shared outbound HTTP client.
 * Embedding work is CPU-bound and gets its own pool so it never queues behind
 * store and webhook calls.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "embeddingExecutor")
    public ThreadPoolTaskExecutor embeddingExecutor() {
        int cores = Runtime.getRuntime().availableProcessors();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, cores / 2));
        executor.setMaxPoolSize(Math.max(2, cores));
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("embed-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "ioExecutor")
    public ThreadPoolTaskExecutor ioExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("io-");
        executor.initialize();
        return executor;
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, NotificationProperties notificationProperties) {
        return builder
                .connectTimeout(notificationProperties.getTimeout())
                .readTimeout(notificationProperties.getTimeout())
                .build();
    }
}
