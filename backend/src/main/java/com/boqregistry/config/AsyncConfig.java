package com.boqregistry.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. fallback-executor runs AI fallback calls of one batch concurrently (max 5 in flight).
 */
@Configuration
public class AsyncConfig {

    public static final String FALLBACK_EXECUTOR = "fallback-executor";

    @Bean(name = FALLBACK_EXECUTOR)
    public Executor fallbackExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(5);
        e.setMaxPoolSize(5);
        e.setThreadNamePrefix("ai-fallback-");
        e.initialize();
        return e;
    }
}
