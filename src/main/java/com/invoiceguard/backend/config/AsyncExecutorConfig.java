package com.invoiceguard.backend.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class AsyncExecutorConfig {

    @Bean(name = "forensicsTaskExecutor")
    public Executor forensicsTaskExecutor(ForensicsProperties properties) {
        log.info("[Forensics] {}", properties.getDescription());
        ForensicsProperties.Executor settings = properties.getExecutor();
        if (!settings.isParallel()) {
            return Runnable::run;
        }

        int poolSize = Math.max(1, settings.getPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize * 2);
        executor.setQueueCapacity(Math.max(0, settings.getQueueCapacity()));
        executor.setThreadNamePrefix("forensics-");
        executor.initialize();
        return executor;
    }
}
