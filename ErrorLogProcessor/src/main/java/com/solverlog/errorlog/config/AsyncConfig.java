package com.solverlog.errorlog.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for the aggregate reads and the detached cache population.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "aggregateQueryExecutor")
    public ThreadPoolTaskExecutor aggregateQueryExecutor(ErrorLogProperties properties) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(properties.getQuery().getThreads());
        ex.setMaxPoolSize(properties.getQuery().getThreads());
        ex.setThreadNamePrefix("aggregate-");
        ex.initialize();
        return ex;
    }

    @Bean(name = "cachePopulationExecutor")
    public ThreadPoolTaskExecutor cachePopulationExecutor(ErrorLogProperties properties) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(properties.getQuery().getCacheThreads());
        ex.setMaxPoolSize(properties.getQuery().getCacheThreads());
        ex.setThreadNamePrefix("cache-fill-");
        ex.initialize();
        return ex;
    }
}
