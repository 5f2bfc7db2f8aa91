package com.inboxsync.config;

import com.inboxsync.ingestion.config.SyncJobProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pool for concurrent message fetch. The run itself stays on the caller's thread,
 * so persistence is never parallel.
 */
@Configuration
public class AsyncConfig {

    public static final String FETCH_EXECUTOR = "fetch-executor";

    @Bean(name = FETCH_EXECUTOR)
    public Executor fetchExecutor(SyncJobProperties jobProperties) {
        int threads = Math.max(1, jobProperties.getFetchParallelism());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(threads);
        e.setMaxPoolSize(threads);
        e.setThreadNamePrefix("fetch-");
        e.initialize();
        return e;
    }
}
