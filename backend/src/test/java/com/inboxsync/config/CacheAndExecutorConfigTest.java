package com.inboxsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxsync.ingestion.auth.AccessTokenProvider;
import com.inboxsync.ingestion.auth.GoogleAccessTokenProvider;
import com.inboxsync.ingestion.config.GoogleApiProperties;
import com.inboxsync.ingestion.config.SyncJobProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        SchedulerConfig.class,
        GoogleAccessTokenProvider.class,
        CacheAndExecutorConfigTest.TestBeans.class
}, properties = {
        "inboxsync.job.fetch-parallelism=3",
        "inboxsync.google.client-id=client",
        "inboxsync.google.client-secret=secret",
        "inboxsync.google.refresh-token=refresh"
})
class CacheAndExecutorConfigTest {

    static final AtomicInteger TOKEN_REQUESTS = new AtomicInteger();

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.FETCH_EXECUTOR)
    Executor fetchExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Autowired
    AccessTokenProvider accessTokenProvider;

    @Test
    @DisplayName("access token cache is created and usable")
    void cacheCreated() {
        assertThat(cacheManager.getCache(CaffeineConfig.ACCESS_TOKEN_CACHE)).isNotNull();
    }

    @Test
    @DisplayName("fetch executor is sized from configuration")
    void fetchExecutorSized() {
        assertThat(fetchExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) fetchExecutor;
        assertThat(executor.getCorePoolSize()).isEqualTo(3);
        assertThat(executor.getMaxPoolSize()).isEqualTo(3);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("fetch-");
        assertThat(schedulerPool.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("refreshed access token is served from cache")
    void accessTokenCached() {
        int before = TOKEN_REQUESTS.get();

        String first = accessTokenProvider.accessToken();
        String second = accessTokenProvider.accessToken();

        assertThat(first).isEqualTo("cached-token").isEqualTo(second);
        assertThat(TOKEN_REQUESTS.get() - before).isLessThanOrEqualTo(1);
        assertThat(cacheManager.getCache(CaffeineConfig.ACCESS_TOKEN_CACHE).get("google")).isNotNull();
    }

    @Configuration
    @EnableConfigurationProperties({ SyncJobProperties.class, GoogleApiProperties.class })
    static class TestBeans {

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }

        @Bean
        WebClient.Builder webClientBuilder() {
            return WebClient.builder().exchangeFunction(request -> {
                TOKEN_REQUESTS.incrementAndGet();
                return Mono.just(ClientResponse.create(HttpStatus.OK)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body("{\"access_token\":\"cached-token\"}")
                        .build());
            });
        }
    }
}
