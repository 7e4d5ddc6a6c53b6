package com.daniel.feedarr.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestClient;

import com.daniel.feedarr.feed.FeedKind;
import com.daniel.feedarr.upstream.MediaServerClient;

@Configuration
public class FeedarrConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // One thread: timer ticks and the start-up refresh never run side by side.
    @Bean(name = "feedSyncTaskScheduler")
    public ThreadPoolTaskScheduler feedSyncTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("feed-sync-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    // One worker per feed kind so a cycle refreshes all kinds in parallel.
    @Bean(name = "feedRefreshExecutor")
    public ThreadPoolTaskExecutor feedRefreshExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(FeedKind.values().length);
        executor.setMaxPoolSize(FeedKind.values().length);
        executor.setThreadNamePrefix("feed-refresh-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(35);
        return executor;
    }

    // Every upstream call is bounded by the request timeout (30 s by default).
    @Bean
    public MediaServerClient mediaServerClient(RestClient.Builder restClientBuilder, FeedarrProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.effectiveRequestTimeout());
        requestFactory.setReadTimeout(properties.effectiveRequestTimeout());
        return new MediaServerClient(restClientBuilder.requestFactory(requestFactory), properties);
    }
}
