package com.propertyintel.listing.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class AppConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, ListingScraperProperties properties) {
        return builder
                .setConnectTimeout(properties.getApi().getConnectTimeout())
                .setReadTimeout(properties.getApi().getReadTimeout())
                .build();
    }

    /**
     * Replaces Boot's single-threaded default so a long ingestion run does not hold up enrichment polling.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler(ListingScraperProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getScheduling().getPoolSize());
        scheduler.setThreadNamePrefix("listing-scheduler-");
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
