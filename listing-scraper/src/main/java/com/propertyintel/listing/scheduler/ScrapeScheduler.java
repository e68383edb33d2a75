package com.propertyintel.listing.scheduler;

import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.persistence.SchemaInitializer;
import com.propertyintel.listing.pipeline.IngestionPipeline;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup ingestion runs.
 *
 * Default schedule: every day at 02:00 UTC.
 * Override with the listing-scraper.scheduling.cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScrapeScheduler {

    private final IngestionPipeline pipeline;
    private final SchemaInitializer schemaInitializer;
    private final ListingScraperProperties properties;

    /**
     * On application startup:
     *  1. Always ensure the database schema exists
     *  2. Optionally run an ingestion if run-on-startup is set
     */
    @PostConstruct
    public void onStartup() {
        try {
            schemaInitializer.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise listing schema; runs will fail until the store is reachable: {}", e.getMessage());
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("run-on-startup=true, starting ingestion in the background");
            new Thread(pipeline::run, "startup-ingestion").start();
        } else {
            log.info("Scraper ready. Next scheduled run: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${listing-scraper.scheduling.cron:0 0 2 * * ?}", zone = "UTC")
    public void scheduledScrape() {
        log.info("Scheduled ingestion triggered");
        try {
            pipeline.run();
        } catch (Exception e) {
            log.error("Scheduled ingestion failed: {}", e.getMessage(), e);
        }
    }
}
