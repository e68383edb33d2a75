package com.propertyintel.listing.scheduler;

import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.enrichment.EnrichmentWorker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polls for untranslated listings on its own fixed delay, independent of ingestion runs.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EnrichmentScheduler {

    private final EnrichmentWorker worker;
    private final ListingScraperProperties properties;

    @Scheduled(fixedDelayString = "${listing-scraper.enrichment.poll-interval:PT5M}",
            initialDelayString = "${listing-scraper.enrichment.poll-interval:PT5M}")
    public void poll() {
        if (!properties.getEnrichment().isEnabled()) {
            return;
        }
        try {
            worker.runCycle();
        } catch (Exception e) {
            log.error("Enrichment cycle failed: {}", e.getMessage(), e);
        }
    }
}
