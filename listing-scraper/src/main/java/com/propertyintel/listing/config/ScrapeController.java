package com.propertyintel.listing.config;

import com.propertyintel.listing.enrichment.EnrichmentWorker;
import com.propertyintel.listing.model.RunReport;
import com.propertyintel.listing.pipeline.IngestionPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ScrapeController {

    private final IngestionPipeline pipeline;
    private final EnrichmentWorker enrichmentWorker;
    private final ListingScraperProperties properties;

    // ── Ingestion ─────────────────────────────────────────────────────────────

    @PostMapping("/scrape/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        if (pipeline.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("status", "already-running"));
        }
        new Thread(pipeline::run, "manual-ingestion").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "source", properties.getSource()));
    }

    @PostMapping("/scrape/cancel")
    public ResponseEntity<Map<String, String>> cancel() {
        if (!pipeline.cancel()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("status", "not-running"));
        }
        return ResponseEntity.accepted().body(Map.of("status", "cancelling"));
    }

    @GetMapping("/scrape/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "property-intel-listing-scraper");
        body.put("version", "1.0.0");
        body.put("dataSource", properties.getSource());
        body.put("running", pipeline.isRunning());
        pipeline.currentReport().ifPresent(r -> body.put("currentRun", summary(r)));
        return ResponseEntity.ok(body);
    }

    // ── Enrichment ────────────────────────────────────────────────────────────

    @PostMapping("/enrichment/trigger")
    public ResponseEntity<Map<String, String>> triggerEnrichment() {
        if (!properties.getEnrichment().isEnabled()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("status", "disabled"));
        }
        new Thread(() -> {
            try {
                enrichmentWorker.runCycle();
            } catch (Exception e) {
                log.error("Manual enrichment cycle failed: {}", e.getMessage(), e);
            }
        }, "manual-enrichment").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }

    private Map<String, Object> summary(RunReport r) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("runId", r.getRunId());
        summary.put("startedAt", r.getStartedAt());
        summary.put("pagesFetched", r.getPagesFetched());
        summary.put("totalFetched", r.getTotalFetched());
        summary.put("inserted", r.getInserted());
        summary.put("updated", r.getUpdated());
        summary.put("duplicatesSkipped", r.getDuplicatesSkipped());
        summary.put("errors", r.getErrors());
        return summary;
    }
}
