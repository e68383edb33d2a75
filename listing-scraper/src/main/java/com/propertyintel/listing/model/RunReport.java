package com.propertyintel.listing.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Summary of one ingestion run, stored in scrape_runs and exported for downstream tooling.
 */
@Data
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunReport {

    public enum Status {
        RUNNING, SUCCESS, CANCELLED, FAILED
    }

    private String runId;
    private String source;
    private Status status;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private long elapsedMillis;

    // ── Fetch ───────────────────────────────────────────────────────────────
    private int pagesFetched;
    private int pagesFailed;
    private int retries;
    private int apiCalls;

    // ── Records ─────────────────────────────────────────────────────────────
    private int totalFetched;
    private int valid;
    private int invalid;
    private int inserted;
    private int updated;
    private int duplicatesSkipped;
    private int ownerPrioritized;
    private int persistenceConflicts;
    private int conversionFallbacks;
    private int errors;

    /** Excluded and skipped records by reason, e.g. OUT_OF_BOUNDS=3, SEEN_IN_RUN=1. */
    private Map<String, Integer> excludedByReason;
    private Map<String, Integer> propertyTypes;
    private Map<String, Integer> dealTypes;

    private String errorMessage;    // null on success
}
