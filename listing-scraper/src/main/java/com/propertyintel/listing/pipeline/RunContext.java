package com.propertyintel.listing.pipeline;

import com.propertyintel.listing.model.DealType;
import com.propertyintel.listing.model.PropertyType;
import com.propertyintel.listing.model.RunReport;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable state of one ingestion run, handed to every stage and folded into a
 * {@link RunReport} at the end. Thread-safe: fetch and normalization stages update it
 * from pool threads.
 */
public class RunContext {

    private final String runId;
    private final String source;
    private final Clock clock;
    private final LocalDateTime startedAt;
    private final long startNanos;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private final AtomicInteger pagesFetched = new AtomicInteger();
    private final AtomicInteger pagesFailed = new AtomicInteger();
    private final AtomicInteger retries = new AtomicInteger();
    private final AtomicInteger apiCalls = new AtomicInteger();

    private final AtomicInteger totalFetched = new AtomicInteger();
    private final AtomicInteger valid = new AtomicInteger();
    private final AtomicInteger invalid = new AtomicInteger();
    private final AtomicInteger inserted = new AtomicInteger();
    private final AtomicInteger updated = new AtomicInteger();
    private final AtomicInteger duplicatesSkipped = new AtomicInteger();
    private final AtomicInteger ownerPrioritized = new AtomicInteger();
    private final AtomicInteger persistenceConflicts = new AtomicInteger();
    private final AtomicInteger conversionFallbacks = new AtomicInteger();
    private final AtomicInteger errors = new AtomicInteger();

    private final Map<String, AtomicInteger> excludedByReason = new ConcurrentHashMap<>();
    private final Map<PropertyType, AtomicInteger> propertyTypes = new ConcurrentHashMap<>();
    private final Map<DealType, AtomicInteger> dealTypes = new ConcurrentHashMap<>();

    private final Set<String> seenExternalIds = ConcurrentHashMap.newKeySet();

    public RunContext(String source, Clock clock) {
        this.runId = UUID.randomUUID().toString();
        this.source = source;
        this.clock = clock;
        this.startedAt = LocalDateTime.now(clock);
        this.startNanos = System.nanoTime();
    }

    public String getRunId() {
        return runId;
    }

    public String getSource() {
        return source;
    }

    // ── Cancellation ─────────────────────────────────────────────────────────

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    // ── Fetch counters ───────────────────────────────────────────────────────

    public void pageFetched() {
        pagesFetched.incrementAndGet();
    }

    public void pageFailed() {
        pagesFailed.incrementAndGet();
    }

    public void retryIssued() {
        retries.incrementAndGet();
    }

    public void apiCall() {
        apiCalls.incrementAndGet();
    }

    public void recordsFetched(int count) {
        totalFetched.addAndGet(count);
    }

    // ── Record outcomes ──────────────────────────────────────────────────────

    public void validRecord() {
        valid.incrementAndGet();
    }

    public void invalidRecord(String reason) {
        invalid.incrementAndGet();
        excluded(reason);
    }

    public void inserted(PropertyType propertyType, DealType dealType) {
        inserted.incrementAndGet();
        countTypes(propertyType, dealType);
    }

    public void updated(PropertyType propertyType, DealType dealType) {
        updated.incrementAndGet();
        countTypes(propertyType, dealType);
    }

    public void duplicateSkipped(String reason) {
        duplicatesSkipped.incrementAndGet();
        excluded(reason);
    }

    public void ownerPrioritized() {
        ownerPrioritized.incrementAndGet();
    }

    public void persistenceConflict() {
        persistenceConflicts.incrementAndGet();
    }

    public void conversionFallback() {
        conversionFallbacks.incrementAndGet();
    }

    public void error(String reason) {
        errors.incrementAndGet();
        excluded(reason);
    }

    public boolean hasSeen(String externalId) {
        return seenExternalIds.contains(externalId);
    }

    /**
     * Record that a listing was handled in this run.
     *
     * @return true the first time an external id is marked
     */
    public boolean markSeen(String externalId) {
        return seenExternalIds.add(externalId);
    }

    /** Undo {@link #markSeen} for a listing whose write was rolled back. */
    public void forgetSeen(String externalId) {
        seenExternalIds.remove(externalId);
    }

    public int getTotalFetched() {
        return totalFetched.get();
    }

    public int getValid() {
        return valid.get();
    }

    public int getInserted() {
        return inserted.get();
    }

    public int getUpdated() {
        return updated.get();
    }

    public int getDuplicatesSkipped() {
        return duplicatesSkipped.get();
    }

    public int getOwnerPrioritized() {
        return ownerPrioritized.get();
    }

    public int getErrors() {
        return errors.get();
    }

    public int getRetries() {
        return retries.get();
    }

    public int getPagesFailed() {
        return pagesFailed.get();
    }

    public int excludedCount(String reason) {
        AtomicInteger count = excludedByReason.get(reason);
        return count == null ? 0 : count.get();
    }

    // ── Report ───────────────────────────────────────────────────────────────

    public RunReport toReport(RunReport.Status status, String errorMessage) {
        return RunReport.builder()
                .runId(runId)
                .source(source)
                .status(status)
                .startedAt(startedAt)
                .completedAt(status == RunReport.Status.RUNNING ? null : LocalDateTime.now(clock))
                .elapsedMillis(Duration.ofNanos(System.nanoTime() - startNanos).toMillis())
                .pagesFetched(pagesFetched.get())
                .pagesFailed(pagesFailed.get())
                .retries(retries.get())
                .apiCalls(apiCalls.get())
                .totalFetched(totalFetched.get())
                .valid(valid.get())
                .invalid(invalid.get())
                .inserted(inserted.get())
                .updated(updated.get())
                .duplicatesSkipped(duplicatesSkipped.get())
                .ownerPrioritized(ownerPrioritized.get())
                .persistenceConflicts(persistenceConflicts.get())
                .conversionFallbacks(conversionFallbacks.get())
                .errors(errors.get())
                .excludedByReason(snapshot(excludedByReason))
                .propertyTypes(snapshot(propertyTypes))
                .dealTypes(snapshot(dealTypes))
                .errorMessage(errorMessage)
                .build();
    }

    private void excluded(String reason) {
        excludedByReason.computeIfAbsent(reason, k -> new AtomicInteger()).incrementAndGet();
    }

    private void countTypes(PropertyType propertyType, DealType dealType) {
        if (propertyType != null) {
            propertyTypes.computeIfAbsent(propertyType, k -> new AtomicInteger()).incrementAndGet();
        }
        if (dealType != null) {
            dealTypes.computeIfAbsent(dealType, k -> new AtomicInteger()).incrementAndGet();
        }
    }

    private static Map<String, Integer> snapshot(Map<?, AtomicInteger> counters) {
        Map<String, Integer> out = new TreeMap<>();
        counters.forEach((k, v) -> out.put(k.toString(), v.get()));
        return out;
    }
}
