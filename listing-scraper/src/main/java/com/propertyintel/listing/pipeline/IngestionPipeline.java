package com.propertyintel.listing.pipeline;

import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.currency.CurrencyConversionService;
import com.propertyintel.listing.dedup.DeduplicationService;
import com.propertyintel.listing.exception.ConversionUnavailableException;
import com.propertyintel.listing.exception.ListingValidationException;
import com.propertyintel.listing.fetch.ListingPage;
import com.propertyintel.listing.fetch.ListingSourceClient;
import com.propertyintel.listing.fetch.PageCursor;
import com.propertyintel.listing.media.ImageMirror;
import com.propertyintel.listing.model.BatchResult;
import com.propertyintel.listing.model.Currency;
import com.propertyintel.listing.model.NormalizedListing;
import com.propertyintel.listing.model.RawListing;
import com.propertyintel.listing.model.RunReport;
import com.propertyintel.listing.normalize.ListingNormalizer;
import com.propertyintel.listing.persistence.BatchPersistenceService;
import com.propertyintel.listing.report.ReportRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestrates one ingestion run: fetch, normalize, convert, deduplicate and persist.
 *
 * Pages are fetched in waves of {@code fetch.concurrency} pages on a bounded pool, every call
 * going through the shared rate limiter. Records are normalized on the same pool and written
 * in serial batches. Images are mirrored after a batch commits, and only for listings that
 * were inserted or updated. Cancellation is checked between waves and before every batch.
 * Only one run is active per process.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionPipeline {

    private final ListingSourceClient client;
    private final ListingNormalizer normalizer;
    private final CurrencyConversionService conversionService;
    private final ImageMirror imageMirror;
    private final DeduplicationService deduplicationService;
    private final BatchPersistenceService persistenceService;
    private final ReportRouter reportRouter;
    private final ListingScraperProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<RunContext> current = new AtomicReference<>();

    /**
     * Run a full ingestion cycle on the calling thread.
     *
     * @return the final report, or empty when another run is already in progress
     */
    public Optional<RunReport> run() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Ingestion run already in progress; trigger ignored");
            return Optional.empty();
        }
        RunContext ctx = new RunContext(properties.getSource(), clock);
        current.set(ctx);
        log.info("Starting ingestion run {} for {}", ctx.getRunId(), ctx.getSource());
        reportRouter.started(ctx.toReport(RunReport.Status.RUNNING, null));

        RunReport.Status status = RunReport.Status.SUCCESS;
        String errorMessage = null;
        ExecutorService pool = Executors.newFixedThreadPool(properties.getFetch().getConcurrency());
        try {
            persistenceService.ensureSystemUser();
            ingest(ctx, pool);
            if (ctx.isCancelled()) {
                status = RunReport.Status.CANCELLED;
            }
        } catch (DataAccessException e) {
            log.error("Store unavailable, run {} failed: {}", ctx.getRunId(), e.getMessage(), e);
            status = RunReport.Status.FAILED;
            errorMessage = e.getMessage();
        } catch (RuntimeException e) {
            log.error("Ingestion run {} failed: {}", ctx.getRunId(), e.getMessage(), e);
            status = RunReport.Status.FAILED;
            errorMessage = e.getMessage();
        } finally {
            pool.shutdownNow();
        }

        RunReport report = ctx.toReport(status, errorMessage);
        reportRouter.publish(report);
        log.info("Run {} finished {}: fetched={}, valid={}, inserted={}, updated={}, skipped={}, errors={} in {} ms",
                report.getRunId(), report.getStatus(), report.getTotalFetched(), report.getValid(),
                report.getInserted(), report.getUpdated(), report.getDuplicatesSkipped(), report.getErrors(),
                report.getElapsedMillis());
        current.set(null);
        running.set(false);
        return Optional.of(report);
    }

    /**
     * Ask the active run to stop at the next batch boundary.
     *
     * @return false when nothing is running
     */
    public boolean cancel() {
        RunContext ctx = current.get();
        if (ctx == null) {
            return false;
        }
        log.info("Cancellation requested for run {}", ctx.getRunId());
        ctx.cancel();
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Live counters of the active run. */
    public Optional<RunReport> currentReport() {
        return Optional.ofNullable(current.get()).map(c -> c.toReport(RunReport.Status.RUNNING, null));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void ingest(RunContext ctx, ExecutorService pool) {
        ListingScraperProperties.Fetch fetch = properties.getFetch();
        int limit = fetch.getMaxRecordsPerRun();
        int batchSize = properties.getPersistence().getBatchSize();

        List<NormalizedListing> buffer = new ArrayList<>();
        PageCursor next = PageCursor.first(fetch.getPageSize());
        int accepted = 0;
        int consecutiveFailures = 0;

        while (next != null && accepted < limit && !ctx.isCancelled()) {
            List<CompletableFuture<ListingPage>> wave = new ArrayList<>();
            int pagesNeeded = (int) Math.ceil((limit - accepted) / (double) fetch.getPageSize());
            PageCursor cursor = next;
            for (int i = 0; i < Math.min(fetch.getConcurrency(), pagesNeeded); i++) {
                PageCursor c = cursor;
                wave.add(CompletableFuture.supplyAsync(() -> client.fetchPage(c, ctx), pool));
                cursor = cursor.next();
            }

            List<RawListing> raw = new ArrayList<>();
            next = cursor;
            for (CompletableFuture<ListingPage> future : wave) {
                ListingPage page = future.join();
                if (page.failed()) {
                    consecutiveFailures++;
                    if (consecutiveFailures >= fetch.getMaxConsecutiveFailedPages()) {
                        log.warn("{} consecutive pages failed; stopping fetch at page {}",
                                consecutiveFailures, page.cursor().page());
                        next = null;
                        break;
                    }
                    continue;
                }
                consecutiveFailures = 0;
                int take = Math.min(page.records().size(), limit - accepted - raw.size());
                raw.addAll(page.records().subList(0, Math.max(0, take)));
                if (page.nextCursor().isEmpty()) {
                    log.info("Reached last page {}", page.cursor().page());
                    next = null;
                    break;
                }
            }
            accepted += raw.size();

            buffer.addAll(prepare(raw, ctx, pool));
            while (buffer.size() >= batchSize && !ctx.isCancelled()) {
                List<NormalizedListing> batch = new ArrayList<>(buffer.subList(0, batchSize));
                buffer.subList(0, batchSize).clear();
                flush(batch, ctx, pool);
            }
        }

        if (!buffer.isEmpty() && !ctx.isCancelled()) {
            flush(buffer, ctx, pool);
        }
        if (ctx.isCancelled()) {
            log.info("Run {} cancelled; {} prepared listings not written", ctx.getRunId(), buffer.size());
        }
    }

    private void flush(List<NormalizedListing> batch, RunContext ctx, ExecutorService pool) {
        BatchResult result = persistenceService.upsertBatch(batch, deduplicationService, ctx);
        log.debug("Flushed batch of {} listings: {}", batch.size(), result);
        if (properties.getFeatures().isImageDownload()) {
            mirrorImages(result, pool);
        }
    }

    private void mirrorImages(BatchResult result, ExecutorService pool) {
        List<CompletableFuture<Void>> futures = result.getWritten().stream()
                .filter(w -> !w.images().isEmpty())
                .map(w -> CompletableFuture.runAsync(() -> mirrorImages(w), pool))
                .toList();
        futures.forEach(CompletableFuture::join);
    }

    private void mirrorImages(BatchResult.Written written) {
        try {
            persistenceService.recordImageLocations(written.propertyId(),
                    imageMirror.mirror(written.externalId(), written.images()));
        } catch (DataAccessException e) {
            log.warn("Could not record mirrored images of property {}: {}", written.propertyId(), e.getMessage());
        }
    }

    /**
     * Normalize and convert in parallel, keeping page order.
     */
    private List<NormalizedListing> prepare(List<RawListing> raw, RunContext ctx, ExecutorService pool) {
        List<CompletableFuture<Optional<NormalizedListing>>> futures = raw.stream()
                .map(r -> CompletableFuture.supplyAsync(() -> prepareOne(r, ctx), pool))
                .toList();
        List<NormalizedListing> prepared = new ArrayList<>(futures.size());
        futures.forEach(f -> f.join().ifPresent(prepared::add));
        return prepared;
    }

    private Optional<NormalizedListing> prepareOne(RawListing raw, RunContext ctx) {
        NormalizedListing listing;
        try {
            listing = normalizer.normalize(raw);
        } catch (ListingValidationException e) {
            log.debug("Excluded listing: {}", e.getMessage());
            ctx.invalidRecord(e.getReason().name());
            return Optional.empty();
        }
        ctx.validRecord();

        fillSecondaryPrice(listing, ctx);
        return Optional.of(listing);
    }

    private void fillSecondaryPrice(NormalizedListing listing, RunContext ctx) {
        Currency secondary = properties.getRates().getSecondaryCurrency();
        if (listing.getPriceUsd() != null || listing.getPrice() == null) {
            return;
        }
        try {
            CurrencyConversionService.Conversion conversion =
                    conversionService.convertDetailed(listing.getPrice(), listing.getCurrency(), secondary);
            listing.setPriceUsd(conversion.amount());
            if (conversion.fallback()) {
                ctx.conversionFallback();
            }
        } catch (ConversionUnavailableException e) {
            log.warn("Listing {} stored without {} price: {}", listing.getExternalId(), secondary, e.getMessage());
            ctx.conversionFallback();
        }
    }
}
