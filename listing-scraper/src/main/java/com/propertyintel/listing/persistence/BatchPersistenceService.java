package com.propertyintel.listing.persistence;

import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.dedup.ListingResolver;
import com.propertyintel.listing.exception.PersistenceConflictException;
import com.propertyintel.listing.model.BatchResult;
import com.propertyintel.listing.model.DedupDecision;
import com.propertyintel.listing.model.DedupTier;
import com.propertyintel.listing.model.Language;
import com.propertyintel.listing.model.ListingImage;
import com.propertyintel.listing.model.NormalizedListing;
import com.propertyintel.listing.model.PersistedProperty;
import com.propertyintel.listing.model.ResolvedListing;
import com.propertyintel.listing.pipeline.RunContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Writes normalized listings in batches.
 *
 * Each batch is one transaction with a timeout. Each record runs in a nested transaction
 * (a savepoint), so a failing record is rolled back and counted while the rest of the batch
 * commits. Dedup resolution happens inside the batch, so later records see earlier writes.
 * An external id counts as seen in the run only once its record went through; a record that
 * failed leaves later copies of the same listing free to be written.
 */
@Service
@Slf4j
public class BatchPersistenceService {

    private final PropertyRepository propertyRepository;
    private final ListingChildRepository childRepository;
    private final ListingScraperProperties properties;
    private final Clock clock;
    private final TransactionTemplate batchTx;
    private final TransactionTemplate recordTx;

    private volatile Long systemUserId;

    public BatchPersistenceService(PropertyRepository propertyRepository,
                                   ListingChildRepository childRepository,
                                   ListingScraperProperties properties,
                                   PlatformTransactionManager transactionManager,
                                   Clock clock) {
        this.propertyRepository = propertyRepository;
        this.childRepository = childRepository;
        this.properties = properties;
        this.clock = clock;

        this.batchTx = new TransactionTemplate(transactionManager);
        this.batchTx.setTimeout((int) Math.max(1, properties.getPersistence().getBatchTimeout().toSeconds()));
        this.recordTx = new TransactionTemplate(transactionManager);
        this.recordTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    }

    /**
     * Look up or create the system account that owns scraped properties.
     *
     * @throws DataAccessException when the store is unreachable
     */
    public long ensureSystemUser() {
        Long id = systemUserId;
        if (id == null) {
            id = childRepository.ensureSystemUser(properties.getPersistence().getSystemUserEmail(), LocalDateTime.now(clock));
            systemUserId = id;
            log.info("System user {} has id {}", properties.getPersistence().getSystemUserEmail(), id);
        }
        return id;
    }

    /**
     * Resolve and write one batch. Never throws for per-record problems; they are counted.
     */
    public BatchResult upsertBatch(List<NormalizedListing> batch, ListingResolver resolver, RunContext ctx) {
        BatchResult result = new BatchResult();
        if (batch.isEmpty()) {
            return result;
        }
        long ownerId = ensureSystemUser();
        List<Consumer<RunContext>> pending = new ArrayList<>();
        List<String> seenHere = new ArrayList<>();

        try {
            batchTx.executeWithoutResult(status -> {
                for (NormalizedListing listing : batch) {
                    if (writeRecord(listing, resolver, ownerId, ctx, result, pending)
                            && ctx.markSeen(listing.getExternalId())) {
                        seenHere.add(listing.getExternalId());
                    }
                }
            });
        } catch (TransactionException | DataAccessException e) {
            log.error("Batch of {} listings rolled back: {}", batch.size(), e.getMessage(), e);
            seenHere.forEach(ctx::forgetSeen);
            BatchResult failed = new BatchResult();
            failed.setFailed(batch.size());
            batch.forEach(l -> ctx.error("BATCH_ROLLED_BACK"));
            return failed;
        }

        pending.forEach(update -> update.accept(ctx));
        log.info("Batch committed: {} inserted, {} updated, {} skipped, {} failed",
                result.getInserted(), result.getUpdated(), result.getSkipped(), result.getFailed());
        return result;
    }

    private record Outcome(DedupDecision decision, Long propertyId) {
    }

    /**
     * @return true when the record was resolved and written, or deliberately skipped
     */
    private boolean writeRecord(NormalizedListing listing, ListingResolver resolver, long ownerId, RunContext ctx,
                                BatchResult result, List<Consumer<RunContext>> pending) {
        try {
            Outcome outcome = recordTx.execute(status -> {
                DedupDecision d = resolver.resolve(listing, ctx);
                return new Outcome(d, write(new ResolvedListing(listing, d), ownerId));
            });
            count(listing, Objects.requireNonNull(outcome), result, pending);
            return true;

        } catch (DuplicateKeyException e) {
            PersistenceConflictException conflict =
                    new PersistenceConflictException(listing.getExternalId(), listing.getSource(), e);
            log.warn("{}; retrying as update", conflict.getMessage());
            pending.add(RunContext::persistenceConflict);
            return retryAsUpdate(listing, ownerId, conflict, result, pending);

        } catch (RuntimeException e) {
            log.error("Failed to persist listing {}: {}", listing.getExternalId(), e.getMessage(), e);
            result.setFailed(result.getFailed() + 1);
            pending.add(c -> c.error("PERSISTENCE_ERROR"));
            return false;
        }
    }

    private boolean retryAsUpdate(NormalizedListing listing, long ownerId, PersistenceConflictException conflict,
                                  BatchResult result, List<Consumer<RunContext>> pending) {
        try {
            Outcome outcome = recordTx.execute(status -> {
                PersistedProperty existing = propertyRepository
                        .findByExternalKey(listing.getExternalId(), listing.getSource())
                        .orElseThrow(() -> conflict);
                DedupDecision d = DedupDecision.update(existing.getId(), DedupTier.EXACT_KEY);
                return new Outcome(d, write(new ResolvedListing(listing, d), ownerId));
            });
            count(listing, Objects.requireNonNull(outcome), result, pending);
            return true;
        } catch (RuntimeException e) {
            log.error("Conflict retry failed for listing {}: {}", listing.getExternalId(), e.getMessage(), e);
            result.setFailed(result.getFailed() + 1);
            pending.add(c -> c.error("PERSISTENCE_CONFLICT"));
            return false;
        }
    }

    private void count(NormalizedListing listing, Outcome outcome, BatchResult result,
                       List<Consumer<RunContext>> pending) {
        DedupDecision decision = outcome.decision();
        if (outcome.propertyId() != null) {
            result.getWritten().add(new BatchResult.Written(outcome.propertyId(), listing.getExternalId(), listing.getImages()));
        }
        switch (decision.action()) {
            case INSERT -> {
                result.setInserted(result.getInserted() + 1);
                pending.add(c -> c.inserted(listing.getPropertyType(), listing.getDealType()));
            }
            case UPDATE -> {
                result.setUpdated(result.getUpdated() + 1);
                pending.add(c -> c.updated(listing.getPropertyType(), listing.getDealType()));
            }
            case SKIP -> {
                result.setSkipped(result.getSkipped() + 1);
                pending.add(c -> c.duplicateSkipped(decision.reason().name()));
            }
        }
    }

    // ── Single record ────────────────────────────────────────────────────────

    /**
     * Apply one resolved listing: insert or update the property, then merge its children.
     *
     * @return id of the written property, or null when the decision was a skip
     */
    public Long write(ResolvedListing resolved, long ownerId) {
        NormalizedListing listing = resolved.listing();
        DedupDecision decision = resolved.decision();
        LocalDateTime now = LocalDateTime.now(clock);

        long propertyId;
        switch (decision.action()) {
            case SKIP -> {
                log.debug("Skipping listing {}: {}", listing.getExternalId(), decision);
                if (decision.existingId() != null) {
                    propertyRepository.touch(decision.existingId(), now);
                }
                return null;
            }
            case INSERT -> propertyId = propertyRepository.insert(listing, ownerId, now);
            default -> {
                propertyId = decision.existingId();
                PersistedProperty existing = propertyRepository.findById(propertyId)
                        .orElseThrow(() -> new IllegalStateException("Property " + decision.existingId() + " vanished"));
                updateProperty(existing, listing, now);
            }
        }

        childRepository.replaceImages(propertyId, listing.getImages());
        childRepository.upsertParameters(propertyId, listing.getParameters(), now);
        childRepository.upsertAmenities(propertyId, listing.getAmenities());
        recordPriceIfChanged(propertyId, listing, now);
        return propertyId;
    }

    private void updateProperty(PersistedProperty existing, NormalizedListing listing, LocalDateTime now) {
        boolean textChanged = textChanged(existing.getTitles(), listing.getTitles())
                || textChanged(existing.getDescriptions(), listing.getDescriptions());
        propertyRepository.update(existing.getId(), listing, textChanged, now);
        if (textChanged) {
            log.debug("Text of property {} changed; translations cleared", existing.getId());
        }
    }

    private void recordPriceIfChanged(long propertyId, NormalizedListing listing, LocalDateTime now) {
        if (listing.getPrice() == null || listing.getCurrency() == null) {
            return;
        }
        boolean changed = childRepository.currentPrice(propertyId)
                .map(p -> p.currency() != listing.getCurrency() || p.price().compareTo(listing.getPrice()) != 0)
                .orElse(true);
        if (changed) {
            childRepository.appendPrice(propertyId, listing.getPrice(), listing.getCurrency(), listing.getPriceUsd(), now);
        }
    }

    private static boolean textChanged(Map<Language, String> stored, Map<Language, String> incoming) {
        return incoming.entrySet().stream()
                .anyMatch(e -> !Objects.equals(stored.get(e.getKey()), e.getValue()));
    }

    // ── Images ───────────────────────────────────────────────────────────────

    /**
     * Record mirrored copies of a written property's images. Runs outside any batch transaction.
     */
    public void recordImageLocations(long propertyId, List<ListingImage> images) {
        int updated = childRepository.updateImageLocations(propertyId, images);
        log.debug("Recorded {} mirrored images for property {}", updated, propertyId);
    }
}
