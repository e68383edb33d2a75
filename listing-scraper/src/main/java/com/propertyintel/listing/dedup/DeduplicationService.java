package com.propertyintel.listing.dedup;

import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.exception.DedupAmbiguousException;
import com.propertyintel.listing.model.DedupDecision;
import com.propertyintel.listing.model.NormalizedListing;
import com.propertyintel.listing.model.OwnerType;
import com.propertyintel.listing.model.PersistedProperty;
import com.propertyintel.listing.persistence.PropertyRepository;
import com.propertyintel.listing.pipeline.RunContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads dedup candidates from the store and lets {@link DeduplicationEngine} decide.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeduplicationService implements ListingResolver {

    private final PropertyRepository repository;
    private final DeduplicationEngine engine;
    private final ListingScraperProperties properties;

    @Override
    public DedupDecision resolve(NormalizedListing listing, RunContext ctx) {
        if (ctx.hasSeen(listing.getExternalId())) {
            log.debug("Listing {} already processed in this run", listing.getExternalId());
            return DedupDecision.skip(DedupDecision.SkipReason.SEEN_IN_RUN);
        }

        Optional<PersistedProperty> exact = repository.findByExternalKey(listing.getExternalId(), listing.getSource());
        List<PersistedProperty> neighbours = exact.isPresent() || !properties.getFeatures().isDeduplication()
                ? List.of()
                : neighbours(listing);

        DedupDecision decision;
        try {
            decision = engine.decide(listing, exact, neighbours);
        } catch (DedupAmbiguousException e) {
            log.warn("{}; skipped for manual review", e.getMessage());
            return DedupDecision.skip(DedupDecision.SkipReason.AMBIGUOUS);
        }

        if (properties.getFeatures().isOwnerPriority() && ownerPriorityDecided(listing, decision, neighbours)) {
            ctx.ownerPrioritized();
        }
        log.debug("Listing {} resolved as {}", listing.getExternalId(), decision);
        return decision;
    }

    private List<PersistedProperty> neighbours(NormalizedListing listing) {
        Map<Long, PersistedProperty> byId = new LinkedHashMap<>();
        if (listing.getAddress() != null) {
            repository.findInArea(listing.getSource(), listing.getCity(), listing.getDistrict()).forEach(p -> byId.putIfAbsent(p.getId(), p));
        }
        if (listing.getLatitude() != null && listing.getLongitude() != null) {
            repository.findNear(listing.getSource(), listing.getLatitude(), listing.getLongitude(), properties.getDedup().getCoordinatePrecision())
                    .forEach(p -> byId.putIfAbsent(p.getId(), p));
        }
        return new ArrayList<>(byId.values());
    }

    /**
     * True when owner type settled the outcome: a lower-priority record was dropped, or a
     * higher-priority record took over an existing row.
     */
    private boolean ownerPriorityDecided(NormalizedListing listing, DedupDecision decision, List<PersistedProperty> neighbours) {
        if (decision.isSkip()) {
            return decision.reason() == DedupDecision.SkipReason.LOWER_PRIORITY_DUPLICATE;
        }
        if (!decision.isUpdate() || neighbours.isEmpty()) {
            return false;
        }
        OwnerType incoming = listing.getOwnerType() == null ? OwnerType.UNKNOWN : listing.getOwnerType();
        return neighbours.stream()
                .filter(p -> p.getId().equals(decision.existingId()))
                .anyMatch(p -> p.getOwnerType() != null && p.getOwnerType().priority() < incoming.priority());
    }
}
