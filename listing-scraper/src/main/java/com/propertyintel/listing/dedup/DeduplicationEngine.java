package com.propertyintel.listing.dedup;

import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.exception.DedupAmbiguousException;
import com.propertyintel.listing.model.DedupDecision;
import com.propertyintel.listing.model.DedupTier;
import com.propertyintel.listing.model.NormalizedListing;
import com.propertyintel.listing.model.OwnerType;
import com.propertyintel.listing.model.PersistedProperty;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Three-tier duplicate matching over candidates the caller has already loaded.
 *
 * Tiers run in strict order and stop at the first one that matches:
 *  1. exact (external_id, source)
 *  2. same normalized address, city and district, with area and price within tolerance
 *  3. coordinates within {@code coordinate-precision}, with area and price within tolerance
 *
 * Among several tier 2/3 matches the stored row with the highest owner priority wins, then
 * the most recently scraped. The incoming record only overwrites a winner of equal or lower
 * priority. The same holds on tier 1: a row that absorbed a higher-priority duplicate is not
 * handed back to the lower-priority listing it was first stored under.
 */
@Component
@RequiredArgsConstructor
public class DeduplicationEngine {

    private static final Comparator<PersistedProperty> MOST_RECENT =
            Comparator.comparing(PersistedProperty::getLastScraped, Comparator.nullsFirst(Comparator.<LocalDateTime>naturalOrder()));

    private static final Comparator<PersistedProperty> BY_OWNER_PRIORITY =
            Comparator.comparingInt((PersistedProperty p) -> priority(p.getOwnerType())).thenComparing(MOST_RECENT);

    private final ListingScraperProperties properties;

    /**
     * @param candidate  the incoming listing
     * @param exactMatch the row stored under the same (external_id, source), if any
     * @param neighbours rows sharing the candidate's area or coordinates, for tiers 2 and 3
     * @throws DedupAmbiguousException when two best matches cannot be told apart
     */
    public DedupDecision decide(NormalizedListing candidate,
                                Optional<PersistedProperty> exactMatch,
                                List<PersistedProperty> neighbours) {
        if (exactMatch.isPresent()) {
            PersistedProperty stored = exactMatch.get();
            if (ownerPriorityApplies() && priority(stored.getOwnerType()) > priority(candidate.getOwnerType())) {
                return DedupDecision.skipExisting(stored.getId(), DedupDecision.SkipReason.LOWER_PRIORITY_DUPLICATE,
                        DedupTier.EXACT_KEY);
            }
            return DedupDecision.update(stored.getId(), DedupTier.EXACT_KEY);
        }
        if (!properties.getFeatures().isDeduplication()) {
            return DedupDecision.insert();
        }

        List<PersistedProperty> byAddress = neighbours.stream()
                .filter(p -> addressMatches(candidate, p) && measuresMatch(candidate, p))
                .toList();
        if (!byAddress.isEmpty()) {
            return choose(candidate, byAddress, DedupTier.FUZZY_ADDRESS);
        }

        List<PersistedProperty> byLocation = neighbours.stream()
                .filter(p -> coordinatesMatch(candidate, p) && measuresMatch(candidate, p))
                .toList();
        if (!byLocation.isEmpty()) {
            return choose(candidate, byLocation, DedupTier.GEO_PROXIMITY);
        }
        return DedupDecision.insert();
    }

    // ── Winner selection ─────────────────────────────────────────────────────

    private DedupDecision choose(NormalizedListing candidate, List<PersistedProperty> matches, DedupTier tier) {
        if (!properties.getFeatures().isOwnerPriority()) {
            PersistedProperty winner = matches.stream()
                    .max(MOST_RECENT.thenComparing(PersistedProperty::getId))
                    .orElseThrow();
            return DedupDecision.update(winner.getId(), tier);
        }

        List<PersistedProperty> ranked = matches.stream().sorted(BY_OWNER_PRIORITY.reversed()).toList();
        PersistedProperty winner = ranked.get(0);
        if (ranked.size() > 1 && BY_OWNER_PRIORITY.compare(winner, ranked.get(1)) == 0) {
            throw new DedupAmbiguousException(candidate.getExternalId(),
                    List.of(winner.getId(), ranked.get(1).getId()));
        }

        if (priority(winner.getOwnerType()) > priority(candidate.getOwnerType())) {
            return DedupDecision.skip(DedupDecision.SkipReason.LOWER_PRIORITY_DUPLICATE, tier);
        }
        return DedupDecision.update(winner.getId(), tier);
    }

    private boolean ownerPriorityApplies() {
        return properties.getFeatures().isDeduplication() && properties.getFeatures().isOwnerPriority();
    }

    private static int priority(OwnerType ownerType) {
        return ownerType == null ? OwnerType.UNKNOWN.priority() : ownerType.priority();
    }

    // ── Matching ─────────────────────────────────────────────────────────────

    private boolean addressMatches(NormalizedListing candidate, PersistedProperty existing) {
        String key = AddressNormalizer.normalize(candidate.getAddress());
        return !key.isEmpty()
                && key.equals(AddressNormalizer.normalize(existing.getAddress()))
                && sameText(candidate.getCity(), existing.getCity())
                && sameText(candidate.getDistrict(), existing.getDistrict());
    }

    private boolean coordinatesMatch(NormalizedListing candidate, PersistedProperty existing) {
        if (candidate.getLatitude() == null || candidate.getLongitude() == null
                || existing.getLatitude() == null || existing.getLongitude() == null) {
            return false;
        }
        double precision = properties.getDedup().getCoordinatePrecision();
        return Math.abs(candidate.getLatitude() - existing.getLatitude()) < precision
                && Math.abs(candidate.getLongitude() - existing.getLongitude()) < precision;
    }

    private boolean measuresMatch(NormalizedListing candidate, PersistedProperty existing) {
        ListingScraperProperties.Dedup dedup = properties.getDedup();
        if (!withinTolerance(candidate.getArea(), existing.getArea(), dedup.getAreaTolerance())) {
            return false;
        }
        if (candidate.getCurrency() != null && candidate.getCurrency() == existing.getCurrency()) {
            return withinTolerance(candidate.getPrice(), existing.getPrice(), dedup.getPriceTolerance());
        }
        return withinTolerance(candidate.getPriceUsd(), existing.getPriceUsd(), dedup.getPriceTolerance());
    }

    /**
     * |incoming - stored| <= tolerance * stored.
     */
    static boolean withinTolerance(BigDecimal incoming, BigDecimal stored, double tolerance) {
        if (incoming == null || stored == null || stored.signum() <= 0) {
            return false;
        }
        BigDecimal allowed = stored.multiply(BigDecimal.valueOf(tolerance), MathContext.DECIMAL64);
        return incoming.subtract(stored).abs().compareTo(allowed) <= 0;
    }

    private static boolean sameText(String a, String b) {
        if (a == null || b == null) {
            return Objects.equals(a, b);
        }
        return a.trim().equalsIgnoreCase(b.trim());
    }
}
