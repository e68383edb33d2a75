package com.propertyintel.listing.dedup;

import com.propertyintel.listing.TestListings;
import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.exception.DedupAmbiguousException;
import com.propertyintel.listing.model.Currency;
import com.propertyintel.listing.model.DedupDecision;
import com.propertyintel.listing.model.DedupTier;
import com.propertyintel.listing.model.NormalizedListing;
import com.propertyintel.listing.model.OwnerType;
import com.propertyintel.listing.model.PersistedProperty;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DeduplicationEngineTest {

    private ListingScraperProperties properties;
    private DeduplicationEngine engine;

    @BeforeEach
    void setUp() {
        properties = new ListingScraperProperties();
        engine = new DeduplicationEngine(properties);
    }

    @Test
    void shouldUpdateByExactKey_EvenWhenFuzzyMatchesExist() {
        // Arrange
        NormalizedListing candidate = TestListings.listing("X1", "1000");
        PersistedProperty exact = stored(1L, "X1", OwnerType.UNKNOWN);
        PersistedProperty other = stored(2L, "X9", OwnerType.INDIVIDUAL);

        // Act
        DedupDecision decision = engine.decide(candidate, Optional.of(exact), List.of(other));

        // Assert
        assertEquals(DedupDecision.update(1L, DedupTier.EXACT_KEY), decision);
    }

    @Test
    void shouldSkipAndKeepRow_WhenExactKeyRowHoldsHigherPriorityOwner() {
        // Arrange
        NormalizedListing agency = TestListings.listing("A1", "1000");
        agency.setOwnerType(OwnerType.AGENCY);
        PersistedProperty mergedOwnerRow = stored(4L, "A1", OwnerType.INDIVIDUAL);

        // Act
        DedupDecision decision = engine.decide(agency, Optional.of(mergedOwnerRow), List.of());

        // Assert
        assertTrue(decision.isSkip(), "An agency copy must not overwrite owner data stored under its key");
        assertEquals(DedupDecision.SkipReason.LOWER_PRIORITY_DUPLICATE, decision.reason());
        assertEquals(4L, decision.existingId(), "The matched row is kept for a last_scraped refresh");
        assertEquals(DedupTier.EXACT_KEY, decision.tier());
    }

    @Test
    void shouldUpdateByExactKey_WhenOwnerPriorityDisabled() {
        properties.getFeatures().setOwnerPriority(false);
        NormalizedListing agency = TestListings.listing("A1", "1000");
        agency.setOwnerType(OwnerType.AGENCY);

        DedupDecision decision = engine.decide(agency, Optional.of(stored(4L, "A1", OwnerType.INDIVIDUAL)), List.of());

        assertEquals(DedupDecision.update(4L, DedupTier.EXACT_KEY), decision);
    }

    @Test
    void shouldMatchByAddress_WhenPunctuationAndSpacingDiffer() {
        // Arrange
        NormalizedListing candidate = TestListings.listing("X2", "1030");
        PersistedProperty existing = stored(7L, "X1", OwnerType.UNKNOWN);
        existing.setAddress("vaja pshavela  25");
        existing.setLatitude(41.8);

        // Act
        DedupDecision decision = engine.decide(candidate, Optional.empty(), List.of(existing));

        // Assert
        assertTrue(decision.isUpdate(), "1030 vs 1000 GEL is within 5% and should update");
        assertEquals(7L, decision.existingId());
        assertEquals(DedupTier.FUZZY_ADDRESS, decision.tier());
    }

    @Test
    void shouldInsert_WhenPriceOutsideTolerance() {
        NormalizedListing candidate = TestListings.listing("X2", "1100");
        PersistedProperty existing = stored(7L, "X1", OwnerType.UNKNOWN);

        DedupDecision decision = engine.decide(candidate, Optional.empty(), List.of(existing));

        assertTrue(decision.isInsert(), "10% price difference must not match");
    }

    @Test
    void shouldInsert_WhenAreaOutsideTolerance() {
        NormalizedListing candidate = TestListings.listing("X2", "1000");
        candidate.setArea(new BigDecimal("85"));
        PersistedProperty existing = stored(7L, "X1", OwnerType.UNKNOWN);

        assertTrue(engine.decide(candidate, Optional.empty(), List.of(existing)).isInsert());
    }

    @Test
    void shouldMatchByCoordinates_WhenAddressDiffers() {
        // Arrange
        NormalizedListing candidate = TestListings.listing("X3", "1000");
        PersistedProperty existing = stored(8L, "X1", OwnerType.UNKNOWN);
        existing.setAddress("Chavchavadze Ave 1");
        existing.setLatitude(41.71515);
        existing.setLongitude(44.82705);

        // Act
        DedupDecision decision = engine.decide(candidate, Optional.empty(), List.of(existing));

        // Assert
        assertEquals(DedupDecision.update(8L, DedupTier.GEO_PROXIMITY), decision);
    }

    @Test
    void shouldInsert_WhenCoordinatesTooFarApart() {
        NormalizedListing candidate = TestListings.listing("X3", "1000");
        PersistedProperty existing = stored(8L, "X1", OwnerType.UNKNOWN);
        existing.setAddress("Chavchavadze Ave 1");
        existing.setLatitude(41.7160);

        assertTrue(engine.decide(candidate, Optional.empty(), List.of(existing)).isInsert());
    }

    @Test
    void shouldComparePricesInUsd_WhenCurrenciesDiffer() {
        NormalizedListing candidate = TestListings.listing("X4", "1000");
        candidate.setCurrency(Currency.USD);
        candidate.setPrice(new BigDecimal("370"));
        candidate.setPriceUsd(new BigDecimal("370"));
        PersistedProperty existing = stored(9L, "X1", OwnerType.UNKNOWN);
        existing.setPriceUsd(new BigDecimal("369"));

        assertTrue(engine.decide(candidate, Optional.empty(), List.of(existing)).isUpdate());
    }

    @Test
    void shouldSkipAgencyRecord_WhenOwnerRecordStored() {
        // Arrange
        NormalizedListing agency = TestListings.listing("A1", "1000");
        agency.setOwnerType(OwnerType.AGENCY);
        PersistedProperty owner = stored(10L, "O1", OwnerType.INDIVIDUAL);

        // Act
        DedupDecision decision = engine.decide(agency, Optional.empty(), List.of(owner));

        // Assert
        assertTrue(decision.isSkip());
        assertEquals(DedupDecision.SkipReason.LOWER_PRIORITY_DUPLICATE, decision.reason());
    }

    @Test
    void shouldReplaceAgencyRecord_WhenOwnerRecordArrivesLater() {
        NormalizedListing owner = TestListings.listing("O1", "1000");
        owner.setOwnerType(OwnerType.INDIVIDUAL);
        PersistedProperty agency = stored(11L, "A1", OwnerType.AGENCY);

        DedupDecision decision = engine.decide(owner, Optional.empty(), List.of(agency));

        assertEquals(DedupDecision.update(11L, DedupTier.FUZZY_ADDRESS), decision);
    }

    @Test
    void shouldPreferHigherPriorityCandidate_AmongSeveralMatches() {
        NormalizedListing candidate = TestListings.listing("N1", "1000");
        candidate.setOwnerType(OwnerType.INDIVIDUAL);
        PersistedProperty agency = stored(20L, "A1", OwnerType.AGENCY);
        agency.setLastScraped(LocalDateTime.now());
        PersistedProperty owner = stored(21L, "O1", OwnerType.INDIVIDUAL);
        owner.setLastScraped(LocalDateTime.now().minusDays(3));

        DedupDecision decision = engine.decide(candidate, Optional.empty(), List.of(agency, owner));

        assertEquals(21L, decision.existingId());
    }

    @Test
    void shouldPreferMostRecentlyScraped_WhenPrioritiesEqual() {
        NormalizedListing candidate = TestListings.listing("N2", "1000");
        PersistedProperty older = stored(30L, "U1", OwnerType.UNKNOWN);
        older.setLastScraped(LocalDateTime.of(2024, 1, 1, 0, 0));
        PersistedProperty newer = stored(31L, "U2", OwnerType.UNKNOWN);
        newer.setLastScraped(LocalDateTime.of(2024, 2, 1, 0, 0));

        DedupDecision decision = engine.decide(candidate, Optional.empty(), List.of(older, newer));

        assertEquals(31L, decision.existingId());
    }

    @Test
    void shouldThrowAmbiguous_WhenBestMatchesTie() {
        // Arrange
        NormalizedListing candidate = TestListings.listing("N3", "1000");
        LocalDateTime scraped = LocalDateTime.of(2024, 1, 1, 0, 0);
        PersistedProperty first = stored(40L, "U1", OwnerType.UNKNOWN);
        first.setLastScraped(scraped);
        PersistedProperty second = stored(41L, "U2", OwnerType.UNKNOWN);
        second.setLastScraped(scraped);

        // Act & Assert
        DedupAmbiguousException e = assertThrows(DedupAmbiguousException.class,
                () -> engine.decide(candidate, Optional.empty(), List.of(first, second)));
        assertTrue(e.getCandidateIds().containsAll(List.of(40L, 41L)));
    }

    @Test
    void shouldInsert_WhenDeduplicationDisabled() {
        properties.getFeatures().setDeduplication(false);
        NormalizedListing candidate = TestListings.listing("X5", "1000");

        DedupDecision decision = engine.decide(candidate, Optional.empty(), List.of(stored(50L, "X1", OwnerType.UNKNOWN)));

        assertTrue(decision.isInsert());
    }

    @Test
    void shouldStillUpdateByExactKey_WhenDeduplicationDisabled() {
        properties.getFeatures().setDeduplication(false);
        NormalizedListing candidate = TestListings.listing("X1", "1000");

        DedupDecision decision = engine.decide(candidate, Optional.of(stored(51L, "X1", OwnerType.UNKNOWN)), List.of());

        assertEquals(DedupTier.EXACT_KEY, decision.tier());
    }

    @Test
    void shouldUpdateRegardlessOfOwner_WhenOwnerPriorityDisabled() {
        properties.getFeatures().setOwnerPriority(false);
        NormalizedListing agency = TestListings.listing("A2", "1000");
        agency.setOwnerType(OwnerType.AGENCY);
        PersistedProperty owner = stored(60L, "O1", OwnerType.INDIVIDUAL);

        DedupDecision decision = engine.decide(agency, Optional.empty(), List.of(owner));

        assertEquals(DedupDecision.update(60L, DedupTier.FUZZY_ADDRESS), decision);
    }

    @Test
    void withinTolerance_IsRelativeToStoredValue() {
        assertTrue(DeduplicationEngine.withinTolerance(new BigDecimal("1050"), new BigDecimal("1000"), 0.05));
        assertFalse(DeduplicationEngine.withinTolerance(new BigDecimal("1051"), new BigDecimal("1000"), 0.05));
        assertFalse(DeduplicationEngine.withinTolerance(null, new BigDecimal("1000"), 0.05));
    }

    private static PersistedProperty stored(long id, String externalId, OwnerType ownerType) {
        return PersistedProperty.builder()
                .id(id)
                .externalId(externalId)
                .source(TestListings.SOURCE)
                .price(new BigDecimal("1000"))
                .currency(Currency.GEL)
                .priceUsd(new BigDecimal("369.00"))
                .ownerType(ownerType)
                .area(new BigDecimal("80.0"))
                .address("Vaja-Pshavela 25")
                .city("Tbilisi")
                .district("Vake-Saburtalo")
                .latitude(41.7151)
                .longitude(44.8271)
                .lastScraped(LocalDateTime.of(2024, 1, 1, 0, 0).plusSeconds(id))
                .build();
    }
}
