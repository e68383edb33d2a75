package com.propertyintel.listing.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical, source-agnostic listing ready for deduplication and persistence.
 *
 *  - (externalId, source) identifies at most one stored property
 *  - text fields are keyed by language; missing languages are filled in later by enrichment
 *  - priceUsd is derived by the currency service and may stay null
 */
@Data
@Builder(toBuilder = true)
public class NormalizedListing {

    // ── Identity ────────────────────────────────────────────────────────────
    private String externalId;
    private String source;

    // ── Text ────────────────────────────────────────────────────────────────
    @Builder.Default
    private Map<Language, String> titles = new EnumMap<>(Language.class);

    @Builder.Default
    private Map<Language, String> descriptions = new EnumMap<>(Language.class);

    // ── Price ───────────────────────────────────────────────────────────────
    private BigDecimal price;
    private Currency currency;
    private BigDecimal priceUsd;

    // ── Classification ──────────────────────────────────────────────────────
    private PropertyType propertyType;
    private DealType dealType;
    private OwnerType ownerType;

    // ── Dimensions ──────────────────────────────────────────────────────────
    private BigDecimal area;
    private Integer rooms;
    private Integer bedrooms;
    private Integer bathrooms;
    private Integer floor;
    private Integer totalFloors;

    // ── Location ────────────────────────────────────────────────────────────
    private String address;
    private String city;
    private String district;
    private String urbanArea;
    private Double latitude;
    private Double longitude;

    // ── Children ────────────────────────────────────────────────────────────
    @Builder.Default
    private List<ListingImage> images = new ArrayList<>();

    @Builder.Default
    private List<ListingParameter> parameters = new ArrayList<>();

    @Builder.Default
    private List<String> amenities = new ArrayList<>();

    private LocalDateTime scrapedAt;

    public String title(Language language) {
        return titles.get(language);
    }

    public String description(Language language) {
        return descriptions.get(language);
    }
}
