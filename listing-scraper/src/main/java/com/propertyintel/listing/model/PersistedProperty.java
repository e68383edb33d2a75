package com.propertyintel.listing.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * A row of the properties table as the pipeline sees it.
 * Children (images, parameters, prices) are loaded separately when needed.
 */
@Data
@Builder(toBuilder = true)
public class PersistedProperty {

    private Long id;
    private String externalId;
    private String source;

    @Builder.Default
    private Map<Language, String> titles = new EnumMap<>(Language.class);

    @Builder.Default
    private Map<Language, String> descriptions = new EnumMap<>(Language.class);

    private BigDecimal price;
    private Currency currency;
    private BigDecimal priceUsd;

    private PropertyType propertyType;
    private DealType dealType;
    private OwnerType ownerType;

    private BigDecimal area;
    private Integer rooms;
    private Integer bedrooms;
    private Integer bathrooms;
    private Integer floor;
    private Integer totalFloors;

    private String address;
    private String city;
    private String district;
    private String urbanArea;
    private Double latitude;
    private Double longitude;

    private Long ownerId;

    /** Bumped by every ingester write; the enrichment worker writes back only against the version it read. */
    private long version;

    /** Null until the enrichment worker has written translations for the current text. */
    private LocalDateTime translatedAt;
    private LocalDateTime enrichmentLeaseUntil;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime lastScraped;
}
