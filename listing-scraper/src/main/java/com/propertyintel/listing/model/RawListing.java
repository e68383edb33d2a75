package com.propertyintel.listing.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw DTO matching one statement of the myhome.ge statements API.
 * Kept separate from the domain model to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawListing {

    private String id;

    @JsonProperty("dynamic_title")
    private String dynamicTitle;

    private String title;

    /** Free-text description; the API calls it a comment. */
    private String comment;

    /** Keyed by the source currency code ("1", "2", "3"). */
    private Map<String, RawPrice> price = new LinkedHashMap<>();

    private Double lat;
    private Double lng;

    @JsonProperty("real_estate_type_id")
    private Integer realEstateTypeId;

    @JsonProperty("deal_type_id")
    private Integer dealTypeId;

    private String area;
    private String room;
    private String bedroom;
    private String bathroom;
    private String floor;

    @JsonProperty("total_floors")
    private String totalFloors;

    private String address;

    @JsonProperty("street_name")
    private String streetName;

    @JsonProperty("house_number")
    private String houseNumber;

    @JsonProperty("city_name")
    private String cityName;

    @JsonProperty("district_name")
    private String districtName;

    @JsonProperty("urban_name")
    private String urbanName;

    private List<RawImage> images = new ArrayList<>();

    private List<RawParameter> parameters = new ArrayList<>();

    private List<RawAmenity> amenities = new ArrayList<>();

    @JsonProperty("user_type")
    private UserType userType;

    @JsonProperty("user_title")
    private String userTitle;

    @JsonProperty("agency_name")
    private String agencyName;

    /** Language the text fields were served in; absent means the source default. */
    private String locale;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RawPrice {
        @JsonProperty("price_total")
        private BigDecimal priceTotal;

        @JsonProperty("price_square")
        private BigDecimal priceSquare;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RawImage {
        private String large;
        private String thumb;
        private String blur;

        @JsonProperty("is_main")
        private boolean main;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RawParameter {
        private Integer id;
        private String key;

        @JsonProperty("display_name")
        private String displayName;

        @JsonProperty("parameter_value")
        private String parameterValue;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RawAmenity {
        private Integer id;
        private String key;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UserType {
        private String type;
    }
}
