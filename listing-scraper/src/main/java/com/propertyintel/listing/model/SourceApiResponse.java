package com.propertyintel.listing.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Envelope of the statements list endpoint:
 * {@code {"result": true, "data": {"data": [...], "meta": {...}}}}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SourceApiResponse {

    private boolean result;

    private Payload data;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Payload {
        private List<RawListing> data = new ArrayList<>();
        private Meta meta;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Meta {
        @JsonProperty("current_page")
        private Integer currentPage;

        @JsonProperty("last_page")
        private Integer lastPage;

        private Integer total;
    }

    public List<RawListing> listings() {
        if (data == null || data.getData() == null) {
            return List.of();
        }
        return data.getData();
    }
}
