package com.propertyintel.listing.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Envelope of the statement detail endpoint:
 * {@code {"result": true, "data": {"statement": {...}}}}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SourceDetailResponse {

    private boolean result;

    private Payload data;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Payload {
        private RawListing statement;
    }

    public RawListing statement() {
        return data == null ? null : data.getStatement();
    }
}
