package com.propertyintel.listing.exception;

/**
 * A raw listing that cannot be normalized. The record is excluded and counted under its reason.
 */
public class ListingValidationException extends RuntimeException {

    public enum Reason {
        /** A type, deal or currency code with no configured mapping. */
        UNMAPPED_CODE,
        /** Price, area, coordinates or floors outside the accepted range. */
        OUT_OF_BOUNDS,
        /** A field required for identity or validation is absent. */
        MISSING_FIELD
    }

    private final Reason reason;
    private final String externalId;

    public ListingValidationException(Reason reason, String externalId, String message) {
        super(message);
        this.reason = reason;
        this.externalId = externalId;
    }

    public Reason getReason() {
        return reason;
    }

    public String getExternalId() {
        return externalId;
    }

    public static ListingValidationException unmappedCode(String externalId, String field, Object code) {
        return new ListingValidationException(Reason.UNMAPPED_CODE, externalId,
                "Unmapped " + field + " code " + code + " for listing " + externalId);
    }

    public static ListingValidationException outOfBounds(String externalId, String detail) {
        return new ListingValidationException(Reason.OUT_OF_BOUNDS, externalId,
                "Listing " + externalId + " out of bounds: " + detail);
    }

    public static ListingValidationException missing(String externalId, String field) {
        return new ListingValidationException(Reason.MISSING_FIELD, externalId,
                "Listing " + externalId + " has no " + field);
    }
}
