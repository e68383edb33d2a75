package com.propertyintel.listing.exception;

/**
 * The ingester changed a property after the enrichment worker read it. Not an error:
 * the record stays queued and is translated again from fresh text.
 */
public class EnrichmentConflictException extends RuntimeException {

    private final long propertyId;
    private final long expectedVersion;

    public EnrichmentConflictException(long propertyId, long expectedVersion) {
        super("Property " + propertyId + " changed since version " + expectedVersion + " was read");
        this.propertyId = propertyId;
        this.expectedVersion = expectedVersion;
    }

    public long getPropertyId() {
        return propertyId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
