package com.propertyintel.listing.exception;

/**
 * An insert lost a race on the (external_id, source) unique key to another writer.
 */
public class PersistenceConflictException extends RuntimeException {

    private final String externalId;

    public PersistenceConflictException(String externalId, String source, Throwable cause) {
        super("Listing " + externalId + " from " + source + " was inserted concurrently", cause);
        this.externalId = externalId;
    }

    public String getExternalId() {
        return externalId;
    }
}
