package com.propertyintel.listing.enrichment;

/**
 * Title and description of a listing in one language. Either part may be null.
 */
public record Translation(String title, String description) {

    public boolean isEmpty() {
        return title == null && description == null;
    }
}
