package com.propertyintel.listing.model;

/**
 * Who published the listing. Ordered from highest to lowest dedup priority.
 */
public enum OwnerType {
    INDIVIDUAL(2), AGENCY(1), UNKNOWN(0);

    private final int priority;

    OwnerType(int priority) {
        this.priority = priority;
    }

    public int priority() {
        return priority;
    }
}
