package com.propertyintel.listing.model;

/**
 * Matching strategies, in the order they are tried.
 */
public enum DedupTier {
    EXACT_KEY, FUZZY_ADDRESS, GEO_PROXIMITY
}
