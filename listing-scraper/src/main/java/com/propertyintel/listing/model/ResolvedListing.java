package com.propertyintel.listing.model;

/**
 * A normalized listing paired with the dedup decision that says how to write it.
 */
public record ResolvedListing(NormalizedListing listing, DedupDecision decision) {
}
