package com.propertyintel.listing.dedup;

import com.propertyintel.listing.model.DedupDecision;
import com.propertyintel.listing.model.NormalizedListing;
import com.propertyintel.listing.pipeline.RunContext;

/**
 * Decides how an incoming listing is written. Called inside the batch transaction, so lookups
 * see the rows written earlier in the same batch.
 */
@FunctionalInterface
public interface ListingResolver {

    DedupDecision resolve(NormalizedListing listing, RunContext ctx);
}
