package com.propertyintel.listing.fetch;

import com.propertyintel.listing.model.RawListing;

import java.util.List;
import java.util.Optional;

/**
 * One fetched page. A failed page carries no records but still points at the next cursor,
 * so the run skips it and carries on.
 */
public record ListingPage(PageCursor cursor, List<RawListing> records, Optional<PageCursor> nextCursor, boolean failed) {

    public static ListingPage of(PageCursor cursor, List<RawListing> records, PageCursor next) {
        return new ListingPage(cursor, List.copyOf(records), Optional.ofNullable(next), false);
    }

    public static ListingPage failed(PageCursor cursor) {
        return new ListingPage(cursor, List.of(), Optional.of(cursor.next()), true);
    }
}
