package com.propertyintel.listing.fetch;

/**
 * Position in the paged statements listing. Pages are 1-based.
 */
public record PageCursor(int page, int pageSize) {

    public static PageCursor first(int pageSize) {
        return new PageCursor(1, pageSize);
    }

    public PageCursor next() {
        return new PageCursor(page + 1, pageSize);
    }
}
