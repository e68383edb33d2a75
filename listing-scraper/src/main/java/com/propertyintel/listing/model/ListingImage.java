package com.propertyintel.listing.model;

/**
 * One image of a listing. {@code localPath} is set only when images are mirrored to the blob store.
 */
public record ListingImage(String url, int ordinal, boolean primary, String localPath) {

    public ListingImage(String url, int ordinal, boolean primary) {
        this(url, ordinal, primary, null);
    }

    public ListingImage withLocalPath(String path) {
        return new ListingImage(url, ordinal, primary, path);
    }
}
