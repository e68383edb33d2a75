package com.propertyintel.listing.model;

/**
 * A source parameter attached to a listing, e.g. {@code (5, "balcony", "2")}.
 */
public record ListingParameter(int parameterId, String key, String value) {
}
