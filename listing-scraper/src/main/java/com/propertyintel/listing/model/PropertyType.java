package com.propertyintel.listing.model;

public enum PropertyType {
    APARTMENT, HOUSE, COMMERCIAL, COUNTRY_HOUSE, LAND_PLOT, HOTEL
}
