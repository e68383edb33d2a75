package com.propertyintel.listing.model;

public enum Currency {
    GEL, USD, EUR
}
