package com.propertyintel.listing.model;

public enum DealType {
    SALE, RENT, LEASE, DAILY_RENT
}
