package com.propertyintel.listing.exception;

import com.propertyintel.listing.model.Currency;

/**
 * Neither the live rate source nor the fallback table knows the requested pair.
 */
public class ConversionUnavailableException extends RuntimeException {

    public ConversionUnavailableException(Currency from, Currency to) {
        super("No exchange rate available for " + from + " -> " + to);
    }
}
