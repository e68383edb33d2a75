package com.propertyintel.listing.currency;

import com.propertyintel.listing.model.Currency;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A live provider of exchange rates.
 */
public interface ExchangeRateSource {

    /**
     * Current rates expressed as units of GEL bought by one unit of each currency.
     * GEL itself may be omitted.
     *
     * @throws RuntimeException when the provider cannot be reached or returns nothing usable
     */
    Map<Currency, BigDecimal> gelRates();
}
