package com.propertyintel.listing.currency;

import com.fasterxml.jackson.databind.JsonNode;
import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.model.Currency;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.EnumMap;
import java.util.Map;

/**
 * Reads official daily rates from the National Bank of Georgia feed:
 * {@code [{"date": "...", "currencies": [{"code": "USD", "quantity": 1, "rate": 2.7125}, ...]}]}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NbgExchangeRateSource implements ExchangeRateSource {

    private final RestTemplate restTemplate;
    private final ListingScraperProperties properties;

    @Override
    public Map<Currency, BigDecimal> gelRates() {
        String url = properties.getRates().getLiveUrl();
        log.debug("Fetching exchange rates from {}", url);
        JsonNode root = restTemplate.getForObject(url, JsonNode.class);

        JsonNode day = root != null && root.isArray() ? root.path(0) : root;
        JsonNode currencies = day == null ? null : day.path("currencies");
        if (currencies == null || !currencies.isArray() || currencies.isEmpty()) {
            throw new IllegalStateException("Exchange rate feed returned no currencies");
        }

        Map<Currency, BigDecimal> rates = new EnumMap<>(Currency.class);
        for (JsonNode node : currencies) {
            Currency currency = parseCurrency(node.path("code").asText(null));
            if (currency == null || !node.hasNonNull("rate")) {
                continue;
            }
            BigDecimal rate = node.get("rate").decimalValue();
            int quantity = Math.max(1, node.path("quantity").asInt(1));
            rates.put(currency, rate.divide(BigDecimal.valueOf(quantity), MathContext.DECIMAL64));
        }
        rates.put(Currency.GEL, BigDecimal.ONE);
        log.info("Loaded {} exchange rates from NBG", rates.size() - 1);
        return rates;
    }

    private Currency parseCurrency(String code) {
        if (code == null) {
            return null;
        }
        try {
            return Currency.valueOf(code.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
