package com.propertyintel.listing.currency;

import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.exception.ConversionUnavailableException;
import com.propertyintel.listing.model.Currency;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CurrencyConversionServiceTest {

    @Mock
    private ExchangeRateSource rateSource;

    private ListingScraperProperties properties;
    private CurrencyConversionService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        properties = new ListingScraperProperties();
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);
        service = new CurrencyConversionService(rateSource, properties, clock);
    }

    @Test
    void shouldUseFallbackTable_WhenLiveSourceFails() {
        // Arrange
        when(rateSource.gelRates()).thenThrow(new IllegalStateException("feed down"));

        // Act
        CurrencyConversionService.Conversion conversion =
                service.convertDetailed(new BigDecimal("1000"), Currency.GEL, Currency.USD);

        // Assert
        assertEquals(new BigDecimal("369.00"), conversion.amount());
        assertTrue(conversion.fallback(), "Fallback table should be reported");
    }

    @Test
    void shouldNotRetryLiveSource_DuringFailureBackoff() {
        when(rateSource.gelRates()).thenThrow(new IllegalStateException("feed down"));

        service.convert(new BigDecimal("1000"), Currency.GEL, Currency.USD);
        service.convert(new BigDecimal("2000"), Currency.GEL, Currency.USD);

        verify(rateSource, times(1)).gelRates();
    }

    @Test
    void shouldUseLiveRates_AndCacheThem() {
        // Arrange
        when(rateSource.gelRates()).thenReturn(Map.of(
                Currency.GEL, BigDecimal.ONE,
                Currency.USD, new BigDecimal("2.50"),
                Currency.EUR, new BigDecimal("2.75")));

        // Act
        CurrencyConversionService.Conversion first =
                service.convertDetailed(new BigDecimal("1000"), Currency.GEL, Currency.USD);
        BigDecimal second = service.convert(new BigDecimal("100"), Currency.EUR, Currency.USD);

        // Assert
        assertEquals(new BigDecimal("400.00"), first.amount());
        assertFalse(first.fallback());
        assertEquals(new BigDecimal("110.00"), second);
        verify(rateSource, times(1)).gelRates();
    }

    @Test
    void shouldSkipLiveSource_WhenDisabled() {
        properties.getRates().setLiveEnabled(false);

        BigDecimal usd = service.convert(new BigDecimal("100"), Currency.USD, Currency.GEL);

        assertEquals(new BigDecimal("271.00"), usd);
        verifyNoInteractions(rateSource);
    }

    @Test
    void shouldReturnSameAmount_ForSameCurrency() {
        CurrencyConversionService.Conversion conversion =
                service.convertDetailed(new BigDecimal("1000"), Currency.GEL, Currency.GEL);

        assertEquals(new BigDecimal("1000.00"), conversion.amount());
        assertFalse(conversion.fallback());
        verifyNoInteractions(rateSource);
    }

    @Test
    void fallbackRate_UsesInverseAndGelPath() {
        properties.getRates().getFallback().clear();
        properties.getRates().getFallback().put("USD_GEL", new BigDecimal("2.50"));
        properties.getRates().getFallback().put("EUR_GEL", new BigDecimal("3.00"));

        BigDecimal gelToUsd = service.fallbackRate(Currency.GEL, Currency.USD).orElseThrow();
        BigDecimal eurToUsd = service.fallbackRate(Currency.EUR, Currency.USD).orElseThrow();

        assertEquals(0, new BigDecimal("0.4").compareTo(gelToUsd));
        assertEquals(0, new BigDecimal("1.2").compareTo(eurToUsd));
    }

    @Test
    void shouldThrow_WhenNoRateKnown() {
        properties.getRates().setLiveEnabled(false);
        properties.getRates().getFallback().clear();
        properties.getRates().getFallback().put("USD_GEL", new BigDecimal("2.71"));

        ConversionUnavailableException e = assertThrows(ConversionUnavailableException.class,
                () -> service.convert(new BigDecimal("100"), Currency.EUR, Currency.GEL));
        assertTrue(e.getMessage().contains("EUR"));
    }
}
