package com.propertyintel.listing.currency;

import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.exception.ConversionUnavailableException;
import com.propertyintel.listing.model.Currency;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Converts prices between currencies. Live rates are cached for {@code rates.ttl}; when the
 * live source is unavailable the static fallback table is used instead.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CurrencyConversionService {

    private static final int SCALE = 2;
    private static final Duration FAILURE_BACKOFF = Duration.ofMinutes(5);

    private final ExchangeRateSource rateSource;
    private final ListingScraperProperties properties;
    private final Clock clock;

    private volatile CachedRates cache;
    private volatile Instant liveFailedAt;

    /**
     * A converted amount and whether the fallback table produced it.
     */
    public record Conversion(BigDecimal amount, boolean fallback) {
    }

    private record CachedRates(Map<Currency, BigDecimal> gelRates, Instant fetchedAt) {
    }

    /**
     * @return {@code amount} in {@code to}, scale 2, rounded half-up
     * @throws ConversionUnavailableException when no rate for the pair is known
     */
    public BigDecimal convert(BigDecimal amount, Currency from, Currency to) {
        return convertDetailed(amount, from, to).amount();
    }

    public Conversion convertDetailed(BigDecimal amount, Currency from, Currency to) {
        if (from == to) {
            return new Conversion(amount.setScale(SCALE, RoundingMode.HALF_UP), false);
        }
        Optional<BigDecimal> live = liveRate(from, to);
        if (live.isPresent()) {
            return new Conversion(scale(amount.multiply(live.get())), false);
        }
        BigDecimal rate = fallbackRate(from, to)
                .orElseThrow(() -> new ConversionUnavailableException(from, to));
        log.debug("Using fallback rate {} for {} -> {}", rate, from, to);
        return new Conversion(scale(amount.multiply(rate)), true);
    }

    // ── Live rates ───────────────────────────────────────────────────────────

    private Optional<BigDecimal> liveRate(Currency from, Currency to) {
        if (!properties.getRates().isLiveEnabled()) {
            return Optional.empty();
        }
        Map<Currency, BigDecimal> rates = currentRates();
        if (rates == null) {
            return Optional.empty();
        }
        BigDecimal fromGel = rates.get(from);
        BigDecimal toGel = rates.get(to);
        if (fromGel == null || toGel == null || toGel.signum() == 0) {
            return Optional.empty();
        }
        return Optional.of(fromGel.divide(toGel, MathContext.DECIMAL64));
    }

    private synchronized Map<Currency, BigDecimal> currentRates() {
        Instant now = clock.instant();
        CachedRates cached = cache;
        if (cached != null && cached.fetchedAt().plus(properties.getRates().getTtl()).isAfter(now)) {
            return cached.gelRates();
        }
        if (liveFailedAt != null && liveFailedAt.plus(FAILURE_BACKOFF).isAfter(now)) {
            return cached == null ? null : cached.gelRates();
        }
        try {
            Map<Currency, BigDecimal> rates = rateSource.gelRates();
            cache = new CachedRates(Map.copyOf(rates), now);
            liveFailedAt = null;
            return cache.gelRates();
        } catch (RuntimeException e) {
            liveFailedAt = now;
            log.warn("Live exchange rates unavailable, using fallback table: {}", e.getMessage());
            return null;
        }
    }

    // ── Fallback table ───────────────────────────────────────────────────────

    /**
     * Direct pair, inverse pair, or a path through GEL.
     */
    Optional<BigDecimal> fallbackRate(Currency from, Currency to) {
        Optional<BigDecimal> direct = tableRate(from, to);
        if (direct.isPresent() || from == Currency.GEL || to == Currency.GEL) {
            return direct;
        }
        Optional<BigDecimal> toGel = tableRate(from, Currency.GEL);
        Optional<BigDecimal> fromGel = tableRate(Currency.GEL, to);
        if (toGel.isPresent() && fromGel.isPresent()) {
            return Optional.of(toGel.get().multiply(fromGel.get(), MathContext.DECIMAL64));
        }
        return Optional.empty();
    }

    private Optional<BigDecimal> tableRate(Currency from, Currency to) {
        Map<String, BigDecimal> table = properties.getRates().getFallback();
        BigDecimal direct = table.get(from + "_" + to);
        if (direct != null) {
            return Optional.of(direct);
        }
        BigDecimal inverse = table.get(to + "_" + from);
        if (inverse != null && inverse.signum() != 0) {
            return Optional.of(BigDecimal.ONE.divide(inverse, MathContext.DECIMAL64));
        }
        return Optional.empty();
    }

    private static BigDecimal scale(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }
}
