package com.propertyintel.listing.normalize;

import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.exception.ListingValidationException;
import com.propertyintel.listing.model.Currency;
import com.propertyintel.listing.model.DealType;
import com.propertyintel.listing.model.Language;
import com.propertyintel.listing.model.ListingImage;
import com.propertyintel.listing.model.ListingParameter;
import com.propertyintel.listing.model.NormalizedListing;
import com.propertyintel.listing.model.PropertyType;
import com.propertyintel.listing.model.RawListing;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps raw statements API records to the canonical {@link NormalizedListing}.
 * Anything that cannot be trusted is rejected with a {@link ListingValidationException}.
 */
@Component
@RequiredArgsConstructor
public class ListingNormalizer {

    private final ListingScraperProperties properties;
    private final OwnerClassifier ownerClassifier;
    private final Clock clock;

    /**
     * Convert a raw record to a validated listing.
     *
     * @param raw Raw DTO from the statements API
     * @throws ListingValidationException when a code is unmapped, a value is out of bounds or a
     *                                    required field is absent
     */
    public NormalizedListing normalize(RawListing raw) {
        String id = TextNormalizer.clean(raw.getId());
        if (id == null) {
            throw ListingValidationException.missing("<none>", "id");
        }

        PropertyType propertyType = mapPropertyType(id, raw.getRealEstateTypeId());
        DealType dealType = mapDealType(id, raw.getDealTypeId());
        SelectedPrice price = selectPrice(id, raw.getPrice());
        validatePrice(id, price);

        Double lat = raw.getLat();
        Double lng = raw.getLng();
        if (lat == null || lng == null) {
            throw ListingValidationException.missing(id, "coordinates");
        }
        validateCoordinates(id, lat, lng);

        BigDecimal area = TextNormalizer.parseDecimal(raw.getArea());
        if (area == null) {
            throw ListingValidationException.missing(id, "area");
        }
        if (area.signum() <= 0) {
            throw ListingValidationException.outOfBounds(id, "area " + area + " must be positive");
        }

        Integer rooms = nonNegative(id, "rooms", TextNormalizer.parseInt(raw.getRoom()));
        Integer bedrooms = nonNegative(id, "bedrooms", TextNormalizer.parseInt(raw.getBedroom()));
        Integer bathrooms = nonNegative(id, "bathrooms", TextNormalizer.parseInt(raw.getBathroom()));
        Integer floor = nonNegative(id, "floor", TextNormalizer.parseInt(raw.getFloor()));
        Integer totalFloors = nonNegative(id, "total floors", TextNormalizer.parseInt(raw.getTotalFloors()));
        if (floor != null && totalFloors != null && floor > totalFloors) {
            throw ListingValidationException.outOfBounds(id, "floor " + floor + " above total floors " + totalFloors);
        }

        Language language = Language.fromCode(raw.getLocale());
        Map<Language, String> titles = new EnumMap<>(Language.class);
        Map<Language, String> descriptions = new EnumMap<>(Language.class);
        String title = TextNormalizer.clean(StringUtils.hasText(raw.getDynamicTitle()) ? raw.getDynamicTitle() : raw.getTitle());
        String description = TextNormalizer.clean(raw.getComment());
        if (title != null) {
            titles.put(language, title);
        }
        if (description != null) {
            descriptions.put(language, description);
        }

        return NormalizedListing.builder()
                .externalId(id)
                .source(properties.getSource())
                .titles(titles)
                .descriptions(descriptions)
                .price(price.amount())
                .currency(price.currency())
                .priceUsd(price.usdAmount())
                .propertyType(propertyType)
                .dealType(dealType)
                .ownerType(ownerClassifier.classify(raw))
                .area(area)
                .rooms(rooms)
                .bedrooms(bedrooms)
                .bathrooms(bathrooms)
                .floor(floor)
                .totalFloors(totalFloors)
                .address(buildAddress(raw))
                .city(TextNormalizer.clean(raw.getCityName()))
                .district(TextNormalizer.clean(raw.getDistrictName()))
                .urbanArea(TextNormalizer.clean(raw.getUrbanName()))
                .latitude(lat)
                .longitude(lng)
                .images(mapImages(raw.getImages()))
                .parameters(mapParameters(raw.getParameters()))
                .amenities(mapAmenities(raw.getAmenities()))
                .scrapedAt(LocalDateTime.now(clock))
                .build();
    }

    // ── Codes ────────────────────────────────────────────────────────────────

    private PropertyType mapPropertyType(String id, Integer code) {
        if (code == null) {
            throw ListingValidationException.missing(id, "real estate type");
        }
        PropertyType type = properties.getMappings().getPropertyTypes().get(code);
        if (type == null) {
            throw ListingValidationException.unmappedCode(id, "real estate type", code);
        }
        return type;
    }

    private DealType mapDealType(String id, Integer code) {
        if (code == null) {
            throw ListingValidationException.missing(id, "deal type");
        }
        DealType type = properties.getMappings().getDealTypes().get(code);
        if (type == null) {
            throw ListingValidationException.unmappedCode(id, "deal type", code);
        }
        return type;
    }

    // ── Price ────────────────────────────────────────────────────────────────

    record SelectedPrice(BigDecimal amount, Currency currency, BigDecimal usdAmount) {
    }

    /**
     * Primary currency entry if present, else the first mapped entry by source code.
     * A USD entry seeds the USD amount directly.
     */
    private SelectedPrice selectPrice(String id, Map<String, RawListing.RawPrice> prices) {
        if (prices == null || prices.isEmpty()) {
            throw ListingValidationException.missing(id, "price");
        }
        Map<String, Currency> codes = properties.getMappings().getCurrencies();
        Map<Currency, BigDecimal> amounts = new EnumMap<>(Currency.class);
        String firstUnmapped = null;

        for (Map.Entry<String, RawListing.RawPrice> entry : new TreeMap<>(prices).entrySet()) {
            BigDecimal total = entry.getValue() == null ? null : entry.getValue().getPriceTotal();
            if (total == null || total.signum() <= 0) {
                continue;
            }
            Currency currency = codes.get(entry.getKey());
            if (currency == null) {
                if (firstUnmapped == null) {
                    firstUnmapped = entry.getKey();
                }
                continue;
            }
            amounts.putIfAbsent(currency, total);
        }

        if (amounts.isEmpty()) {
            if (firstUnmapped != null) {
                throw ListingValidationException.unmappedCode(id, "currency", firstUnmapped);
            }
            throw ListingValidationException.missing(id, "price");
        }

        Currency primary = properties.getMappings().getPrimaryCurrency();
        Currency chosen = amounts.containsKey(primary) ? primary : firstMapped(prices, codes, amounts);
        return new SelectedPrice(amounts.get(chosen), chosen, amounts.get(Currency.USD));
    }

    private Currency firstMapped(Map<String, RawListing.RawPrice> prices, Map<String, Currency> codes,
                                 Map<Currency, BigDecimal> amounts) {
        for (String code : new TreeMap<>(prices).keySet()) {
            Currency currency = codes.get(code);
            if (currency != null && amounts.containsKey(currency)) {
                return currency;
            }
        }
        return amounts.keySet().iterator().next();
    }

    private void validatePrice(String id, SelectedPrice price) {
        ListingScraperProperties.PriceBand band = properties.getValidation().getPriceRanges().get(price.currency());
        if (band != null && !band.contains(price.amount())) {
            throw ListingValidationException.outOfBounds(id,
                    "price " + price.amount() + " " + price.currency() + " outside [" + band.getMin() + ", " + band.getMax() + "]");
        }
    }

    // ── Location ─────────────────────────────────────────────────────────────

    private void validateCoordinates(String id, double lat, double lng) {
        ListingScraperProperties.Validation v = properties.getValidation();
        if (lat < v.getMinLatitude() || lat > v.getMaxLatitude()
                || lng < v.getMinLongitude() || lng > v.getMaxLongitude()) {
            throw ListingValidationException.outOfBounds(id, "coordinates (" + lat + ", " + lng + ") outside bounding box");
        }
    }

    private String buildAddress(RawListing raw) {
        String address = TextNormalizer.clean(raw.getAddress());
        if (address != null) {
            return address;
        }
        String street = TextNormalizer.clean(raw.getStreetName());
        String house = TextNormalizer.clean(raw.getHouseNumber());
        if (street == null) {
            return null;
        }
        return house == null ? street : street + " " + house;
    }

    private Integer nonNegative(String id, String field, Integer value) {
        if (value != null && value < 0) {
            throw ListingValidationException.outOfBounds(id, field + " " + value + " is negative");
        }
        return value;
    }

    // ── Children ─────────────────────────────────────────────────────────────

    private List<ListingImage> mapImages(List<RawListing.RawImage> raw) {
        if (raw == null || raw.isEmpty()) {
            return new ArrayList<>();
        }
        Set<String> seen = new LinkedHashSet<>();
        List<String> urls = new ArrayList<>();
        int mainIndex = -1;
        int limit = properties.getMedia().getMaxImagesPerListing();

        for (RawListing.RawImage image : raw) {
            String source = image == null ? null
                    : StringUtils.hasText(image.getLarge()) ? image.getLarge() : image.getThumb();
            if (!StringUtils.hasText(source)) {
                continue;
            }
            String url = source.replace("\\/", "/").trim();
            if (!seen.add(url) || urls.size() >= limit) {
                continue;
            }
            if (image.isMain() && mainIndex < 0) {
                mainIndex = urls.size();
            }
            urls.add(url);
        }

        int primary = mainIndex < 0 ? 0 : mainIndex;
        List<ListingImage> images = new ArrayList<>(urls.size());
        for (int i = 0; i < urls.size(); i++) {
            images.add(new ListingImage(urls.get(i), i, i == primary));
        }
        return images;
    }

    private List<ListingParameter> mapParameters(List<RawListing.RawParameter> raw) {
        List<ListingParameter> params = new ArrayList<>();
        if (raw == null) {
            return params;
        }
        Set<Integer> seen = new LinkedHashSet<>();
        for (RawListing.RawParameter p : raw) {
            if (p == null || p.getId() == null || !seen.add(p.getId())) {
                continue;
            }
            String key = StringUtils.hasText(p.getKey()) ? p.getKey().trim() : "param_" + p.getId();
            params.add(new ListingParameter(p.getId(), key, TextNormalizer.clean(p.getParameterValue())));
        }
        return params;
    }

    private List<String> mapAmenities(List<RawListing.RawAmenity> raw) {
        Set<String> keys = new LinkedHashSet<>();
        if (raw != null) {
            for (RawListing.RawAmenity a : raw) {
                if (a != null && StringUtils.hasText(a.getKey())) {
                    keys.add(a.getKey().trim());
                }
            }
        }
        return new ArrayList<>(keys);
    }
}
