package com.propertyintel.listing.normalize;

import com.propertyintel.listing.TestListings;
import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.exception.ListingValidationException;
import com.propertyintel.listing.model.Currency;
import com.propertyintel.listing.model.Language;
import com.propertyintel.listing.model.ListingImage;
import com.propertyintel.listing.model.NormalizedListing;
import com.propertyintel.listing.model.OwnerType;
import com.propertyintel.listing.model.PropertyType;
import com.propertyintel.listing.model.RawListing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ListingNormalizerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T09:30:00Z"), ZoneOffset.UTC);

    private ListingNormalizer normalizer;

    @BeforeEach
    void setUp() {
        ListingScraperProperties properties = new ListingScraperProperties();
        normalizer = new ListingNormalizer(properties, new OwnerClassifier(properties), CLOCK);
    }

    @Test
    void normalize_StampsScrapeTimeFromClock() {
        // Act
        NormalizedListing listing = normalizer.normalize(TestListings.raw("X1"));

        // Assert
        assertEquals(LocalDateTime.of(2026, 3, 1, 9, 30), listing.getScrapedAt(), "Scrape time comes from the injected clock");
    }

    @Test
    void normalize_MapsValidRecord() {
        // Act
        NormalizedListing listing = normalizer.normalize(TestListings.raw("X1"));

        // Assert
        assertEquals("X1", listing.getExternalId());
        assertEquals("myhome.ge", listing.getSource());
        assertEquals(PropertyType.APARTMENT, listing.getPropertyType());
        assertEquals(Currency.GEL, listing.getCurrency());
        assertEquals(0, new BigDecimal("1000").compareTo(listing.getPrice()));
        assertNull(listing.getPriceUsd(), "No USD entry means the USD price is derived later");
        assertEquals(0, new BigDecimal("80").compareTo(listing.getArea()));
        assertEquals(4, listing.getFloor());
        assertEquals("იყიდება 2 ოთახიანი ბინა", listing.title(Language.KA));
        assertNull(listing.title(Language.EN));
    }

    @Test
    void normalize_RejectsLatitudeOutsideBoundingBox() {
        // Arrange
        RawListing raw = TestListings.raw("X2");
        raw.setLat(0.0);

        // Act & Assert
        ListingValidationException e = assertThrows(ListingValidationException.class, () -> normalizer.normalize(raw));
        assertEquals(ListingValidationException.Reason.OUT_OF_BOUNDS, e.getReason());
        assertEquals("X2", e.getExternalId());
    }

    @Test
    void normalize_RejectsUnmappedPropertyType() {
        RawListing raw = TestListings.raw("X3");
        raw.setRealEstateTypeId(99);

        ListingValidationException e = assertThrows(ListingValidationException.class, () -> normalizer.normalize(raw));
        assertEquals(ListingValidationException.Reason.UNMAPPED_CODE, e.getReason());
    }

    @Test
    void normalize_RejectsPriceOutsideBand() {
        RawListing raw = TestListings.raw("X4");
        raw.getPrice().get("1").setPriceTotal(new BigDecimal("100"));

        ListingValidationException e = assertThrows(ListingValidationException.class, () -> normalizer.normalize(raw));
        assertEquals(ListingValidationException.Reason.OUT_OF_BOUNDS, e.getReason(),
                "100 GEL is below the 135 GEL minimum");
    }

    @Test
    void normalize_RejectsFloorAboveTotalFloors() {
        RawListing raw = TestListings.raw("X5");
        raw.setFloor("12");
        raw.setTotalFloors("9");

        ListingValidationException e = assertThrows(ListingValidationException.class, () -> normalizer.normalize(raw));
        assertEquals(ListingValidationException.Reason.OUT_OF_BOUNDS, e.getReason());
    }

    @Test
    void normalize_RejectsMissingCoordinates() {
        RawListing raw = TestListings.raw("X6");
        raw.setLng(null);

        ListingValidationException e = assertThrows(ListingValidationException.class, () -> normalizer.normalize(raw));
        assertEquals(ListingValidationException.Reason.MISSING_FIELD, e.getReason());
    }

    @Test
    void normalize_FallsBackToFirstMappedCurrencyAndSeedsUsd() {
        // Arrange
        RawListing raw = TestListings.raw("X7");
        raw.getPrice().clear();
        RawListing.RawPrice usd = new RawListing.RawPrice();
        usd.setPriceTotal(new BigDecimal("400"));
        raw.getPrice().put("2", usd);

        // Act
        NormalizedListing listing = normalizer.normalize(raw);

        // Assert
        assertEquals(Currency.USD, listing.getCurrency());
        assertEquals(0, new BigDecimal("400").compareTo(listing.getPriceUsd()));
    }

    @Test
    void normalize_ParsesLooseNumbersAndCleansText() {
        RawListing raw = TestListings.raw("X8");
        raw.setRoom("5+");
        raw.setArea("1,200.5");
        raw.setComment("  line one\n\n\tline two\u0007 ");

        NormalizedListing listing = normalizer.normalize(raw);

        assertEquals(5, listing.getRooms());
        assertEquals(0, new BigDecimal("1200.5").compareTo(listing.getArea()));
        assertEquals("line one line two", listing.description(Language.KA));
    }

    @Test
    void normalize_DropsDuplicateImagesAndMarksFirstPrimaryWhenNoneFlagged() {
        // Arrange
        RawListing raw = TestListings.raw("X9");
        raw.getImages().add(image("https:\\/\\/static.my.ge\\/1.jpg", false));
        raw.getImages().add(image("https://static.my.ge/2.jpg", false));
        raw.getImages().add(image("https://static.my.ge/1.jpg", false));

        // Act
        List<ListingImage> images = normalizer.normalize(raw).getImages();

        // Assert
        assertEquals(2, images.size(), "Duplicate URL should be dropped");
        assertEquals("https://static.my.ge/1.jpg", images.get(0).url());
        assertTrue(images.get(0).primary());
        assertFalse(images.get(1).primary());
        assertEquals(1, images.get(1).ordinal());
    }

    @Test
    void normalize_KeepsFlaggedMainImageAsOnlyPrimary() {
        RawListing raw = TestListings.raw("X10");
        raw.getImages().add(image("https://static.my.ge/1.jpg", false));
        raw.getImages().add(image("https://static.my.ge/2.jpg", true));

        List<ListingImage> images = normalizer.normalize(raw).getImages();

        assertEquals(1, images.stream().filter(ListingImage::primary).count());
        assertTrue(images.get(1).primary());
    }

    @Test
    void normalize_ClassifiesOwner() {
        RawListing raw = TestListings.raw("X11");
        RawListing.UserType type = new RawListing.UserType();
        type.setType("physical_person owner");
        raw.setUserType(type);

        assertEquals(OwnerType.INDIVIDUAL, normalizer.normalize(raw).getOwnerType());
    }

    @Test
    void normalize_StoresTextUnderServedLocale() {
        RawListing raw = TestListings.raw("X12");
        raw.setLocale("en");
        raw.setDynamicTitle("2 room apartment for sale");

        NormalizedListing listing = normalizer.normalize(raw);

        assertEquals("2 room apartment for sale", listing.title(Language.EN));
        assertNull(listing.title(Language.KA));
    }

    private static RawListing.RawImage image(String url, boolean main) {
        RawListing.RawImage image = new RawListing.RawImage();
        image.setLarge(url);
        image.setMain(main);
        return image;
    }
}
