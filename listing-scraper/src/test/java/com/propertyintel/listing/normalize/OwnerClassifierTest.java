package com.propertyintel.listing.normalize;

import com.propertyintel.listing.TestListings;
import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.model.OwnerType;
import com.propertyintel.listing.model.RawListing;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OwnerClassifierTest {

    private final OwnerClassifier classifier = new OwnerClassifier(new ListingScraperProperties());

    @Test
    void classify_MoreOwnerHits_IsIndividual() {
        RawListing raw = TestListings.raw("O1");
        raw.setUserTitle("Private owner");

        assertEquals(OwnerType.INDIVIDUAL, classifier.classify(raw));
    }

    @Test
    void classify_NamedAgency_IsAgency() {
        RawListing raw = TestListings.raw("O2");
        raw.setAgencyName("Tbilisi Homes");

        assertEquals(OwnerType.AGENCY, classifier.classify(raw));
    }

    @Test
    void classify_NoIndicators_IsUnknown() {
        assertEquals(OwnerType.UNKNOWN, classifier.classify(TestListings.raw("O3")));
    }

    @Test
    void classify_EqualHits_IsUnknown() {
        RawListing raw = TestListings.raw("O4");
        raw.setUserTitle("owner");
        raw.setComment("call our agency");

        assertEquals(OwnerType.UNKNOWN, classifier.classify(raw));
    }
}
