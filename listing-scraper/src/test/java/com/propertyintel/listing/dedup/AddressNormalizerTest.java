package com.propertyintel.listing.dedup;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AddressNormalizerTest {

    @Test
    void normalize_LowercasesAndStripsPunctuation() {
        assertEquals("vaja pshavela 25", AddressNormalizer.normalize("Vaja-Pshavela 25"));
        assertEquals("vaja pshavela 25", AddressNormalizer.normalize("  vaja pshavela,  25. "));
    }

    @Test
    void normalize_KeepsGeorgianLetters() {
        assertEquals("ვაჟა ფშაველა 25", AddressNormalizer.normalize("ვაჟა-ფშაველა 25"));
    }

    @Test
    void normalize_NullIsEmpty() {
        assertEquals("", AddressNormalizer.normalize(null));
    }
}
