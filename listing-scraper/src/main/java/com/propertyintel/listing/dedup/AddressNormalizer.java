package com.propertyintel.listing.dedup;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Comparison key for street addresses: case-folded, punctuation turned into spaces and
 * whitespace collapsed. {@code "Vaja-Pshavela 25"} and {@code "vaja pshavela  25"} share the
 * key {@code "vaja pshavela 25"}.
 */
public final class AddressNormalizer {

    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{Punct}\\p{IsPunctuation}]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private AddressNormalizer() {
    }

    public static String normalize(String address) {
        if (address == null) {
            return "";
        }
        String key = address.toLowerCase(Locale.ROOT);
        key = PUNCTUATION.matcher(key).replaceAll(" ");
        key = WHITESPACE.matcher(key).replaceAll(" ");
        return key.trim();
    }
}
