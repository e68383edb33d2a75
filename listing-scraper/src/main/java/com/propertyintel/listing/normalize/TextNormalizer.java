package com.propertyintel.listing.normalize;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Static helpers for cleaning source text and the loosely typed numbers the API returns as strings.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x1f\\x7f-\\x9f]");

    private TextNormalizer() {
    }

    /**
     * Collapse whitespace and strip control characters. Blank input becomes null.
     */
    public static String clean(String text) {
        if (text == null) {
            return null;
        }
        String cleaned = WHITESPACE.matcher(text).replaceAll(" ");
        cleaned = CONTROL.matcher(cleaned).replaceAll("").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    /**
     * Parse "3", "3+", "1,200" or "45.5". Anything else is null.
     */
    public static BigDecimal parseDecimal(String value) {
        if (value == null) {
            return null;
        }
        String v = value.trim();
        while (v.endsWith("+")) {
            v = v.substring(0, v.length() - 1).trim();
        }
        v = v.replace(",", "");
        if (v.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(v);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Integer parseInt(String value) {
        BigDecimal parsed = parseDecimal(value);
        return parsed == null ? null : parsed.intValue();
    }
}
