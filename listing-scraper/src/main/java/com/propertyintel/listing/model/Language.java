package com.propertyintel.listing.model;

import java.util.Arrays;

/**
 * Languages the source publishes listing text in. {@link #KA} is the source default.
 */
public enum Language {
    KA("ka"), EN("en"), RU("ru");

    private final String code;

    Language(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Language fromCode(String code) {
        if (code == null || code.isBlank()) {
            return KA;
        }
        return Arrays.stream(values())
                .filter(l -> l.code.equalsIgnoreCase(code.trim()))
                .findFirst()
                .orElse(KA);
    }
}
