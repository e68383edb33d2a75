package com.propertyintel.listing.enrichment;

import com.propertyintel.listing.model.Language;

/**
 * Text to translate, plus the source id so translators can ask the source for its own versions.
 */
public record TranslationRequest(String externalId, Language sourceLanguage, String title, String description) {
}
