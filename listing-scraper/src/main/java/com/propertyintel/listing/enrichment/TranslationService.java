package com.propertyintel.listing.enrichment;

import com.propertyintel.listing.model.Language;

import java.util.Map;
import java.util.Set;

public interface TranslationService {

    /**
     * @return a translation per target language this service could produce; others are absent
     */
    Map<Language, Translation> translate(TranslationRequest request, Set<Language> targets);
}
