package com.propertyintel.listing.enrichment;

import com.propertyintel.listing.model.Language;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Source API first; any language it cannot serve, or all of them when it is down, go to the glossary.
 */
@Service
@Primary
@Slf4j
@RequiredArgsConstructor
public class FallbackTranslationService implements TranslationService {

    private final SourceApiTranslationService sourceApi;
    private final GlossaryTranslationService glossary;

    @Override
    public Map<Language, Translation> translate(TranslationRequest request, Set<Language> targets) {
        Map<Language, Translation> out = new EnumMap<>(Language.class);
        try {
            out.putAll(sourceApi.translate(request, targets));
        } catch (RuntimeException e) {
            log.warn("Source translations unavailable for listing {}, using glossary: {}",
                    request.externalId(), e.getMessage());
        }

        Set<Language> missing = targets.isEmpty() ? EnumSet.noneOf(Language.class) : EnumSet.copyOf(targets);
        missing.removeAll(out.keySet());
        missing.remove(request.sourceLanguage());
        if (!missing.isEmpty()) {
            out.putAll(glossary.translate(request, missing));
        }
        return out;
    }
}
