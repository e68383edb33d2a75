package com.propertyintel.listing.enrichment;

import com.propertyintel.listing.model.Language;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Word-level replacement of common Georgian real-estate terms. Used when the source cannot
 * serve a language; it always answers, leaving unknown words untouched.
 */
@Component
@Slf4j
public class GlossaryTranslationService implements TranslationService {

    private static final Map<String, Map<Language, String>> GLOSSARY = new LinkedHashMap<>();

    static {
        term("იყიდება", "For Sale", "Продается");
        term("ქირავდება", "For Rent", "Сдается в аренду");
        term("ბინა", "Apartment", "Квартира");
        term("სახლი", "House", "Дом");
        term("ოთახიანი", "Room", "комнатный");
        term("ოთახი", "Room", "Комната");
        term("კომერციული", "Commercial", "Коммерческий");
        term("ოფისი", "Office", "Офис");
        term("მაღაზია", "Shop", "Магазин");
        term("ავტოფარეხი", "Garage", "Гараж");
        term("ზღვის", "Sea", "Море");
        term("ცენტრი", "Center", "Центр");
        term("ახალი", "New", "Новый");
        term("რემონტი", "Renovation", "Ремонт");
        term("ავეჯი", "Furniture", "Мебель");
        term("ლიფტი", "Elevator", "Лифт");
        term("ბალკონი", "Balcony", "Балкон");
        term("ტელეფონი", "Phone", "Телефон");
        term("ინტერნეტი", "Internet", "Интернет");
    }

    /** Longest terms first, so a word is never replaced by the entry for its own prefix. */
    private static final List<String> TERMS = GLOSSARY.keySet().stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .toList();

    private static void term(String georgian, String english, String russian) {
        Map<Language, String> translations = new EnumMap<>(Language.class);
        translations.put(Language.EN, english);
        translations.put(Language.RU, russian);
        GLOSSARY.put(georgian, translations);
    }

    @Override
    public Map<Language, Translation> translate(TranslationRequest request, Set<Language> targets) {
        Map<Language, Translation> out = new EnumMap<>(Language.class);
        for (Language target : targets) {
            if (target == request.sourceLanguage()) {
                continue;
            }
            out.put(target, new Translation(apply(request.title(), target), apply(request.description(), target)));
        }
        log.debug("Glossary translated listing {} into {}", request.externalId(), out.keySet());
        return out;
    }

    String apply(String text, Language target) {
        if (text == null) {
            return null;
        }
        String result = text;
        for (String term : TERMS) {
            String replacement = GLOSSARY.get(term).get(target);
            if (replacement != null && result.contains(term)) {
                result = result.replace(term, replacement);
            }
        }
        return result.trim();
    }
}
