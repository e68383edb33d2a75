package com.propertyintel.listing.enrichment;

import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.exception.FetchException;
import com.propertyintel.listing.fetch.ListingSourceClient;
import com.propertyintel.listing.model.Language;
import com.propertyintel.listing.model.RawListing;
import com.propertyintel.listing.normalize.TextNormalizer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Asks the source for its own version of a listing in each target locale. Languages are
 * fetched in parallel when {@code features.concurrent-languages} is on.
 */
@Component
@Slf4j
public class SourceApiTranslationService implements TranslationService {

    private final ListingSourceClient client;
    private final ListingScraperProperties properties;
    private final ExecutorService languagePool;

    public SourceApiTranslationService(ListingSourceClient client, ListingScraperProperties properties) {
        this.client = client;
        this.properties = properties;
        this.languagePool = Executors.newFixedThreadPool(Language.values().length);
    }

    /**
     * @throws FetchException when the source is unavailable
     */
    @Override
    public Map<Language, Translation> translate(TranslationRequest request, Set<Language> targets) {
        Map<Language, Translation> out = new EnumMap<>(Language.class);
        if (properties.getFeatures().isConcurrentLanguages() && targets.size() > 1) {
            Map<Language, CompletableFuture<Optional<Translation>>> futures = new LinkedHashMap<>();
            for (Language target : targets) {
                futures.put(target, CompletableFuture.supplyAsync(() -> fetch(request, target), languagePool));
            }
            futures.forEach((language, future) -> join(future).ifPresent(t -> out.put(language, t)));
        } else {
            for (Language target : targets) {
                fetch(request, target).ifPresent(t -> out.put(target, t));
            }
        }
        return out;
    }

    private Optional<Translation> fetch(TranslationRequest request, Language target) {
        if (target == request.sourceLanguage()) {
            return Optional.empty();
        }
        Optional<RawListing> detail = client.fetchDetail(request.externalId(), target);
        return detail.map(raw -> new Translation(
                        TextNormalizer.clean(StringUtils.hasText(raw.getDynamicTitle()) ? raw.getDynamicTitle() : raw.getTitle()),
                        TextNormalizer.clean(raw.getComment())))
                .filter(t -> !t.isEmpty())
                .filter(t -> !sameAsSource(request, t));
    }

    /** The source falls back to its default language for locales it lacks. */
    private boolean sameAsSource(TranslationRequest request, Translation t) {
        return t.title() != null && t.title().equals(request.title())
                && (t.description() == null || t.description().equals(request.description()));
    }

    private static Optional<Translation> join(CompletableFuture<Optional<Translation>> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }

    @PreDestroy
    public void shutdown() {
        languagePool.shutdownNow();
    }
}
