package com.propertyintel.listing.enrichment;

import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.exception.EnrichmentConflictException;
import com.propertyintel.listing.model.Language;
import com.propertyintel.listing.model.PersistedProperty;
import com.propertyintel.listing.persistence.PropertyRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fills in missing languages of stored listings, independently of the ingester.
 *
 * Each cycle claims a bounded number of untranslated rows by taking a time-limited lease, so
 * two workers never translate the same row. Translations are written back only if the row
 * still has the version read at claim time; otherwise the lease is dropped and the row is
 * picked up again later with its new text.
 */
@Service
@Slf4j
public class EnrichmentWorker {

    private final PropertyRepository repository;
    private final TranslationService translationService;
    private final ListingScraperProperties properties;
    private final Clock clock;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public EnrichmentWorker(PropertyRepository repository,
                            TranslationService translationService,
                            ListingScraperProperties properties,
                            Clock clock) {
        this.repository = repository;
        this.translationService = translationService;
        this.properties = properties;
        this.clock = clock;
    }

    /** Outcome counts of one cycle. */
    public record CycleResult(int claimed, int translated, int conflicts, int failed) {
    }

    public CycleResult runCycle() {
        if (cancelled.get()) {
            log.info("Enrichment cancelled; cycle skipped");
            return new CycleResult(0, 0, 0, 0);
        }
        List<PersistedProperty> claimed = claimUntranslated(properties.getEnrichment().getBatchSize());
        if (claimed.isEmpty()) {
            log.debug("No listings waiting for translation");
            return new CycleResult(0, 0, 0, 0);
        }
        log.info("Enrichment cycle claimed {} listings", claimed.size());

        int translated = 0;
        int conflicts = 0;
        int failed = 0;
        for (int i = 0; i < claimed.size(); i++) {
            PersistedProperty property = claimed.get(i);
            if (cancelled.get()) {
                log.info("Enrichment cancelled; releasing {} remaining leases", claimed.size() - i);
                claimed.subList(i, claimed.size()).forEach(p -> repository.releaseLease(p.getId()));
                break;
            }
            try {
                enrich(property);
                translated++;
            } catch (EnrichmentConflictException e) {
                log.info("{}; left queued", e.getMessage());
                repository.releaseLease(property.getId());
                conflicts++;
            } catch (RuntimeException e) {
                log.error("Enrichment failed for property {}: {}", property.getId(), e.getMessage(), e);
                repository.releaseLease(property.getId());
                failed++;
            }
        }

        log.info("Enrichment cycle done: {} translated, {} conflicts, {} failed", translated, conflicts, failed);
        return new CycleResult(claimed.size(), translated, conflicts, failed);
    }

    /**
     * Lease up to {@code limit} untranslated rows. The returned snapshots carry the version
     * that write-back will be checked against.
     */
    public List<PersistedProperty> claimUntranslated(int limit) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime leaseUntil = now.plus(properties.getEnrichment().getLeaseDuration());
        List<PersistedProperty> claimed = new ArrayList<>();
        for (Long id : repository.findUntranslated(now, limit)) {
            if (repository.claim(id, now, leaseUntil)) {
                repository.findById(id).ifPresent(claimed::add);
            }
        }
        return claimed;
    }

    /**
     * @throws EnrichmentConflictException when the row changed after it was read
     */
    public void writeBack(long propertyId, long expectedVersion, Map<Language, Translation> translations) {
        Map<Language, String> titles = new EnumMap<>(Language.class);
        Map<Language, String> descriptions = new EnumMap<>(Language.class);
        translations.forEach((language, t) -> {
            if (t.title() != null) {
                titles.put(language, t.title());
            }
            if (t.description() != null) {
                descriptions.put(language, t.description());
            }
        });
        if (!repository.writeBack(propertyId, expectedVersion, titles, descriptions, LocalDateTime.now(clock))) {
            throw new EnrichmentConflictException(propertyId, expectedVersion);
        }
        log.debug("Wrote {} translations for property {}", translations.size(), propertyId);
    }

    private void enrich(PersistedProperty property) {
        Optional<Language> source = sourceLanguage(property);
        Set<Language> targets = EnumSet.copyOf(properties.getEnrichment().getTargetLanguages());
        source.ifPresent(targets::remove);

        Map<Language, Translation> translations = new EnumMap<>(Language.class);
        if (source.isPresent() && !targets.isEmpty()) {
            Language from = source.get();
            TranslationRequest request = new TranslationRequest(property.getExternalId(), from,
                    property.getTitles().get(from), property.getDescriptions().get(from));
            translations.putAll(translationService.translate(request, targets));
        }
        writeBack(property.getId(), property.getVersion(), translations);
    }

    /** Georgian first, else whichever language the row has text in. */
    private static Optional<Language> sourceLanguage(PersistedProperty property) {
        for (Language language : Language.values()) {
            if (property.getTitles().containsKey(language) || property.getDescriptions().containsKey(language)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public void resume() {
        cancelled.set(false);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @PreDestroy
    public void shutdown() {
        cancel();
    }
}
