package com.propertyintel.listing.fetch;

import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.exception.FetchException;
import com.propertyintel.listing.model.Language;
import com.propertyintel.listing.model.RawListing;
import com.propertyintel.listing.model.SourceApiResponse;
import com.propertyintel.listing.model.SourceDetailResponse;
import com.propertyintel.listing.pipeline.RunContext;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Thin client over the myhome.ge statements API.
 *
 * Rate limiting: every attempt takes a permit from a Resilience4j rate limiter holding
 * {@code requests-per-minute} permits per minute; callers park until one frees up. A 429,
 * 5xx or I/O error triggers a Resilience4j retry with exponential backoff. When retries run
 * out the page is reported as failed and the run moves on.
 */
@Service
@Slf4j
public class ListingSourceClient {

    static final String LIMITER_NAME = "listingSource";

    private final RestTemplate restTemplate;
    private final ListingScraperProperties properties;
    private final ClientIdentityRotator identities;
    private final RateLimiter rateLimiter;
    private final Retry retry;

    public ListingSourceClient(RestTemplate restTemplate,
                               ListingScraperProperties properties,
                               ClientIdentityRotator identities,
                               RateLimiterRegistry rateLimiterRegistry,
                               RetryRegistry retryRegistry) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.identities = identities;

        ListingScraperProperties.Fetch fetch = properties.getFetch();
        this.rateLimiter = rateLimiterRegistry.rateLimiter(LIMITER_NAME, RateLimiterConfig.custom()
                .limitForPeriod(fetch.getRequestsPerMinute())
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(fetch.getPermitTimeout())
                .build());
        this.retry = retryRegistry.retry(LIMITER_NAME, RetryConfig.custom()
                .maxAttempts(fetch.getMaxRetries())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(fetch.getInitialBackoff(), 2.0))
                .retryOnException(e -> e instanceof FetchException fe && fe.isRetryable())
                .build());
    }

    /**
     * Fetch one page of listings.
     *
     * @return the page; never throws for transport problems, a failed page is returned instead
     */
    public ListingPage fetchPage(PageCursor cursor, RunContext ctx) {
        URI uri = UriComponentsBuilder
                .fromUriString(properties.getApi().getListUrl())
                .queryParam("page", cursor.page())
                .queryParam("per_page", cursor.pageSize())
                .queryParam("deal_types", properties.getApi().getDealTypes())
                .queryParam("real_estate_types", properties.getApi().getRealEstateTypes())
                .queryParam("currency_id", 1)
                .encode()
                .build()
                .toUri();

        try {
            SourceApiResponse response = execute(uri, Language.KA, SourceApiResponse.class, ctx);
            List<RawListing> records = response == null ? List.of() : response.listings();
            ctx.pageFetched();
            ctx.recordsFetched(records.size());
            log.debug("Page {} returned {} listings", cursor.page(), records.size());
            return ListingPage.of(cursor, records, nextCursor(cursor, records.size(), response));

        } catch (FetchException | RequestNotPermitted e) {
            ctx.pageFailed();
            log.warn("Page {} failed and will be skipped: {}", cursor.page(), e.getMessage());
            return ListingPage.failed(cursor);
        }
    }

    /**
     * Fetch one listing as served in the given language.
     *
     * @return the listing, or empty when the source no longer has it
     * @throws FetchException when the source stays unavailable after retries
     */
    public Optional<RawListing> fetchDetail(String externalId, Language language) {
        URI uri = UriComponentsBuilder
                .fromUriString(properties.getApi().getDetailUrl())
                .pathSegment(externalId)
                .encode()
                .build()
                .toUri();
        try {
            SourceDetailResponse response = execute(uri, language, SourceDetailResponse.class, null);
            if (response == null || response.statement() == null) {
                return Optional.empty();
            }
            RawListing listing = response.statement();
            listing.setLocale(language.code());
            return Optional.of(listing);
        } catch (RequestNotPermitted e) {
            throw new FetchException("No rate-limit permit for detail " + externalId, e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> T execute(URI uri, Language language, Class<T> type, RunContext ctx) {
        AtomicInteger attempts = new AtomicInteger();
        Supplier<T> call = RateLimiter.decorateSupplier(rateLimiter, () -> {
            if (attempts.incrementAndGet() > 1 && ctx != null) {
                ctx.retryIssued();
            }
            return callApi(uri, language, type, ctx);
        });
        return Retry.decorateSupplier(retry, call).get();
    }

    private <T> T callApi(URI uri, Language language, Class<T> type, RunContext ctx) {
        log.debug("Calling source API: {}", uri);
        applyDelay();
        HttpHeaders headers = identities.nextHeaders(language);
        try {
            if (ctx != null) {
                ctx.apiCall();
            }
            return restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), type).getBody();

        } catch (HttpClientErrorException.NotFound e) {
            // 404 means nothing there; treat as empty
            log.debug("No data found (404) for URL: {}", uri);
            return null;

        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Rate limited (429) by source API, backing off");
            throw FetchException.rateLimited(uri.toString());

        } catch (HttpServerErrorException e) {
            throw FetchException.serverError(uri.toString(), e.getStatusCode().value());

        } catch (HttpClientErrorException e) {
            throw FetchException.clientError(uri.toString(), e.getStatusCode().value());

        } catch (ResourceAccessException e) {
            throw new FetchException("I/O error calling " + uri + ": " + e.getMessage(), e);
        }
    }

    private PageCursor nextCursor(PageCursor cursor, int received, SourceApiResponse response) {
        if (received < cursor.pageSize()) {
            return null;
        }
        if (response.getData() != null && response.getData().getMeta() != null) {
            Integer lastPage = response.getData().getMeta().getLastPage();
            if (lastPage != null && cursor.page() >= lastPage) {
                return null;
            }
        }
        return cursor.next();
    }

    private void applyDelay() {
        long ms = properties.getFetch().getDelayBetweenRequests().toMillis();
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
