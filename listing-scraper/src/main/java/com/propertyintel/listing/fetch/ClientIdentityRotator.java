package com.propertyintel.listing.fetch;

import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.model.Language;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out request headers with the user agent rotated round-robin across the configured pool.
 */
@Component
@Slf4j
public class ClientIdentityRotator {

    private final ListingScraperProperties properties;
    private final AtomicInteger next = new AtomicInteger();

    public ClientIdentityRotator(ListingScraperProperties properties) {
        this.properties = properties;
    }

    public HttpHeaders nextHeaders(Language language) {
        List<String> agents = properties.getFetch().getUserAgents();
        String userAgent = agents.get(Math.floorMod(next.getAndIncrement(), agents.size()));

        HttpHeaders headers = new HttpHeaders();
        properties.getApi().getHeaders().forEach(headers::set);
        headers.set(HttpHeaders.USER_AGENT, userAgent);
        headers.set("locale", language.code());
        headers.set(HttpHeaders.ACCEPT_LANGUAGE, language.code() + ";q=0.9,ka;q=0.8,en;q=0.7");
        if (StringUtils.hasText(properties.getApi().getAuthorizationToken())) {
            headers.set("global-authorization", properties.getApi().getAuthorizationToken());
        }
        log.trace("Using user agent {}", userAgent);
        return headers;
    }
}
