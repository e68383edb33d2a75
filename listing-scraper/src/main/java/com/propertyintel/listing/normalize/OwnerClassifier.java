package com.propertyintel.listing.normalize;

import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.model.OwnerType;
import com.propertyintel.listing.model.RawListing;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Decides whether a listing was posted by the owner or by an agency, by counting configured
 * indicator words in the listing's publisher and text fields. A named agency counts as one more
 * agency hit. Equal counts, zero included, give {@link OwnerType#UNKNOWN}.
 */
@Component
@RequiredArgsConstructor
public class OwnerClassifier {

    private final ListingScraperProperties properties;

    public OwnerType classify(RawListing raw) {
        String userType = raw.getUserType() != null ? raw.getUserType().getType() : null;
        List<String> fields = Stream.of(userType, raw.getUserTitle(), raw.getAgencyName(),
                        raw.getDynamicTitle(), raw.getTitle(), raw.getComment())
                .filter(StringUtils::hasText)
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList();

        int ownerHits = hits(fields, properties.getDedup().getOwnerIndicators());
        int agencyHits = hits(fields, properties.getDedup().getAgencyIndicators());
        if (StringUtils.hasText(raw.getAgencyName())) {
            agencyHits++;
        }

        if (ownerHits > agencyHits) {
            return OwnerType.INDIVIDUAL;
        }
        if (agencyHits > ownerHits) {
            return OwnerType.AGENCY;
        }
        return OwnerType.UNKNOWN;
    }

    private int hits(List<String> fields, List<String> indicators) {
        int count = 0;
        for (String field : fields) {
            for (String indicator : indicators) {
                if (field.contains(indicator.toLowerCase(Locale.ROOT))) {
                    count++;
                }
            }
        }
        return count;
    }
}
