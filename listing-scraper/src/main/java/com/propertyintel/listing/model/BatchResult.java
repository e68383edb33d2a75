package com.propertyintel.listing.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-batch outcome counts. A batch never fails as a whole; failures are counted per record.
 */
@Data
public class BatchResult {

    private int inserted;
    private int updated;
    private int skipped;
    private int failed;

    /** Properties inserted or updated by the batch, in write order. */
    private final List<Written> written = new ArrayList<>();

    /**
     * @param externalId key of the listing that was written, which may differ from the row's own
     *                   key after a fuzzy merge
     */
    public record Written(long propertyId, String externalId, List<ListingImage> images) {
    }

    public int total() {
        return inserted + updated + skipped + failed;
    }
}
