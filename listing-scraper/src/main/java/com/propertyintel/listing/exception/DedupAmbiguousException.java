package com.propertyintel.listing.exception;

import java.util.List;

/**
 * Two or more stored candidates tie on every dedup criterion. The incoming record is skipped.
 */
public class DedupAmbiguousException extends RuntimeException {

    private final List<Long> candidateIds;

    public DedupAmbiguousException(String externalId, List<Long> candidateIds) {
        super("Ambiguous duplicate for listing " + externalId + ": candidates " + candidateIds);
        this.candidateIds = List.copyOf(candidateIds);
    }

    public List<Long> getCandidateIds() {
        return candidateIds;
    }
}
