package com.propertyintel.listing.model;

import java.util.Objects;

/**
 * Outcome of deduplicating one incoming listing against the store.
 */
public final class DedupDecision {

    public enum Action {
        INSERT, UPDATE, SKIP
    }

    public enum SkipReason {
        /** A stored listing of the same property has higher owner priority. */
        LOWER_PRIORITY_DUPLICATE,
        /** The same external id was already processed earlier in this run. */
        SEEN_IN_RUN,
        /** Two candidates could not be told apart; left for manual review. */
        AMBIGUOUS
    }

    private static final DedupDecision INSERT = new DedupDecision(Action.INSERT, null, null, null);

    private final Action action;
    private final Long existingId;
    private final DedupTier tier;
    private final SkipReason reason;

    private DedupDecision(Action action, Long existingId, DedupTier tier, SkipReason reason) {
        this.action = action;
        this.existingId = existingId;
        this.tier = tier;
        this.reason = reason;
    }

    public static DedupDecision insert() {
        return INSERT;
    }

    public static DedupDecision update(long existingId, DedupTier tier) {
        return new DedupDecision(Action.UPDATE, existingId, Objects.requireNonNull(tier), null);
    }

    public static DedupDecision skip(SkipReason reason) {
        return new DedupDecision(Action.SKIP, null, null, Objects.requireNonNull(reason));
    }

    public static DedupDecision skip(SkipReason reason, DedupTier tier) {
        return new DedupDecision(Action.SKIP, null, tier, Objects.requireNonNull(reason));
    }

    /**
     * Skip the incoming data but keep a reference to the stored row it matched, whose
     * {@code last_scraped} is still refreshed.
     */
    public static DedupDecision skipExisting(long existingId, SkipReason reason, DedupTier tier) {
        return new DedupDecision(Action.SKIP, existingId, Objects.requireNonNull(tier), Objects.requireNonNull(reason));
    }

    public Action action() {
        return action;
    }

    public Long existingId() {
        return existingId;
    }

    public DedupTier tier() {
        return tier;
    }

    public SkipReason reason() {
        return reason;
    }

    public boolean isInsert() {
        return action == Action.INSERT;
    }

    public boolean isUpdate() {
        return action == Action.UPDATE;
    }

    public boolean isSkip() {
        return action == Action.SKIP;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DedupDecision that)) return false;
        return action == that.action
                && Objects.equals(existingId, that.existingId)
                && tier == that.tier
                && reason == that.reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, existingId, tier, reason);
    }

    @Override
    public String toString() {
        return switch (action) {
            case INSERT -> "Insert";
            case UPDATE -> "Update(" + existingId + ", " + tier + ")";
            case SKIP -> existingId == null ? "Skip(" + reason + ")" : "Skip(" + reason + ", " + existingId + ")";
        };
    }
}
