package com.lookup.matching.review;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A review decision, published once per user action.
 *
 * @param kind      the decision kind
 * @param matchIds  the affected match IDs, one for single-match decisions
 * @param value     the accepted or manual value; null for rejections and for batch accepts
 *                  that keep each match's suggested value
 * @param timestamp when the decision was made
 */
public record ReviewEvent(ReviewEventKind kind, List<String> matchIds, String value, Instant timestamp) {

    public ReviewEvent {
        Objects.requireNonNull(kind, "kind is required");
        matchIds = matchIds != null ? List.copyOf(matchIds) : List.of();
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public boolean isBatch() {
        return kind == ReviewEventKind.BATCH_ACCEPT || kind == ReviewEventKind.BATCH_REJECT;
    }
}
