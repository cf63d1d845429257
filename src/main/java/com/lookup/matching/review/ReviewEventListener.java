package com.lookup.matching.review;

/**
 * Receives review decisions for audit or undo. Delivery is fire-and-forget:
 * the session does not wait for or depend on the outcome.
 */
@FunctionalInterface
public interface ReviewEventListener {

    void onReviewEvent(ReviewEvent event);

    /**
     * A listener that ignores every event.
     */
    ReviewEventListener NOOP = event -> {};
}
