package com.lookup.matching.review;

import com.lookup.matching.logging.LogContext;
import com.lookup.matching.metrics.MetricsService;
import com.lookup.matching.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A review session over one batch of fuzzy matches.
 *
 * <p>Holds the current {@link ReviewState}, applies actions through {@link ReviewReducer}
 * and publishes one {@link ReviewEvent} per decision to the injected listener. Listener
 * failures are logged and do not affect the session. Sessions are not thread-safe;
 * discarding a session is the only way to cancel it.</p>
 */
public class ReviewSession {
    private static final Logger log = LoggerFactory.getLogger(ReviewSession.class);

    private final String sessionId;
    private final ReviewEventListener listener;
    private final MetricsService metrics;
    private final Clock clock;
    private ReviewState state;

    public ReviewSession(List<FuzzyMatch> matches) {
        this(matches, ReviewEventListener.NOOP);
    }

    public ReviewSession(List<FuzzyMatch> matches, ReviewEventListener listener) {
        this(matches, listener, new NoOpMetricsService(), Clock.systemUTC());
    }

    public ReviewSession(List<FuzzyMatch> matches, ReviewEventListener listener,
                         MetricsService metrics, Clock clock) {
        this.sessionId = UUID.randomUUID().toString();
        this.listener = listener != null ? listener : ReviewEventListener.NOOP;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.state = ReviewState.initial(matches);
        log.info("review.session.started sessionId={} matches={}", sessionId, state.getMatches().size());
    }

    /**
     * Applies an action, publishes its event if it has one, and returns the new state.
     */
    public ReviewState dispatch(ReviewAction action) {
        try (LogContext ctx = LogContext.forReview(sessionId, action.getClass().getSimpleName())) {
            ReviewState before = state;
            Optional<ReviewEvent> event = ReviewReducer.eventFor(before, action, clock.instant());
            state = ReviewReducer.reduce(before, action);

            if (before == state) {
                log.debug("review.action.ignored action={}", action);
            }
            event.ifPresent(this::publish);
            return state;
        }
    }

    public ReviewState acceptMatch(String id) {
        return dispatch(ReviewAction.accept(id));
    }

    /**
     * Accepts a match with the given value, or its suggested value when null.
     */
    public ReviewState acceptMatch(String id, String value) {
        return dispatch(ReviewAction.accept(id, value));
    }

    public ReviewState rejectMatch(String id) {
        return dispatch(ReviewAction.reject(id));
    }

    public ReviewState setManualValue(String id, String value) {
        return dispatch(ReviewAction.manual(id, value));
    }

    public ReviewState toggleSelection(String id) {
        return dispatch(ReviewAction.toggle(id));
    }

    public ReviewState selectAll() {
        return dispatch(ReviewAction.selectAll());
    }

    public ReviewState selectAll(ReviewFilter criteria) {
        return dispatch(ReviewAction.selectAll(criteria));
    }

    public ReviewState clearSelection() {
        return dispatch(ReviewAction.clearSelection());
    }

    public ReviewState acceptSelected() {
        return dispatch(ReviewAction.acceptSelected());
    }

    public ReviewState acceptSelected(String value) {
        return dispatch(ReviewAction.acceptSelected(value));
    }

    public ReviewState rejectSelected() {
        return dispatch(ReviewAction.rejectSelected());
    }

    public ReviewState updateFilter(ReviewFilter partial) {
        return dispatch(ReviewAction.updateFilter(partial));
    }

    public ReviewState replaceFilter(ReviewFilter filter) {
        return dispatch(ReviewAction.replaceFilter(filter));
    }

    public ReviewState resetAll() {
        return dispatch(ReviewAction.resetAll());
    }

    public String getSessionId() {
        return sessionId;
    }

    public ReviewState getState() {
        return state;
    }

    public List<FuzzyMatchForReview> filteredMatches() {
        return state.filteredMatches();
    }

    public ReviewStats stats() {
        return state.stats();
    }

    public boolean hasChanges() {
        return state.hasChanges();
    }

    public boolean isComplete() {
        return state.isComplete();
    }

    public boolean canBatchOperate() {
        return state.canBatchOperate();
    }

    private void publish(ReviewEvent event) {
        metrics.incrementReviewDecision(event.kind(), event.matchIds().size());
        log.info("review.decision sessionId={} kind={} matches={}", sessionId, event.kind(), event.matchIds().size());
        try {
            listener.onReviewEvent(event);
        } catch (RuntimeException e) {
            log.warn("Review event listener failed for {} on {}: {}",
                    event.kind(), event.matchIds(), e.getMessage(), e);
        }
    }
}
