package com.lookup.matching.review;

import java.util.Objects;

/**
 * A user action in a review session, reduced by {@link ReviewReducer}.
 */
public interface ReviewAction {

    /**
     * Accepts a match. A null value accepts the suggested value.
     */
    record AcceptMatch(String id, String value) implements ReviewAction {
        public AcceptMatch {
            Objects.requireNonNull(id, "id is required");
        }
    }

    record RejectMatch(String id) implements ReviewAction {
        public RejectMatch {
            Objects.requireNonNull(id, "id is required");
        }
    }

    record SetManualValue(String id, String value) implements ReviewAction {
        public SetManualValue {
            Objects.requireNonNull(id, "id is required");
        }
    }

    record ToggleSelection(String id) implements ReviewAction {
        public ToggleSelection {
            Objects.requireNonNull(id, "id is required");
        }
    }

    /**
     * Selects pending matches passing {@code criteria}, or the current filter when null.
     */
    record SelectAll(ReviewFilter criteria) implements ReviewAction {
    }

    record ClearSelection() implements ReviewAction {
    }

    /**
     * Accepts every selected pending match. A null value accepts each match's suggested value.
     */
    record AcceptSelected(String value) implements ReviewAction {
    }

    record RejectSelected() implements ReviewAction {
    }

    /**
     * Merges the set dimensions of {@code partial} into the current filter.
     */
    record UpdateFilter(ReviewFilter partial) implements ReviewAction {
        public UpdateFilter {
            Objects.requireNonNull(partial, "partial is required");
        }
    }

    /**
     * Replaces the current filter, clearing dimensions that merging cannot unset.
     */
    record ReplaceFilter(ReviewFilter filter) implements ReviewAction {
        public ReplaceFilter {
            filter = filter != null ? filter : ReviewFilter.empty();
        }
    }

    record ResetAll() implements ReviewAction {
    }

    static ReviewAction accept(String id) {
        return new AcceptMatch(id, null);
    }

    static ReviewAction accept(String id, String value) {
        return new AcceptMatch(id, value);
    }

    static ReviewAction reject(String id) {
        return new RejectMatch(id);
    }

    static ReviewAction manual(String id, String value) {
        return new SetManualValue(id, value);
    }

    static ReviewAction toggle(String id) {
        return new ToggleSelection(id);
    }

    static ReviewAction selectAll() {
        return new SelectAll(null);
    }

    static ReviewAction selectAll(ReviewFilter criteria) {
        return new SelectAll(criteria);
    }

    static ReviewAction clearSelection() {
        return new ClearSelection();
    }

    static ReviewAction acceptSelected() {
        return new AcceptSelected(null);
    }

    static ReviewAction acceptSelected(String value) {
        return new AcceptSelected(value);
    }

    static ReviewAction rejectSelected() {
        return new RejectSelected();
    }

    static ReviewAction updateFilter(ReviewFilter partial) {
        return new UpdateFilter(partial);
    }

    static ReviewAction replaceFilter(ReviewFilter filter) {
        return new ReplaceFilter(filter);
    }

    static ReviewAction resetAll() {
        return new ResetAll();
    }
}
