package com.lookup.matching.review;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Pure state transitions for a review session.
 *
 * <p>Actions naming an unknown match ID return the state unchanged. Batch actions touch
 * only selected matches that are still pending, clear the selection, and complete in a
 * single transition.</p>
 */
public final class ReviewReducer {

    private ReviewReducer() {
    }

    /**
     * Applies an action to a state.
     *
     * @param state  the current state
     * @param action the action to apply
     * @return the next state; the same instance when the action changes nothing
     * @throws IllegalArgumentException if the action type is not supported
     */
    public static ReviewState reduce(ReviewState state, ReviewAction action) {
        if (action instanceof ReviewAction.AcceptMatch a) {
            return updateMatch(state, a.id(), m -> m.accepted(a.value()));
        } else if (action instanceof ReviewAction.RejectMatch r) {
            return updateMatch(state, r.id(), FuzzyMatchForReview::rejected);
        } else if (action instanceof ReviewAction.SetManualValue m) {
            return updateMatch(state, m.id(), match -> match.manual(m.value()));
        } else if (action instanceof ReviewAction.ToggleSelection t) {
            return toggle(state, t.id());
        } else if (action instanceof ReviewAction.SelectAll s) {
            return selectAll(state, s.criteria());
        } else if (action instanceof ReviewAction.ClearSelection) {
            return state.getSelectedIds().isEmpty() ? state : select(state, Set.of());
        } else if (action instanceof ReviewAction.AcceptSelected a) {
            return applyToSelection(state, m -> m.accepted(a.value()));
        } else if (action instanceof ReviewAction.RejectSelected) {
            return applyToSelection(state, FuzzyMatchForReview::rejected);
        } else if (action instanceof ReviewAction.UpdateFilter u) {
            return changeFilter(state, state.getFilter().merge(u.partial()));
        } else if (action instanceof ReviewAction.ReplaceFilter r) {
            return changeFilter(state, r.filter());
        } else if (action instanceof ReviewAction.ResetAll) {
            return resetAll(state);
        }
        throw new IllegalArgumentException("Unsupported review action: " + action);
    }

    /**
     * The event an action would publish when applied to {@code state}, if any.
     * Selection and filter actions publish nothing, nor do actions that affect no match.
     * A single accept without a value carries the suggested value it resolves to; a batch
     * accept without a value carries null, since each match resolves to its own suggestion.
     */
    public static Optional<ReviewEvent> eventFor(ReviewState state, ReviewAction action, Instant timestamp) {
        if (action instanceof ReviewAction.AcceptMatch a && state.contains(a.id())) {
            String accepted = a.value() != null ? a.value() : state.getMatch(a.id()).getSuggestedValue();
            return Optional.of(new ReviewEvent(ReviewEventKind.ACCEPT, List.of(a.id()), accepted, timestamp));
        } else if (action instanceof ReviewAction.RejectMatch r && state.contains(r.id())) {
            return Optional.of(new ReviewEvent(ReviewEventKind.REJECT, List.of(r.id()), null, timestamp));
        } else if (action instanceof ReviewAction.SetManualValue m && state.contains(m.id())) {
            return Optional.of(new ReviewEvent(ReviewEventKind.MANUAL, List.of(m.id()), m.value(), timestamp));
        } else if (action instanceof ReviewAction.AcceptSelected a) {
            List<String> ids = pendingSelection(state);
            return ids.isEmpty()
                    ? Optional.empty()
                    : Optional.of(new ReviewEvent(ReviewEventKind.BATCH_ACCEPT, ids, a.value(), timestamp));
        } else if (action instanceof ReviewAction.RejectSelected) {
            List<String> ids = pendingSelection(state);
            return ids.isEmpty()
                    ? Optional.empty()
                    : Optional.of(new ReviewEvent(ReviewEventKind.BATCH_REJECT, ids, null, timestamp));
        }
        return Optional.empty();
    }

    /**
     * IDs of selected matches that are still pending, in selection order.
     */
    static List<String> pendingSelection(ReviewState state) {
        List<String> ids = new ArrayList<>();
        for (String id : state.getSelectedIds()) {
            FuzzyMatchForReview match = state.getMatch(id);
            if (match != null && match.isPending()) {
                ids.add(id);
            }
        }
        return ids;
    }

    private static ReviewState updateMatch(ReviewState state, String id, UnaryOperator<FuzzyMatchForReview> change) {
        int position = state.indexOf(id);
        if (position < 0) {
            return state;
        }
        List<FuzzyMatchForReview> updated = new ArrayList<>(state.getMatches());
        updated.set(position, change.apply(updated.get(position)));
        return state.withMatches(updated, state.getSelectedIds());
    }

    private static ReviewState toggle(ReviewState state, String id) {
        if (!state.contains(id)) {
            return state;
        }
        Set<String> selection = new LinkedHashSet<>(state.getSelectedIds());
        if (!selection.remove(id)) {
            selection.add(id);
        }
        return select(state, selection);
    }

    private static ReviewState selectAll(ReviewState state, ReviewFilter criteria) {
        List<FuzzyMatchForReview> candidates = criteria != null
                ? criteria.apply(state.getMatches())
                : state.filteredMatches();
        Set<String> selection = new LinkedHashSet<>();
        for (FuzzyMatchForReview match : candidates) {
            if (match.isPending()) {
                selection.add(match.getId());
            }
        }
        return select(state, selection);
    }

    private static ReviewState select(ReviewState state, Set<String> selection) {
        List<FuzzyMatchForReview> updated = new ArrayList<>(state.getMatches().size());
        for (FuzzyMatchForReview match : state.getMatches()) {
            updated.add(match.withSelected(selection.contains(match.getId())));
        }
        return state.withMatches(updated, selection);
    }

    private static ReviewState applyToSelection(ReviewState state, UnaryOperator<FuzzyMatchForReview> change) {
        Set<String> affected = new LinkedHashSet<>(pendingSelection(state));
        if (affected.isEmpty() && state.getSelectedIds().isEmpty()) {
            return state;
        }
        List<FuzzyMatchForReview> updated = new ArrayList<>(state.getMatches().size());
        for (FuzzyMatchForReview match : state.getMatches()) {
            FuzzyMatchForReview next = affected.contains(match.getId()) ? change.apply(match) : match;
            updated.add(next.withSelected(false));
        }
        return state.withMatches(updated, Set.of());
    }

    private static ReviewState changeFilter(ReviewState state, ReviewFilter filter) {
        List<FuzzyMatchForReview> updated = new ArrayList<>(state.getMatches().size());
        for (FuzzyMatchForReview match : state.getMatches()) {
            updated.add(match.withSelected(false));
        }
        return state.withFilter(filter, updated);
    }

    private static ReviewState resetAll(ReviewState state) {
        List<FuzzyMatchForReview> updated = new ArrayList<>(state.getMatches().size());
        for (FuzzyMatchForReview match : state.getMatches()) {
            updated.add(match.reset());
        }
        return state.withMatches(updated, Set.of());
    }
}
