package com.lookup.matching.review;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a review session.
 *
 * <p>Matches keep their load order. The filtered view and statistics are derived on
 * first access and reused for the lifetime of the snapshot. Snapshots are meant to be
 * confined to one session and are not safe to publish across threads.</p>
 */
public final class ReviewState {

    private final List<FuzzyMatchForReview> matches;
    private final Map<String, Integer> positions;
    private final Set<String> selectedIds;
    private final ReviewFilter filter;

    private List<FuzzyMatchForReview> filteredMatches;
    private ReviewStats stats;

    ReviewState(List<FuzzyMatchForReview> matches, Set<String> selectedIds, ReviewFilter filter) {
        this.matches = List.copyOf(matches);
        this.positions = indexById(this.matches);
        this.selectedIds = Collections.unmodifiableSet(new LinkedHashSet<>(selectedIds));
        this.filter = Objects.requireNonNull(filter, "filter is required");
    }

    private ReviewState(List<FuzzyMatchForReview> matches, Map<String, Integer> positions,
                        Set<String> selectedIds, ReviewFilter filter) {
        this.matches = matches;
        this.positions = positions;
        this.selectedIds = selectedIds;
        this.filter = filter;
    }

    /**
     * Builds the initial state for a batch of fuzzy matches: all pending, nothing selected, no filter.
     */
    public static ReviewState initial(List<FuzzyMatch> fuzzyMatches) {
        List<FuzzyMatchForReview> loaded = new ArrayList<>();
        if (fuzzyMatches != null) {
            for (int i = 0; i < fuzzyMatches.size(); i++) {
                loaded.add(FuzzyMatchForReview.from(fuzzyMatches.get(i), i));
            }
        }
        return new ReviewState(loaded, Set.of(), ReviewFilter.empty());
    }

    public List<FuzzyMatchForReview> getMatches() {
        return matches;
    }

    /**
     * The match with the given ID, or null if there is none.
     */
    public FuzzyMatchForReview getMatch(String id) {
        Integer position = positions.get(id);
        return position != null ? matches.get(position) : null;
    }

    /**
     * Load position of the match with the given ID, or -1 if there is none.
     */
    int indexOf(String id) {
        Integer position = positions.get(id);
        return position != null ? position : -1;
    }

    public boolean contains(String id) {
        return positions.containsKey(id);
    }

    public Set<String> getSelectedIds() {
        return selectedIds;
    }

    public ReviewFilter getFilter() {
        return filter;
    }

    /**
     * Matches passing the current filter, confidence descending then field name ascending.
     */
    public List<FuzzyMatchForReview> filteredMatches() {
        if (filteredMatches == null) {
            filteredMatches = filter.apply(matches);
        }
        return filteredMatches;
    }

    public ReviewStats stats() {
        if (stats == null) {
            stats = ReviewStats.of(matches);
        }
        return stats;
    }

    /**
     * True if any match has a decision.
     */
    public boolean hasChanges() {
        return stats().pending() < stats().totalMatches();
    }

    /**
     * True if no match is pending; an empty session is complete.
     */
    public boolean isComplete() {
        return stats().pending() == 0;
    }

    public boolean canBatchOperate() {
        return !selectedIds.isEmpty();
    }

    ReviewState withMatches(List<FuzzyMatchForReview> updated, Set<String> selection) {
        return new ReviewState(List.copyOf(updated), positions,
                Collections.unmodifiableSet(new LinkedHashSet<>(selection)), filter);
    }

    ReviewState withFilter(ReviewFilter newFilter, List<FuzzyMatchForReview> updated) {
        return new ReviewState(List.copyOf(updated), positions, Set.of(), newFilter);
    }

    private static Map<String, Integer> indexById(List<FuzzyMatchForReview> matches) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < matches.size(); i++) {
            index.putIfAbsent(matches.get(i).getId(), i);
        }
        return Collections.unmodifiableMap(index);
    }

    @Override
    public String toString() {
        return "ReviewState{" +
                "matches=" + matches.size() +
                ", selected=" + selectedIds.size() +
                ", filter=" + filter +
                '}';
    }
}
