package com.lookup.matching.review;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Filter over matches under review. Every dimension is optional: an unset dimension,
 * an empty field name or search term, or an empty status set, places no constraint on matches.
 */
public final class ReviewFilter {

    /**
     * Review listing order: confidence descending, then field name ascending.
     */
    public static final Comparator<FuzzyMatchForReview> REVIEW_ORDER =
            Comparator.comparingDouble(FuzzyMatchForReview::getConfidence).reversed()
                    .thenComparing(FuzzyMatchForReview::getFieldName);

    private static final ReviewFilter EMPTY = builder().build();

    private final ConfidenceRange confidenceRange;
    private final String fieldName;
    private final Set<ReviewStatus> statuses;
    private final String searchTerm;

    private ReviewFilter(Builder builder) {
        this.confidenceRange = builder.confidenceRange;
        this.fieldName = builder.fieldName;
        this.statuses = builder.statuses != null ? Set.copyOf(builder.statuses) : null;
        this.searchTerm = builder.searchTerm;
    }

    public static ReviewFilter empty() {
        return EMPTY;
    }

    public ConfidenceRange getConfidenceRange() {
        return confidenceRange;
    }

    public String getFieldName() {
        return fieldName;
    }

    /**
     * Allowed statuses, or null when unset.
     */
    public Set<ReviewStatus> getStatuses() {
        return statuses;
    }

    public String getSearchTerm() {
        return searchTerm;
    }

    public boolean isEmpty() {
        return confidenceRange == null && (fieldName == null || fieldName.isEmpty())
                && (statuses == null || statuses.isEmpty())
                && (searchTerm == null || searchTerm.isEmpty());
    }

    /**
     * Returns a filter with every dimension set in {@code partial} replacing this filter's value.
     * Dimensions left unset in {@code partial} keep their current value.
     */
    public ReviewFilter merge(ReviewFilter partial) {
        if (partial == null) {
            return this;
        }
        return builder()
                .confidenceRange(partial.confidenceRange != null ? partial.confidenceRange : confidenceRange)
                .fieldName(partial.fieldName != null ? partial.fieldName : fieldName)
                .statuses(partial.statuses != null ? partial.statuses : statuses)
                .searchTerm(partial.searchTerm != null ? partial.searchTerm : searchTerm)
                .build();
    }

    public boolean test(FuzzyMatchForReview match) {
        if (confidenceRange != null && !confidenceRange.contains(match.getConfidence())) {
            return false;
        }
        if (fieldName != null && !fieldName.isEmpty() && !fieldName.equals(match.getFieldName())) {
            return false;
        }
        if (statuses != null && !statuses.isEmpty() && !statuses.contains(match.getStatus())) {
            return false;
        }
        if (searchTerm != null && !searchTerm.isEmpty()) {
            return matchesSearch(match, searchTerm.toLowerCase(Locale.ROOT));
        }
        return true;
    }

    /**
     * Matches passing this filter, in {@link #REVIEW_ORDER}.
     */
    public List<FuzzyMatchForReview> apply(Collection<FuzzyMatchForReview> matches) {
        return matches.stream()
                .filter(this::test)
                .sorted(REVIEW_ORDER)
                .toList();
    }

    private static boolean matchesSearch(FuzzyMatchForReview match, String term) {
        if (containsIgnoreCase(match.getInputValue(), term)
                || containsIgnoreCase(match.getSuggestedValue(), term)) {
            return true;
        }
        for (ReviewSuggestion suggestion : match.getSuggestions()) {
            if (containsIgnoreCase(suggestion.value(), term)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsIgnoreCase(String value, String lowerTerm) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(lowerTerm);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReviewFilter that = (ReviewFilter) o;
        return Objects.equals(confidenceRange, that.confidenceRange)
                && Objects.equals(fieldName, that.fieldName)
                && Objects.equals(statuses, that.statuses)
                && Objects.equals(searchTerm, that.searchTerm);
    }

    @Override
    public int hashCode() {
        return Objects.hash(confidenceRange, fieldName, statuses, searchTerm);
    }

    @Override
    public String toString() {
        return "ReviewFilter{" +
                "confidenceRange=" + confidenceRange +
                ", fieldName='" + fieldName + '\'' +
                ", statuses=" + statuses +
                ", searchTerm='" + searchTerm + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ConfidenceRange confidenceRange;
        private String fieldName;
        private Set<ReviewStatus> statuses;
        private String searchTerm;

        public Builder confidenceRange(ConfidenceRange confidenceRange) {
            this.confidenceRange = confidenceRange;
            return this;
        }

        public Builder confidenceRange(double min, double max) {
            this.confidenceRange = new ConfidenceRange(min, max);
            return this;
        }

        public Builder fieldName(String fieldName) {
            this.fieldName = fieldName;
            return this;
        }

        public Builder statuses(Set<ReviewStatus> statuses) {
            this.statuses = statuses;
            return this;
        }

        public Builder status(ReviewStatus first, ReviewStatus... rest) {
            this.statuses = EnumSet.of(first, rest);
            return this;
        }

        public Builder searchTerm(String searchTerm) {
            this.searchTerm = searchTerm;
            return this;
        }

        public ReviewFilter build() {
            return new ReviewFilter(this);
        }
    }
}
