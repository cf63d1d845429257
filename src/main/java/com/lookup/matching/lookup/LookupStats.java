package com.lookup.matching.lookup;

/**
 * Counts for one processing run.
 *
 * @param totalRequests     requests processed
 * @param exactMatches      exact-tier matches
 * @param normalizedMatches normalized-tier matches
 * @param fuzzyMatches      fuzzy-tier matches
 * @param noMatches         requests left unresolved, errors included
 * @param derivedValues     derived values populated across all matches
 * @param successRate       matched / total, 0 when nothing was processed
 */
public record LookupStats(
        int totalRequests,
        int exactMatches,
        int normalizedMatches,
        int fuzzyMatches,
        int noMatches,
        int derivedValues,
        double successRate
) {
    public static LookupStats empty() {
        return new LookupStats(0, 0, 0, 0, 0, 0, 0.0);
    }

    public int matched() {
        return exactMatches + normalizedMatches + fuzzyMatches;
    }
}
