package com.lookup.matching.lookup;

import com.lookup.matching.core.model.LookupResult;
import com.lookup.matching.review.FuzzyMatch;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of processing a set of lookup requests.
 *
 * @param results      lookup result per request, keyed by {@code rowId + "/" + fieldName}, in request order
 * @param errors       unresolved values
 * @param stats        tier counts and success rate
 * @param fuzzyMatches low-confidence fuzzy matches queued for review
 */
public record ProcessedLookupResult(
        Map<String, LookupResult> results,
        List<LookupError> errors,
        LookupStats stats,
        List<FuzzyMatch> fuzzyMatches
) {
    public ProcessedLookupResult {
        results = results != null ? Collections.unmodifiableMap(results) : Map.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
        fuzzyMatches = fuzzyMatches != null ? List.copyOf(fuzzyMatches) : List.of();
    }

    public static String resultKey(String rowId, String fieldName) {
        return rowId + "/" + fieldName;
    }

    public LookupResult result(String rowId, String fieldName) {
        return results.get(resultKey(rowId, fieldName));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
