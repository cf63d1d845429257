package com.lookup.matching.lookup;

import com.lookup.matching.core.model.LookupResult;
import com.lookup.matching.core.model.LookupSuggestion;
import com.lookup.matching.core.model.MatchType;
import com.lookup.matching.review.FuzzyMatch;
import com.lookup.matching.store.ReferenceDatasetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs lookups for imported values against stored reference datasets.
 * Unresolved values become {@link LookupError}s; low-confidence fuzzy matches are
 * collected as {@link FuzzyMatch}es, the input of a review session.
 * Processing never aborts on a bad value.
 */
public class LookupProcessor {
    private static final Logger log = LoggerFactory.getLogger(LookupProcessor.class);

    private final LookupMatchingEngine engine;
    private final ReferenceDatasetStore store;

    public LookupProcessor(LookupMatchingEngine engine, ReferenceDatasetStore store) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.store = Objects.requireNonNull(store, "store is required");
    }

    public ProcessedLookupResult process(List<LookupField> fields, List<LookupRequest> requests) {
        return process(fields, requests, ProcessingOptions.defaults(), ProgressCallback.NOOP);
    }

    /**
     * Resolves every request through the lookup field bound to its field name.
     *
     * @param fields   lookup field bindings
     * @param requests values to resolve
     * @param options  review collection options
     * @param callback progress callback, invoked after each request
     * @return results, errors, stats and review candidates
     */
    public ProcessedLookupResult process(List<LookupField> fields, List<LookupRequest> requests,
                                         ProcessingOptions options, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        ProcessingOptions opts = options != null ? options : ProcessingOptions.defaults();
        List<LookupRequest> pending = requests != null ? requests : List.of();

        Map<String, LookupField> fieldsByName = new HashMap<>();
        if (fields != null) {
            for (LookupField field : fields) {
                fieldsByName.put(field.fieldName(), field);
            }
        }

        Map<String, LookupResult> results = new LinkedHashMap<>();
        List<LookupError> errors = new ArrayList<>();
        List<FuzzyMatch> fuzzyMatches = new ArrayList<>();
        Map<MatchType, Integer> counts = new HashMap<>();
        int derived = 0;
        int total = pending.size();

        for (int i = 0; i < total; i++) {
            LookupRequest request = pending.get(i);
            LookupField field = fieldsByName.get(request.fieldName());

            if (field == null) {
                errors.add(error(request, LookupErrorType.INVALID_INPUT,
                        "No lookup field named \"" + request.fieldName() + "\"", List.of()));
                counts.merge(MatchType.NONE, 1, Integer::sum);
            } else if (!store.exists(field.datasetId())) {
                errors.add(error(request, LookupErrorType.REFERENCE_MISSING,
                        "Reference dataset \"" + field.datasetId() + "\" not found", List.of()));
                counts.merge(MatchType.NONE, 1, Integer::sum);
            } else {
                LookupResult result = engine.lookup(field.datasetId(), request.inputValue(), field.config());
                results.put(ProcessedLookupResult.resultKey(request.rowId(), request.fieldName()), result);
                counts.merge(result.getMatchType(), 1, Integer::sum);
                derived += result.getDerivedValues().size();

                if (!result.isMatched()) {
                    errors.add(error(request, LookupErrorType.NO_MATCH,
                            "No match found for \"" + request.inputValue() + "\" in " + field.datasetId(),
                            result.getSuggestions().stream().map(LookupSuggestion::matchedText).toList()));
                } else if (result.getMatchType() == MatchType.FUZZY
                        && result.getConfidence() < opts.minConfidence()
                        && fuzzyMatches.size() < opts.maxFuzzyMatches()) {
                    fuzzyMatches.add(new FuzzyMatch(request.rowId(), request.fieldName(), request.inputValue(),
                            result.getMatchedValue().asText(), result.getConfidence()));
                }
            }
            cb.onProgress(i + 1, total);
        }

        int exact = counts.getOrDefault(MatchType.EXACT, 0);
        int normalized = counts.getOrDefault(MatchType.NORMALIZED, 0);
        int fuzzy = counts.getOrDefault(MatchType.FUZZY, 0);
        int none = counts.getOrDefault(MatchType.NONE, 0);
        double successRate = total > 0 ? (double) (exact + normalized + fuzzy) / total : 0.0;
        LookupStats stats = new LookupStats(total, exact, normalized, fuzzy, none, derived, successRate);

        log.info("lookup.processing.completed requests={} matched={} errors={} reviewItems={}",
                total, stats.matched(), errors.size(), fuzzyMatches.size());

        return new ProcessedLookupResult(results, errors, stats, fuzzyMatches);
    }

    private static LookupError error(LookupRequest request, LookupErrorType type, String message,
                                     List<String> suggestions) {
        log.debug("lookup.processing.error rowId={} field={} type={}", request.rowId(), request.fieldName(), type);
        return new LookupError(request.rowId(), request.fieldName(), request.inputValue(), type, message, suggestions);
    }
}
