package com.lookup.matching.lookup;

import com.lookup.matching.cache.LookupCache;
import com.lookup.matching.cache.NoOpLookupCache;
import com.lookup.matching.core.model.DerivedField;
import com.lookup.matching.core.model.LookupResult;
import com.lookup.matching.core.model.LookupSuggestion;
import com.lookup.matching.core.model.MatchConfig;
import com.lookup.matching.core.model.MatchType;
import com.lookup.matching.core.model.ReferenceDataset;
import com.lookup.matching.core.model.ReferenceRow;
import com.lookup.matching.logging.LogContext;
import com.lookup.matching.metrics.MetricsService;
import com.lookup.matching.metrics.NoOpMetricsService;
import com.lookup.matching.normalization.NormalizationOptions;
import com.lookup.matching.normalization.StringNormalizer;
import com.lookup.matching.similarity.BestMatchFinder;
import com.lookup.matching.similarity.CandidateMatch;
import com.lookup.matching.similarity.CompositeSimilarityScorer;
import com.lookup.matching.store.ReferenceDatasetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves an input value against reference rows in tiers, first hit wins:
 * <ol>
 *   <li><b>exact</b>: verbatim equality with the source column, confidence 1.0</li>
 *   <li><b>normalized</b>: equality after normalization, fixed confidence
 *       ({@link LookupOptions#getNormalizedConfidence()})</li>
 *   <li><b>fuzzy</b>: best composite-similarity candidate at or above the configured
 *       threshold, confidence = similarity</li>
 *   <li><b>none</b>: not matched, confidence 0</li>
 * </ol>
 *
 * <p>Derived fields are copied from the winning row only. Rows that lack the source
 * value or the target column are not candidates; they never abort the scan.
 * Lookups do not modify their inputs.</p>
 */
public class LookupMatchingEngine {
    private static final Logger log = LoggerFactory.getLogger(LookupMatchingEngine.class);

    // Suggestions are gathered down to this similarity even when the match threshold is higher
    private static final double SUGGESTION_FLOOR = 0.1;
    private static final NormalizationOptions PUNCTUATION_INSENSITIVE = NormalizationOptions.builder()
            .removeNonAlphanumeric(true)
            .build();

    private final ReferenceDatasetStore store;
    private final LookupOptions options;
    private final LookupCache cache;
    private final MetricsService metrics;
    private final StringNormalizer normalizer;
    private final BestMatchFinder matchFinder;
    private final CompositeSimilarityScorer scorer;

    public LookupMatchingEngine() {
        this(LookupOptions.defaults());
    }

    public LookupMatchingEngine(LookupOptions options) {
        this(null, options, new NoOpLookupCache(), new NoOpMetricsService());
    }

    public LookupMatchingEngine(ReferenceDatasetStore store) {
        this(store, LookupOptions.defaults(), new NoOpLookupCache(), new NoOpMetricsService());
    }

    public LookupMatchingEngine(ReferenceDatasetStore store, LookupOptions options,
                                LookupCache cache, MetricsService metrics) {
        this.store = store;
        this.options = options != null ? options : LookupOptions.defaults();
        this.cache = cache != null ? cache : new NoOpLookupCache();
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.normalizer = new StringNormalizer(this.options.getNormalization());
        this.scorer = new CompositeSimilarityScorer(this.options.getSimilarityWeights());
        this.matchFinder = new BestMatchFinder(scorer, normalizer);
    }

    /**
     * Looks up a value in a stored dataset.
     * A missing dataset, or an engine built without a store, yields no match.
     *
     * @param datasetId  the reference dataset ID
     * @param inputValue the value to resolve
     * @param config     columns, threshold and derived fields
     * @return the lookup result, never null
     */
    public LookupResult lookup(String datasetId, String inputValue, MatchConfig config) {
        String sourceColumn = config != null ? config.sourceColumn() : null;
        try (LogContext ctx = LogContext.forLookup(datasetId, sourceColumn)) {
            boolean cacheable = datasetId != null && config != null;
            if (cacheable) {
                Optional<LookupResult> cached = cache.get(datasetId, config, inputValue);
                if (cached.isPresent()) {
                    metrics.recordCacheHit();
                    return cached.get();
                }
                metrics.recordCacheMiss();
            }

            List<ReferenceRow> rows = store != null ? store.getRows(datasetId) : null;
            if (rows == null) {
                log.debug("lookup.dataset.missing datasetId={}", datasetId);
                return LookupResult.noMatch(inputValue);
            }

            LookupResult result = performLookup(inputValue, rows, config);
            if (cacheable) {
                cache.put(datasetId, config, inputValue, result);
            }
            return result;
        }
    }

    /**
     * Looks up a value in the given dataset. A null dataset yields no match.
     */
    public LookupResult performLookup(String inputValue, ReferenceDataset dataset, MatchConfig config) {
        return performLookup(inputValue, dataset != null ? dataset.getRows() : null, config);
    }

    /**
     * Looks up a value in the given rows.
     *
     * @param inputValue the value to resolve
     * @param rows       reference rows; null or empty yields no match
     * @param config     columns, threshold and derived fields
     * @return the lookup result, never null
     */
    public LookupResult performLookup(String inputValue, List<ReferenceRow> rows, MatchConfig config) {
        long start = System.nanoTime();
        LookupResult result = match(inputValue, rows, config);

        metrics.recordLookupDuration(result.getMatchType(), Duration.ofNanos(System.nanoTime() - start));
        if (result.isMatched()) {
            metrics.recordConfidence(result.getConfidence());
        }
        log.debug("lookup.completed input='{}' matchType={} confidence={}",
                inputValue, result.getMatchType(), result.getConfidence());
        return result;
    }

    /**
     * Looks up every input against the same rows, in order.
     *
     * @param inputValues values to resolve
     * @param rows        reference rows
     * @param config      columns, threshold and derived fields
     * @param callback    progress callback, invoked every {@link LookupOptions#getBatchSize()} inputs and at the end
     * @return the results in input order with aggregate metrics
     */
    public BatchLookupResult batchLookup(List<String> inputValues, List<ReferenceRow> rows,
                                         MatchConfig config, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<String> inputs = inputValues != null ? inputValues : List.of();
        int total = inputs.size();
        int batchSize = options.getBatchSize();

        try (LogContext ctx = LogContext.forBatch(LogContext.generateCorrelationId())) {
            long start = System.nanoTime();
            List<LookupResult> results = new ArrayList<>(total);
            Map<MatchType, Integer> counts = new EnumMap<>(MatchType.class);
            int matched = 0;

            for (int i = 0; i < total; i++) {
                LookupResult result = performLookup(inputs.get(i), rows, config);
                results.add(result);
                counts.merge(result.getMatchType(), 1, Integer::sum);
                if (result.isMatched()) {
                    matched++;
                }
                int processed = i + 1;
                if (processed % batchSize == 0 || processed == total) {
                    cb.onProgress(processed, total);
                }
            }

            long elapsedNanos = System.nanoTime() - start;
            metrics.recordBatchSize(total);

            Duration totalTime = Duration.ofNanos(elapsedNanos);
            Duration averageTime = total > 0 ? totalTime.dividedBy(total) : Duration.ZERO;
            double matchRate = total > 0 ? (double) matched / total : 0.0;
            double throughput = elapsedNanos > 0 ? total / (elapsedNanos / 1_000_000_000.0) : 0.0;

            log.info("lookup.batch.completed total={} matched={} durationMs={}",
                    total, matched, totalTime.toMillis());

            return new BatchLookupResult(results,
                    new BatchLookupResult.BatchMetrics(totalTime, averageTime, matchRate, throughput, counts));
        }
    }

    /**
     * Composite similarity between two raw strings, using this engine's weights.
     */
    public double calculateSimilarity(String s1, String s2) {
        return scorer.compute(s1, s2);
    }

    public LookupOptions getOptions() {
        return options;
    }

    private LookupResult match(String inputValue, List<ReferenceRow> rows, MatchConfig config) {
        if (inputValue == null || inputValue.isEmpty()) {
            return LookupResult.noMatch(inputValue);
        }
        if (rows == null || rows.isEmpty()) {
            return LookupResult.noMatch(inputValue);
        }
        if (config == null || !config.hasColumns()) {
            log.warn("Match config is missing a source or target column, no rows can match: {}", config);
            return LookupResult.noMatch(inputValue);
        }

        String source = config.sourceColumn();
        String target = config.targetColumn();

        // Exact tier, no normalization needed
        for (ReferenceRow row : rows) {
            String text = candidateText(row, source, target);
            if (text != null && text.equals(inputValue)) {
                return success(inputValue, row, config, 1.0, MatchType.EXACT);
            }
        }

        // Normalized tier; candidates are collected here for the fuzzy tier
        String normalizedInput = normalizer.normalize(inputValue);
        List<ReferenceRow> candidateRows = new ArrayList<>();
        List<String> candidateTexts = new ArrayList<>();
        for (ReferenceRow row : rows) {
            String text = candidateText(row, source, target);
            if (text == null) {
                continue;
            }
            if (normalizedInput.equals(normalizer.normalize(text))) {
                return success(inputValue, row, config, options.getNormalizedConfidence(), MatchType.NORMALIZED);
            }
            candidateRows.add(row);
            candidateTexts.add(text);
        }

        if (!options.isFuzzyMatchingEnabled() || candidateTexts.isEmpty()) {
            return LookupResult.noMatch(inputValue);
        }
        return fuzzyMatch(inputValue, candidateRows, candidateTexts, config);
    }

    private LookupResult fuzzyMatch(String inputValue, List<ReferenceRow> candidateRows,
                                    List<String> candidateTexts, MatchConfig config) {
        int maxSuggestions = options.getMaxSuggestions();
        double threshold = config.fuzzyThreshold();
        double searchThreshold = maxSuggestions > 0 ? Math.min(SUGGESTION_FLOOR, threshold) : threshold;

        List<CandidateMatch> matches = matchFinder.findBestMatches(
                inputValue, candidateTexts, searchThreshold, maxSuggestions + 1);

        CandidateMatch best = !matches.isEmpty() && matches.get(0).similarity() >= threshold
                ? matches.get(0)
                : null;

        List<LookupSuggestion> suggestions = new ArrayList<>();
        for (CandidateMatch match : matches) {
            if (match == best || suggestions.size() >= maxSuggestions) {
                continue;
            }
            ReferenceRow row = candidateRows.get(match.index());
            suggestions.add(new LookupSuggestion(row.get(config.targetColumn()), match.value(),
                    match.similarity(), suggestionReason(match.similarity(), inputValue, match.value())));
        }

        if (best == null) {
            return LookupResult.noMatch(inputValue, suggestions);
        }

        ReferenceRow bestRow = candidateRows.get(best.index());
        return successBuilder(inputValue, bestRow, config, best.similarity(), MatchType.FUZZY)
                .suggestions(suggestions)
                .build();
    }

    private LookupResult success(String inputValue, ReferenceRow row, MatchConfig config,
                                 double confidence, MatchType matchType) {
        return successBuilder(inputValue, row, config, confidence, matchType).build();
    }

    private LookupResult.Builder successBuilder(String inputValue, ReferenceRow row, MatchConfig config,
                                                double confidence, MatchType matchType) {
        LookupResult.Builder builder = LookupResult.builder()
                .inputValue(inputValue)
                .matchType(matchType)
                .confidence(confidence)
                .matchedValue(row.get(config.targetColumn()))
                .matchedRow(row);

        for (DerivedField field : config.alsoGet()) {
            if (field.targetFieldName() == null) {
                continue;
            }
            if (row.hasColumn(field.sourceColumn())) {
                builder.derivedValue(field.targetFieldName(), row.get(field.sourceColumn()));
            }
        }
        return builder;
    }

    /**
     * Text of the source column if the row can be a candidate, else null.
     */
    private static String candidateText(ReferenceRow row, String sourceColumn, String targetColumn) {
        if (row == null || !row.hasColumn(targetColumn)) {
            return null;
        }
        return row.getText(sourceColumn);
    }

    private static String suggestionReason(double confidence, String input, String candidate) {
        if (confidence >= 0.9) {
            return "Very similar spelling";
        } else if (confidence >= 0.8) {
            return "Similar spelling";
        } else if (confidence >= 0.7) {
            return "Possible match";
        } else if (input.trim().equalsIgnoreCase(candidate.trim())) {
            return "Case difference";
        } else if (StringNormalizer.normalize(input, PUNCTUATION_INSENSITIVE)
                .equals(StringNormalizer.normalize(candidate, PUNCTUATION_INSENSITIVE))) {
            return "Spacing or punctuation difference";
        }
        return "Partial match";
    }
}
