package com.lookup.matching.similarity;

import com.lookup.matching.normalization.NormalizationOptions;
import com.lookup.matching.normalization.StringNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Top-K fuzzy search over a list of candidate strings.
 *
 * <p>The target is normalized once. Each candidate then goes through three gates
 * before it is scored:</p>
 * <ul>
 *   <li>non-string and empty candidates are skipped</li>
 *   <li>a normalized-equal candidate is taken with similarity 1.0 without scoring</li>
 *   <li>a candidate whose normalized length ratio to the target is below
 *       {@value #MIN_LENGTH_RATIO} is pruned without scoring</li>
 * </ul>
 */
public class BestMatchFinder {

    public static final double DEFAULT_THRESHOLD = 0.6;
    public static final int DEFAULT_MAX_RESULTS = 5;
    static final double MIN_LENGTH_RATIO = 0.2;

    private final CompositeSimilarityScorer scorer;
    private final StringNormalizer normalizer;

    public BestMatchFinder() {
        this(new CompositeSimilarityScorer(), new StringNormalizer());
    }

    public BestMatchFinder(CompositeSimilarityScorer scorer) {
        this(scorer, new StringNormalizer());
    }

    public BestMatchFinder(CompositeSimilarityScorer scorer, StringNormalizer normalizer) {
        this.scorer = scorer;
        this.normalizer = normalizer;
    }

    /**
     * Finds up to {@value #DEFAULT_MAX_RESULTS} matches scoring at least {@value #DEFAULT_THRESHOLD}.
     */
    public List<CandidateMatch> findBestMatches(String target, List<?> candidates) {
        return findBestMatches(target, candidates, DEFAULT_THRESHOLD, DEFAULT_MAX_RESULTS);
    }

    /**
     * Finds the best matches for {@code target} among {@code candidates}.
     *
     * @param target     the value to match
     * @param candidates candidate values; entries that are not non-empty strings are ignored
     * @param threshold  minimum similarity to keep
     * @param maxResults maximum number of results
     * @return matches sorted by similarity, highest first; ties keep candidate order
     */
    public List<CandidateMatch> findBestMatches(String target, List<?> candidates, double threshold, int maxResults) {
        if (target == null || candidates == null || candidates.isEmpty() || maxResults <= 0) {
            return List.of();
        }

        String normalizedTarget = normalizer.normalize(target);
        List<CandidateMatch> results = new ArrayList<>();

        for (int i = 0; i < candidates.size(); i++) {
            if (!(candidates.get(i) instanceof String candidate) || candidate.isEmpty()) {
                continue;
            }

            String normalizedCandidate = normalizer.normalize(candidate);

            if (normalizedTarget.equals(normalizedCandidate)) {
                results.add(new CandidateMatch(candidate, 1.0, i));
                continue;
            }

            int shorter = Math.min(normalizedTarget.length(), normalizedCandidate.length());
            int longer = Math.max(normalizedTarget.length(), normalizedCandidate.length());
            if ((double) shorter / longer < MIN_LENGTH_RATIO) {
                continue;
            }

            double similarity = scorer.compute(normalizedTarget, normalizedCandidate);
            if (similarity >= threshold) {
                results.add(new CandidateMatch(candidate, similarity, i));
            }
        }

        results.sort(Comparator.comparingDouble(CandidateMatch::similarity).reversed());
        return results.size() > maxResults ? List.copyOf(results.subList(0, maxResults)) : List.copyOf(results);
    }

    /**
     * Creates a finder with explicit normalization options and weights.
     */
    public static BestMatchFinder withNormalization(NormalizationOptions options, SimilarityWeights weights) {
        return new BestMatchFinder(new CompositeSimilarityScorer(weights), new StringNormalizer(options));
    }
}
