package com.lookup.matching.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composite similarity scorer that combines multiple algorithms with configurable weights.
 * Formula: score = w1*levenshtein + w2*jaro + w3*jaroWinkler, with weights rescaled to sum to 1.
 */
public class CompositeSimilarityScorer implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(CompositeSimilarityScorer.class);

    private final LevenshteinSimilarity levenshtein;
    private final JaroSimilarity jaro;
    private final JaroWinklerSimilarity jaroWinkler;
    private final SimilarityWeights weights;

    public CompositeSimilarityScorer() {
        this(SimilarityWeights.defaultWeights());
    }

    public CompositeSimilarityScorer(SimilarityWeights weights) {
        this.levenshtein = new LevenshteinSimilarity();
        this.jaro = new JaroSimilarity();
        this.jaroWinkler = new JaroWinklerSimilarity();
        this.weights = weights.normalized();
    }

    @Override
    public double compute(String s1, String s2) {
        SimilarityBreakdown breakdown = computeWithBreakdown(s1, s2);
        log.debug("Similarity scores for '{}' vs '{}': {}", s1, s2, breakdown);
        return breakdown.compositeScore();
    }

    @Override
    public String getName() {
        return "Composite";
    }

    /**
     * Computes detailed similarity breakdown. The composite score is the value {@link #compute} returns.
     */
    public SimilarityBreakdown computeWithBreakdown(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return new SimilarityBreakdown(0.0, 0.0, 0.0, 0.0, weights);
        }

        double levScore = levenshtein.compute(s1, s2);
        double jaroScore = jaro.compute(s1, s2);
        double jwScore = jaroWinkler.compute(s1, s2);
        double compositeScore = weights.levenshteinWeight() * levScore
                + weights.jaroWeight() * jaroScore
                + weights.jaroWinklerWeight() * jwScore;

        // Rescaled weights may sum to a hair over 1.0
        return new SimilarityBreakdown(levScore, jaroScore, jwScore, Math.min(1.0, compositeScore), weights);
    }

    /**
     * Gets the normalized weights in use.
     */
    public SimilarityWeights getWeights() {
        return weights;
    }

    /**
     * Detailed breakdown of similarity scores from each algorithm.
     */
    public record SimilarityBreakdown(
            double levenshteinScore,
            double jaroScore,
            double jaroWinklerScore,
            double compositeScore,
            SimilarityWeights weights
    ) {
        @Override
        public String toString() {
            return String.format(
                    "SimilarityBreakdown{levenshtein=%.4f (w=%.2f), jaro=%.4f (w=%.2f), jaroWinkler=%.4f (w=%.2f), composite=%.4f}",
                    levenshteinScore, weights.levenshteinWeight(),
                    jaroScore, weights.jaroWeight(),
                    jaroWinklerScore, weights.jaroWinklerWeight(),
                    compositeScore
            );
        }
    }
}
