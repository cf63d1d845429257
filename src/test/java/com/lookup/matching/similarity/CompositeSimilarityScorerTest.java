package com.lookup.matching.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class CompositeSimilarityScorerTest {

    private final CompositeSimilarityScorer composite = new CompositeSimilarityScorer();

    @Test
    @DisplayName("Identical strings score 1.0")
    void testIdentical() {
        assertEquals(1.0, composite.compute("Engineering", "Engineering"), 1e-9);
    }

    @Test
    @DisplayName("Null input scores 0")
    void testNull() {
        assertEquals(0.0, composite.compute(null, "Engineering"));
        assertEquals(0.0, composite.compute("Engineering", null));
    }

    @Test
    @DisplayName("Score is the weighted sum of the three algorithms")
    void testWeightedSum() {
        String a = "enginering";
        String b = "engineering";
        double expected = 0.4 * new LevenshteinSimilarity().compute(a, b)
                + 0.3 * new JaroSimilarity().compute(a, b)
                + 0.3 * new JaroWinklerSimilarity().compute(a, b);

        assertEquals(expected, composite.compute(a, b), 1e-9);
    }

    @Test
    @DisplayName("Weights are rescaled to sum to 1")
    void testWeightsRescaled() {
        CompositeSimilarityScorer doubled = new CompositeSimilarityScorer(new SimilarityWeights(0.8, 0.6, 0.6));

        SimilarityWeights weights = doubled.getWeights();
        assertEquals(1.0, weights.levenshteinWeight() + weights.jaroWeight() + weights.jaroWinklerWeight(), 1e-9);
        assertEquals(composite.compute("Finance", "Finanse"), doubled.compute("Finance", "Finanse"), 1e-9);
    }

    @Test
    @DisplayName("Breakdown exposes per-algorithm scores")
    void testBreakdown() {
        CompositeSimilarityScorer.SimilarityBreakdown breakdown = composite.computeWithBreakdown("MARTHA", "MARHTA");

        assertEquals(0.944, breakdown.jaroScore(), 0.001);
        assertEquals(0.961, breakdown.jaroWinklerScore(), 0.001);
        assertEquals(composite.compute("MARTHA", "MARHTA"), breakdown.compositeScore(), 1e-9);
    }

    @ParameterizedTest(name = "{0} vs {1}")
    @DisplayName("Breakdown composite is exactly the score compute returns")
    @CsvSource({
            "Engineering, Engineering",
            "enginering, engineering",
            "Finance, Finanse",
            "abc, xyz",
            ", Engineering"
    })
    void testBreakdownAgreesWithCompute(String a, String b) {
        CompositeSimilarityScorer thirds = new CompositeSimilarityScorer(new SimilarityWeights(0.1, 0.1, 0.1));

        for (CompositeSimilarityScorer scorer : new CompositeSimilarityScorer[]{composite, thirds}) {
            double score = scorer.compute(a, b);
            assertEquals(score, scorer.computeWithBreakdown(a, b).compositeScore());
            assertTrue(score <= 1.0);
        }
    }

    @Test
    @DisplayName("Negative or all-zero weights are rejected")
    void testInvalidWeights() {
        assertThrows(IllegalArgumentException.class, () -> new SimilarityWeights(-0.1, 0.5, 0.6));
        assertThrows(IllegalArgumentException.class, () -> new SimilarityWeights(0, 0, 0));
    }
}
