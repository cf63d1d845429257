package com.lookup.matching.similarity;

/**
 * Jaro-Winkler similarity algorithm.
 * Boosts the Jaro score of strings sharing a prefix, but only once the
 * base score reaches {@value #BOOST_THRESHOLD}.
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    private static final double DEFAULT_PREFIX_SCALE = 0.1;
    private static final double BOOST_THRESHOLD = 0.7;
    private static final int MAX_PREFIX_LENGTH = 4;

    private final JaroSimilarity jaro;
    private final double prefixScale;

    public JaroWinklerSimilarity() {
        this(DEFAULT_PREFIX_SCALE);
    }

    public JaroWinklerSimilarity(double prefixScale) {
        if (prefixScale < 0 || prefixScale > 0.25) {
            throw new IllegalArgumentException("Prefix scale must be between 0 and 0.25");
        }
        this.jaro = new JaroSimilarity();
        this.prefixScale = prefixScale;
    }

    @Override
    public double compute(String s1, String s2) {
        double jaroScore = jaro.compute(s1, s2);
        if (jaroScore < BOOST_THRESHOLD) {
            return jaroScore;
        }

        int prefixLength = 0;
        int maxPrefixLength = Math.min(MAX_PREFIX_LENGTH, Math.min(s1.length(), s2.length()));
        while (prefixLength < maxPrefixLength && s1.charAt(prefixLength) == s2.charAt(prefixLength)) {
            prefixLength++;
        }

        // Jaro-Winkler formula: jw = jaro + (prefix * scale * (1 - jaro))
        return jaroScore + (prefixLength * prefixScale * (1.0 - jaroScore));
    }

    @Override
    public String getName() {
        return "Jaro-Winkler";
    }

    public double getPrefixScale() {
        return prefixScale;
    }
}
