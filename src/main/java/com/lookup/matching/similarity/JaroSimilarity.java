package com.lookup.matching.similarity;

/**
 * Jaro similarity algorithm.
 * Counts characters that match within a sliding window and penalizes transpositions,
 * which makes it kinder than Levenshtein to swapped letters in short names.
 */
public class JaroSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        int s1Length = s1.length();
        int s2Length = s2.length();

        int matchWindow = Math.max(s1Length, s2Length) / 2 - 1;
        if (matchWindow < 0) {
            return 0.0;
        }

        boolean[] s1Matches = new boolean[s1Length];
        boolean[] s2Matches = new boolean[s2Length];

        int matches = 0;
        int transpositions = 0;

        for (int i = 0; i < s1Length; i++) {
            int start = Math.max(0, i - matchWindow);
            int end = Math.min(i + matchWindow + 1, s2Length);

            for (int j = start; j < end; j++) {
                if (s2Matches[j] || s1.charAt(i) != s2.charAt(j)) {
                    continue;
                }
                s1Matches[i] = true;
                s2Matches[j] = true;
                matches++;
                break;
            }
        }

        if (matches == 0) {
            return 0.0;
        }

        int k = 0;
        for (int i = 0; i < s1Length; i++) {
            if (!s1Matches[i]) {
                continue;
            }
            while (!s2Matches[k]) {
                k++;
            }
            if (s1.charAt(i) != s2.charAt(k)) {
                transpositions++;
            }
            k++;
        }

        // Jaro formula: (m/|s1| + m/|s2| + (m-t/2)/m) / 3
        double m = matches;
        double t = transpositions / 2.0;
        return ((m / s1Length) + (m / s2Length) + ((m - t) / m)) / 3.0;
    }

    @Override
    public String getName() {
        return "Jaro";
    }
}
