package com.lookup.matching.core.model;

/**
 * Tier at which a lookup found its match. Tiers are tried in declaration order
 * and the first hit wins.
 */
public enum MatchType {
    /**
     * Input equals the reference value verbatim. Confidence 1.0.
     */
    EXACT,

    /**
     * Input equals the reference value after case, accent and whitespace normalization.
     */
    NORMALIZED,

    /**
     * Best composite-similarity candidate at or above the configured threshold.
     */
    FUZZY,

    /**
     * Nothing matched.
     */
    NONE
}
