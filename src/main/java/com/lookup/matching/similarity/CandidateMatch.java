package com.lookup.matching.similarity;

/**
 * A candidate that scored at or above the search threshold.
 *
 * @param value      the original (un-normalized) candidate string
 * @param similarity composite similarity in [0, 1]
 * @param index      position of the candidate in the searched list
 */
public record CandidateMatch(String value, double similarity, int index) {
}
