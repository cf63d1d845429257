package com.lookup.matching.review;

/**
 * Review status of a fuzzy match. Every status other than {@link #PENDING} is a decision;
 * only a session-wide reset returns a match to pending.
 */
public enum ReviewStatus {
    PENDING,
    ACCEPTED,
    REJECTED,
    MANUAL
}
