package com.lookup.matching.review;

/**
 * Kinds of review decisions published to the host.
 */
public enum ReviewEventKind {
    ACCEPT,
    REJECT,
    MANUAL,
    BATCH_ACCEPT,
    BATCH_REJECT
}
