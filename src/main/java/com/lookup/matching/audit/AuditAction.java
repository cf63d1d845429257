package com.lookup.matching.audit;

import com.lookup.matching.review.ReviewEventKind;

/**
 * Types of auditable review decisions.
 */
public enum AuditAction {
    MATCH_ACCEPTED,
    MATCH_REJECTED,
    MANUAL_VALUE_SET,
    BATCH_ACCEPTED,
    BATCH_REJECTED;

    public static AuditAction from(ReviewEventKind kind) {
        return switch (kind) {
            case ACCEPT -> MATCH_ACCEPTED;
            case REJECT -> MATCH_REJECTED;
            case MANUAL -> MANUAL_VALUE_SET;
            case BATCH_ACCEPT -> BATCH_ACCEPTED;
            case BATCH_REJECT -> BATCH_REJECTED;
        };
    }
}
