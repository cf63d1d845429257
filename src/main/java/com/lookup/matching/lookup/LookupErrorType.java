package com.lookup.matching.lookup;

/**
 * Reasons a value could not be resolved during processing.
 */
public enum LookupErrorType {
    /** No tier produced a match. */
    NO_MATCH,
    /** The field's reference dataset is not in the store. */
    REFERENCE_MISSING,
    /** The request names a field with no lookup binding. */
    INVALID_INPUT
}
