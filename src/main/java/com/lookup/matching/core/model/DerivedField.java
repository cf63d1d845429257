package com.lookup.matching.core.model;

/**
 * An "also get" mapping: copy {@code sourceColumn} of the matched reference row
 * into the result under {@code targetFieldName}.
 */
public record DerivedField(String sourceColumn, String targetFieldName) {

    public static DerivedField of(String sourceColumn, String targetFieldName) {
        return new DerivedField(sourceColumn, targetFieldName);
    }
}
