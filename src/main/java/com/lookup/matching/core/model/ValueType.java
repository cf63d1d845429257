package com.lookup.matching.core.model;

/**
 * Scalar kinds a reference cell may hold.
 */
public enum ValueType {
    STRING,
    NUMBER,
    BOOLEAN,
    NULL
}
