package com.lookup.matching.lookup;

import java.util.Objects;

/**
 * One value to resolve during import processing.
 *
 * @param rowId      the ID of the imported row
 * @param fieldName  the lookup field the value belongs to
 * @param inputValue the raw imported value, may be null
 */
public record LookupRequest(String rowId, String fieldName, String inputValue) {

    public LookupRequest {
        Objects.requireNonNull(rowId, "rowId is required");
        Objects.requireNonNull(fieldName, "fieldName is required");
    }
}
