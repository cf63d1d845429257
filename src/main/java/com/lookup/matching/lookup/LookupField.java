package com.lookup.matching.lookup;

import com.lookup.matching.core.model.MatchConfig;

import java.util.Objects;

/**
 * Binds an import field to the reference dataset and match settings used to resolve it.
 *
 * @param fieldName the import field name
 * @param datasetId the reference dataset ID
 * @param config    columns, threshold and derived fields
 */
public record LookupField(String fieldName, String datasetId, MatchConfig config) {

    public LookupField {
        Objects.requireNonNull(fieldName, "fieldName is required");
        Objects.requireNonNull(datasetId, "datasetId is required");
        Objects.requireNonNull(config, "config is required");
    }
}
