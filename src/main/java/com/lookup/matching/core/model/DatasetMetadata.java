package com.lookup.matching.core.model;

import java.util.List;

/**
 * Shape of a stored reference dataset.
 *
 * @param datasetId the dataset identifier
 * @param name      display name
 * @param columns   declared columns, in order
 * @param rowCount  number of rows
 */
public record DatasetMetadata(String datasetId, String name, List<String> columns, int rowCount) {
    public DatasetMetadata {
        columns = columns != null ? List.copyOf(columns) : List.of();
    }
}
