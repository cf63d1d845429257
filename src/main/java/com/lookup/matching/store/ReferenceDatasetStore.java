package com.lookup.matching.store;

import com.lookup.matching.core.model.DatasetMetadata;
import com.lookup.matching.core.model.ReferenceDataset;
import com.lookup.matching.core.model.ReferenceRow;

import java.util.List;

/**
 * Store of named reference datasets.
 * The lookup engine only reads through {@link #getRows} and {@link #getMetadata};
 * the remaining operations belong to the host application managing the data.
 */
public interface ReferenceDatasetStore {

    /**
     * Gets the rows of a dataset.
     *
     * @param datasetId the dataset ID
     * @return the rows, or null if the dataset does not exist
     */
    List<ReferenceRow> getRows(String datasetId);

    /**
     * Gets the shape of a dataset.
     *
     * @param datasetId the dataset ID
     * @return the metadata, or null if the dataset does not exist
     */
    DatasetMetadata getMetadata(String datasetId);

    /**
     * Gets a whole dataset.
     *
     * @param datasetId the dataset ID
     * @return the dataset, or null if it does not exist
     */
    ReferenceDataset get(String datasetId);

    /**
     * Saves a dataset, replacing any existing dataset with the same ID.
     *
     * @param dataset the dataset to store
     * @return the stored dataset
     */
    ReferenceDataset save(ReferenceDataset dataset);

    /**
     * Deletes a dataset.
     *
     * @param datasetId the dataset ID
     * @return true if a dataset was removed
     */
    boolean delete(String datasetId);

    /**
     * Checks whether a dataset exists.
     */
    boolean exists(String datasetId);

    /**
     * Lists the metadata of all stored datasets, ordered by ID.
     */
    List<DatasetMetadata> list();

    /**
     * Removes every dataset.
     */
    void clear();

    /**
     * Registers a listener for dataset changes.
     */
    void addChangeListener(DatasetChangeListener listener);
}
