package com.lookup.matching.store;

/**
 * Listener notified when a stored reference dataset is replaced or removed.
 * Used to invalidate cached lookup results that read the old rows.
 */
@FunctionalInterface
public interface DatasetChangeListener {

    /**
     * Called after a dataset has been saved, replaced or deleted.
     *
     * @param datasetId the affected dataset
     */
    void onDatasetChanged(String datasetId);
}
