package com.lookup.matching.lookup;

/**
 * Callback interface for tracking progress of batch lookups.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called to report progress.
     *
     * @param processed the number of inputs processed so far
     * @param total     the total number of inputs
     */
    void onProgress(long processed, long total);

    /**
     * A no-op progress callback.
     */
    ProgressCallback NOOP = (processed, total) -> {};
}
