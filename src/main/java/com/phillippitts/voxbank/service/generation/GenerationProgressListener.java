package com.phillippitts.voxbank.service.generation;

/**
 * Push channel for generation progress. Invoked from worker threads, one call at a time,
 * after every counter change.
 */
@FunctionalInterface
public interface GenerationProgressListener {

    GenerationProgressListener NOOP = progress -> { };

    void onProgress(GenerationProgress progress);

    /**
     * Called once after the word bank lookup, before any provider call is made.
     *
     * @param cached distinct words found in the word bank
     * @param missing distinct words that need synthesis
     */
    default void onCacheChecked(int cached, int missing) {
    }
}
