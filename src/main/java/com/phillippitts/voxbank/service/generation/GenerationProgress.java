package com.phillippitts.voxbank.service.generation;

/**
 * Snapshot of per-word counters of one generation run.
 *
 * @param total distinct words in the request
 * @param cached words found in the word bank
 * @param generated words synthesized and stored
 * @param failed words that could not be synthesized
 */
public record GenerationProgress(int total, int cached, int generated, int failed) {

    public int completed() {
        return cached + generated + failed;
    }

    public int pending() {
        return total - completed();
    }
}
