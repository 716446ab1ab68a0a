package com.phillippitts.voxbank.domain;

/**
 * Per-word outcome of cache lookup and generation.
 */
public enum GenerationStatus {
    /** Clip was already in the word bank. */
    CACHED,
    /** Clip was synthesized and written to the word bank during this request. */
    GENERATED,
    /** Synthesis was attempted and failed. */
    FAILED,
    /** Word was not attempted (cache-only mode, cancellation). */
    SKIPPED
}
