package com.phillippitts.voxbank.domain;

/**
 * Stages of one synthesis request. {@link #FAILED} is reachable from every stage on a
 * fatal error; {@link #DONE} only after filtering.
 */
public enum PipelineStage {
    TOKENIZING,
    CHECKING_CACHE,
    GENERATING,
    CONCATENATING,
    FILTERING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
