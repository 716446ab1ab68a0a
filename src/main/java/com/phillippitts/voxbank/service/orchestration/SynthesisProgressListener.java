package com.phillippitts.voxbank.service.orchestration;

import com.phillippitts.voxbank.domain.PipelineStage;
import com.phillippitts.voxbank.service.generation.GenerationProgress;

/**
 * Caller-visible progress of one synthesis request: stage transitions plus per-word
 * counters while words are generated. Stage callbacks come from the request thread,
 * generation callbacks from worker threads, one at a time.
 */
public interface SynthesisProgressListener {

    SynthesisProgressListener NOOP = new SynthesisProgressListener() { };

    default void onStage(PipelineStage stage) {
    }

    default void onGeneration(GenerationProgress progress) {
    }
}
