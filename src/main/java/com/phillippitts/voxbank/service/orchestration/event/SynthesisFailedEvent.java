package com.phillippitts.voxbank.service.orchestration.event;

import com.phillippitts.voxbank.domain.FailureReason;
import com.phillippitts.voxbank.domain.PipelineStage;

import java.time.Instant;

/**
 * Emitted when a synthesis request ended without a buffer.
 *
 * @param scopeId word bank scope
 * @param voiceId provider voice
 * @param stage stage that failed
 * @param reason kind of failure
 * @param message failure description (no announcement text)
 * @param timestamp failure time
 */
public record SynthesisFailedEvent(
        String scopeId,
        String voiceId,
        PipelineStage stage,
        FailureReason reason,
        String message,
        Instant timestamp
) {}
