package com.phillippitts.voxbank.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when a synthesis request produced a buffer.
 *
 * @param scopeId word bank scope
 * @param voiceId provider voice
 * @param matchedWords words in the buffer
 * @param skippedWords words left out
 * @param durationSeconds playback duration of the buffer
 * @param timestamp completion time
 */
public record SynthesisCompletedEvent(
        String scopeId,
        String voiceId,
        int matchedWords,
        int skippedWords,
        double durationSeconds,
        Instant timestamp
) {}
