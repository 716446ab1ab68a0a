package com.phillippitts.voxbank.service.orchestration;

import com.phillippitts.voxbank.domain.SynthesisPreview;
import com.phillippitts.voxbank.domain.SynthesisRequest;
import com.phillippitts.voxbank.domain.SynthesisResult;
import com.phillippitts.voxbank.exception.InvalidRequestException;

/**
 * Entry point of the word bank pipeline: tokenize, resolve words from the word bank,
 * generate misses, concatenate and filter.
 *
 * <p>Request-level validation problems are thrown as {@link InvalidRequestException}
 * before any work starts. Everything after that is reported in the returned
 * {@link SynthesisResult}: per-word problems in its skipped list, stage failures as a
 * failed result.
 */
public interface VoxOrchestrator {

    /**
     * Runs the pipeline for one request.
     *
     * @param request text or pre-tokenized composition plus options
     * @param listener progress channel
     * @return a successful result with a buffer, or a failed result naming the stage
     * @throws InvalidRequestException if the request violates the configured limits
     */
    SynthesisResult synthesize(SynthesisRequest request, SynthesisProgressListener listener);

    default SynthesisResult synthesize(SynthesisRequest request) {
        return synthesize(request, SynthesisProgressListener.NOOP);
    }

    /**
     * Reports which words of {@code text} are cached and the expected duration if only
     * cached words were played. Never calls the synthesis provider.
     *
     * @param wordGapMs silence between entries, {@code null} for the configured default
     * @throws InvalidRequestException if the text violates the configured limits
     */
    SynthesisPreview preview(String scopeId, String voiceId, String text, Integer wordGapMs);
}
