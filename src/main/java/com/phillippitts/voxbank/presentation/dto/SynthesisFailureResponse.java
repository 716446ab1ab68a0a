package com.phillippitts.voxbank.presentation.dto;

import com.phillippitts.voxbank.domain.SkippedWord;
import com.phillippitts.voxbank.domain.SynthesisResult;

import java.util.List;

/**
 * JSON body returned when the pipeline produced no audio.
 */
public record SynthesisFailureResponse(String failedStage,
                                       String failureReason,
                                       String message,
                                       List<String> matchedWords,
                                       List<SkippedWord> skipped) {

    public static SynthesisFailureResponse of(SynthesisResult result) {
        return new SynthesisFailureResponse(result.failedStage().name(), result.failureReason().name(),
                result.errorMessage(), result.matchedWords(), result.skipped());
    }
}
