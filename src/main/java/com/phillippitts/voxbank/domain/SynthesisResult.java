package com.phillippitts.voxbank.domain;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a synthesis request handed to the playback consumer.
 *
 * <p>A successful result always has a non-empty buffer; {@code skipped} may still be
 * non-empty (partial success). A failed result has no buffer and names the stage that
 * failed, so the two cases are never confused.
 *
 * @param success whether a buffer was produced
 * @param buffer final PCM16LE stereo 48 kHz audio, {@code null} on failure
 * @param matchedWords words present in the buffer, in token order
 * @param skipped words left out, with reasons: rejected words first, then unresolved words in token order
 * @param durationEstimateSeconds exact playback duration of {@code buffer}
 * @param cachedCount words served from the word bank
 * @param generatedCount words synthesized during this request
 * @param failedStage stage that failed, {@code null} on success
 * @param failureReason kind of failure, {@code null} on success
 * @param errorMessage failure reason, {@code null} on success
 */
public record SynthesisResult(
        boolean success,
        byte[] buffer,
        List<String> matchedWords,
        List<SkippedWord> skipped,
        double durationEstimateSeconds,
        int cachedCount,
        int generatedCount,
        PipelineStage failedStage,
        FailureReason failureReason,
        String errorMessage
) {

    public SynthesisResult {
        matchedWords = List.copyOf(Objects.requireNonNull(matchedWords, "matchedWords must not be null"));
        skipped = List.copyOf(Objects.requireNonNull(skipped, "skipped must not be null"));
        if (success && (buffer == null || buffer.length == 0)) {
            throw new IllegalArgumentException("Successful result requires a non-empty buffer");
        }
        if (!success && (failedStage == null || failureReason == null || errorMessage == null)) {
            throw new IllegalArgumentException("Failed result requires a stage, a reason and an error message");
        }
    }

    public static SynthesisResult success(byte[] buffer, List<String> matchedWords, List<SkippedWord> skipped,
                                          double durationEstimateSeconds, int cachedCount, int generatedCount) {
        return new SynthesisResult(true, buffer, matchedWords, skipped, durationEstimateSeconds,
                cachedCount, generatedCount, null, null, null);
    }

    public static SynthesisResult failure(PipelineStage failedStage, FailureReason failureReason, String errorMessage,
                                          List<String> matchedWords, List<SkippedWord> skipped) {
        return new SynthesisResult(false, null, matchedWords, skipped, 0.0, 0, 0, failedStage, failureReason,
                errorMessage);
    }

    public List<String> skippedWords() {
        return skipped.stream().map(SkippedWord::word).toList();
    }

    @Override
    public String toString() {
        return "SynthesisResult[success=" + success
                + ", bufferBytes=" + (buffer == null ? 0 : buffer.length)
                + ", matchedWords=" + matchedWords.size()
                + ", skipped=" + skipped.size()
                + ", durationEstimateSeconds=" + durationEstimateSeconds
                + ", failedStage=" + failedStage
                + ", failureReason=" + failureReason
                + ", errorMessage=" + errorMessage + "]";
    }
}
