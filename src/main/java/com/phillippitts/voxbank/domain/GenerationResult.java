package com.phillippitts.voxbank.domain;

import java.util.Objects;

/**
 * Outcome for a single word of a request.
 *
 * @param word normalized word
 * @param status cached, generated, failed or skipped
 * @param reason failure or skip reason, {@code null} when resolved
 * @param clip resolved clip, {@code null} unless cached or generated
 */
public record GenerationResult(String word, GenerationStatus status, String reason, WordClip clip) {

    public GenerationResult {
        Objects.requireNonNull(word, "word must not be null");
        Objects.requireNonNull(status, "status must not be null");
        boolean resolved = status == GenerationStatus.CACHED || status == GenerationStatus.GENERATED;
        if (resolved && clip == null) {
            throw new IllegalArgumentException(status + " result requires a clip");
        }
        if (!resolved && reason == null) {
            throw new IllegalArgumentException(status + " result requires a reason");
        }
    }

    public static GenerationResult cached(WordClip clip) {
        return new GenerationResult(clip.key().word(), GenerationStatus.CACHED, null, clip);
    }

    public static GenerationResult generated(WordClip clip) {
        return new GenerationResult(clip.key().word(), GenerationStatus.GENERATED, null, clip);
    }

    public static GenerationResult failed(String word, String reason) {
        return new GenerationResult(word, GenerationStatus.FAILED, reason, null);
    }

    public static GenerationResult skipped(String word, String reason) {
        return new GenerationResult(word, GenerationStatus.SKIPPED, reason, null);
    }

    public boolean isResolved() {
        return clip != null;
    }
}
