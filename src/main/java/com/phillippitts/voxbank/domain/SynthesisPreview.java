package com.phillippitts.voxbank.domain;

import java.util.List;

/**
 * Dry-run view of a request: which words already have clips and how long the announcement
 * would be if only cached words were played. The provider is never called.
 *
 * @param tokens per-token view in order
 * @param invalidWords words rejected by validation
 * @param cachedCount word tokens with a cached clip
 * @param missingCount word tokens without a cached clip
 * @param estimatedDurationSeconds duration of cached clips plus inserted silence
 */
public record SynthesisPreview(
        List<TokenPreview> tokens,
        List<SkippedWord> invalidWords,
        int cachedCount,
        int missingCount,
        double estimatedDurationSeconds
) {

    public SynthesisPreview {
        tokens = List.copyOf(tokens);
        invalidWords = List.copyOf(invalidWords);
    }

    /**
     * @param token the token
     * @param cached whether a clip exists (always false for pauses)
     * @param durationSeconds clip duration, or pause duration for pauses
     */
    public record TokenPreview(Token token, boolean cached, double durationSeconds) {
    }
}
