package com.phillippitts.voxbank.config.properties;

import com.phillippitts.voxbank.service.audio.PauseMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed limits and defaults for synthesis requests.
 */
@Validated
@ConfigurationProperties(prefix = "vox.request")
public class RequestProperties {

    @Positive
    private final int maxMessageLength;

    @Positive
    private final int maxWordCount;

    @Min(0)
    private final int minWordGapMs;

    @Positive
    private final int maxWordGapMs;

    @Min(0)
    private final int defaultWordGapMs;

    @NotNull
    private final PauseMode pauseMode;

    /**
     * When true, missing words are skipped instead of generated (cache-only playback).
     */
    private final boolean skipMissingWords;

    @ConstructorBinding
    public RequestProperties(Integer maxMessageLength, Integer maxWordCount, Integer minWordGapMs,
                             Integer maxWordGapMs, Integer defaultWordGapMs, PauseMode pauseMode,
                             Boolean skipMissingWords) {
        this.maxMessageLength = maxMessageLength == null ? 500 : maxMessageLength;
        this.maxWordCount = maxWordCount == null ? 50 : maxWordCount;
        this.minWordGapMs = minWordGapMs == null ? 20 : minWordGapMs;
        this.maxWordGapMs = maxWordGapMs == null ? 200 : maxWordGapMs;
        this.defaultWordGapMs = defaultWordGapMs == null ? 50 : defaultWordGapMs;
        this.pauseMode = pauseMode == null ? PauseMode.ADDITIVE : pauseMode;
        this.skipMissingWords = skipMissingWords != null && skipMissingWords;
        if (this.minWordGapMs > this.maxWordGapMs) {
            throw new IllegalArgumentException("vox.request.min-word-gap-ms (" + this.minWordGapMs
                    + ") must not exceed max-word-gap-ms (" + this.maxWordGapMs + ")");
        }
    }

    /**
     * Defaults for tests: 500 chars, 50 words, gap 20..200 ms defaulting to 50 ms, additive pauses.
     */
    public static RequestProperties defaults() {
        return new RequestProperties(null, null, null, null, null, null, null);
    }

    public int getMaxMessageLength() {
        return maxMessageLength;
    }

    public int getMaxWordCount() {
        return maxWordCount;
    }

    public int getMinWordGapMs() {
        return minWordGapMs;
    }

    public int getMaxWordGapMs() {
        return maxWordGapMs;
    }

    public int getDefaultWordGapMs() {
        return defaultWordGapMs;
    }

    public PauseMode getPauseMode() {
        return pauseMode;
    }

    public boolean isSkipMissingWords() {
        return skipMissingWords;
    }
}
