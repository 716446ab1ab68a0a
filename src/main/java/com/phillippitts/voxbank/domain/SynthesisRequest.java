package com.phillippitts.voxbank.domain;

import java.util.List;
import java.util.Objects;

/**
 * Input of one synthesis request. Exactly one of {@code text} or {@code composition} is set.
 *
 * @param text free-form announcement text, tokenized by the pipeline
 * @param composition pre-tokenized sequence, used as-is
 * @param voiceId provider voice
 * @param scopeId word bank scope
 * @param filter effects selection
 * @param wordGapMs silence between entries, {@code null} for the configured default
 * @param cancellation cancellation signal observed by every stage
 */
public record SynthesisRequest(
        String text,
        List<Token> composition,
        String voiceId,
        String scopeId,
        FilterSpec filter,
        Integer wordGapMs,
        CancellationSignal cancellation
) {

    public SynthesisRequest {
        if ((text == null) == (composition == null)) {
            throw new IllegalArgumentException("Exactly one of text or composition must be provided");
        }
        Objects.requireNonNull(voiceId, "voiceId must not be null");
        Objects.requireNonNull(scopeId, "scopeId must not be null");
        composition = composition == null ? null : List.copyOf(composition);
        filter = filter == null ? FilterSpec.off() : filter;
        cancellation = cancellation == null ? CancellationSignal.none() : cancellation;
    }

    public static SynthesisRequest forText(String scopeId, String voiceId, String text) {
        Objects.requireNonNull(text, "text must not be null");
        return new SynthesisRequest(text, null, voiceId, scopeId, null, null, null);
    }

    public static SynthesisRequest forComposition(String scopeId, String voiceId, List<Token> composition) {
        Objects.requireNonNull(composition, "composition must not be null");
        return new SynthesisRequest(null, composition, voiceId, scopeId, null, null, null);
    }

    public SynthesisRequest withFilter(FilterSpec filter) {
        return new SynthesisRequest(text, composition, voiceId, scopeId, filter, wordGapMs, cancellation);
    }

    public SynthesisRequest withWordGapMs(Integer wordGapMs) {
        return new SynthesisRequest(text, composition, voiceId, scopeId, filter, wordGapMs, cancellation);
    }

    public SynthesisRequest withCancellation(CancellationSignal cancellation) {
        return new SynthesisRequest(text, composition, voiceId, scopeId, filter, wordGapMs, cancellation);
    }

    public boolean isPreTokenized() {
        return composition != null;
    }
}
