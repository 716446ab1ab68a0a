package com.phillippitts.voxbank.exception;

/**
 * Thrown when the external synthesis provider fails for a single word.
 *
 * <p>The generator recovers from this per word: the word is reported as failed and
 * sibling requests continue. {@link #isRetryable()} marks transient faults (timeouts,
 * rate limiting, upstream 5xx). The message never contains the word; callers that need
 * it for diagnostics read {@link #getWord()}.
 */
public class SynthesisProviderException extends VoxBankException {

    private final String word;
    private final String voiceId;
    private final boolean retryable;

    public SynthesisProviderException(String message) {
        this(message, "unknown", "unknown", false, null);
    }

    public SynthesisProviderException(String message, String word, String voiceId, boolean retryable) {
        this(message, word, voiceId, retryable, null);
    }

    public SynthesisProviderException(String message, String word, String voiceId, boolean retryable,
                                      Throwable cause) {
        super(message, cause);
        this.word = word;
        this.voiceId = voiceId;
        this.retryable = retryable;
    }

    public String getWord() {
        return word;
    }

    public String getVoiceId() {
        return voiceId;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
