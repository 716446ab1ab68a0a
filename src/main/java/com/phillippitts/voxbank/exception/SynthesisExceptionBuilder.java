package com.phillippitts.voxbank.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link SynthesisProviderException} with contextual metadata.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw SynthesisExceptionBuilder.create("Provider rejected request")
 *         .word("breach")
 *         .voice("en-US-GuyNeural")
 *         .status(429)
 *         .retryable(true)
 *         .durationMs(812)
 *         .build();
 * </pre>
 */
public final class SynthesisExceptionBuilder {

    private final String message;
    private String word;
    private String voiceId;
    private Throwable cause;
    private Integer status;
    private Long durationMs;
    private boolean retryable;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private SynthesisExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static SynthesisExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new SynthesisExceptionBuilder(message);
    }

    public SynthesisExceptionBuilder word(String word) {
        this.word = word;
        return this;
    }

    public SynthesisExceptionBuilder voice(String voiceId) {
        this.voiceId = voiceId;
        return this;
    }

    public SynthesisExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the upstream HTTP status code.
     *
     * @param status HTTP status returned by the provider
     * @return this builder for chaining
     */
    public SynthesisExceptionBuilder status(int status) {
        this.status = status;
        return this;
    }

    public SynthesisExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    public SynthesisExceptionBuilder retryable(boolean retryable) {
        this.retryable = retryable;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public SynthesisExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (status={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return constructed SynthesisProviderException
     */
    public SynthesisProviderException build() {
        String w = word != null ? word : "unknown";
        String v = voiceId != null ? voiceId : "unknown";
        return new SynthesisProviderException(buildDetailedMessage(), w, v, retryable, cause);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = status != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (status != null) {
            sb.append("status=").append(status);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
