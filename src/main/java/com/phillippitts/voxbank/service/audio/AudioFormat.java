package com.phillippitts.voxbank.service.audio;

/**
 * Single source of truth for the system-wide clip format.
 * Required: 48 kHz, 16-bit signed PCM, stereo, little-endian.
 *
 * <p>Every cached clip, every inserted silence gap and the final buffer use this format;
 * clips of any other format are rejected before they reach the word bank.
 */
public final class AudioFormat {

    /** Sample rate in Hz. */
    public static final int SAMPLE_RATE = 48_000;
    /** Bits per sample. */
    public static final int BITS_PER_SAMPLE = 16;
    /** Bytes per sample of one channel. */
    public static final int BYTES_PER_SAMPLE = BITS_PER_SAMPLE / 8;
    /** Channel count (stereo). */
    public static final int CHANNELS = 2;

    /** Bytes per PCM frame (one sample for every channel). */
    public static final int BLOCK_ALIGN = BYTES_PER_SAMPLE * CHANNELS;          // 4 bytes
    /** Bytes per second. */
    public static final int BYTE_RATE = SAMPLE_RATE * BLOCK_ALIGN;              // 192,000
    /** Bytes per millisecond of audio. */
    public static final int BYTES_PER_MILLISECOND = BYTE_RATE / 1000;           // 192

    // WAV header constants (PCM simple header)
    public static final int WAV_HEADER_SIZE = 44;
    public static final int WAV_CHANNELS_OFFSET = 22;            // 2 bytes (LE)
    public static final int WAV_SAMPLE_RATE_OFFSET = 24;         // 4 bytes (LE)
    public static final int WAV_BYTE_RATE_OFFSET = 28;           // 4 bytes (LE)
    public static final int WAV_BLOCK_ALIGN_OFFSET = 32;         // 2 bytes (LE)
    public static final int WAV_BITS_PER_SAMPLE_OFFSET = 34;     // 2 bytes (LE)

    private AudioFormat() {}

    /**
     * Number of zero bytes that encode {@code durationMs} of silence:
     * {@code durationMs * sampleRate * bytesPerSample * channels / 1000}.
     *
     * @param durationMs silence duration, non-negative
     * @return byte count, always a multiple of {@link #BLOCK_ALIGN}
     */
    public static int silenceBytes(int durationMs) {
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be non-negative, got: " + durationMs);
        }
        return Math.toIntExact((long) durationMs * SAMPLE_RATE * BYTES_PER_SAMPLE * CHANNELS / 1000L);
    }

    /**
     * Playback duration of a PCM payload of the given size.
     */
    public static double durationSeconds(long bytes) {
        return (double) bytes / BYTE_RATE;
    }

    /**
     * Whether a payload length is a whole number of frames.
     */
    public static boolean isFrameAligned(long bytes) {
        return bytes % BLOCK_ALIGN == 0;
    }
}
