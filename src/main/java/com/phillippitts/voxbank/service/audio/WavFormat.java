package com.phillippitts.voxbank.service.audio;

/**
 * Structural constants of the RIFF/WAVE container.
 *
 * <pre>
 * RIFF header (12 bytes)        RIFF_HEADER_SIZE
 * fmt chunk header (8 bytes)    CHUNK_HEADER_SIZE
 * fmt chunk data (>=16 bytes)   FMT_CHUNK_MIN_SIZE
 * data chunk header (8 bytes)   CHUNK_HEADER_SIZE
 * PCM payload
 * </pre>
 *
 * @see com.phillippitts.voxbank.service.generation.ClipAudioValidator
 */
public final class WavFormat {

    /** "RIFF" + size + "WAVE". */
    public static final int RIFF_HEADER_SIZE = 12;

    /** Chunk ID (4 bytes) + chunk size (4 bytes, LE). */
    public static final int CHUNK_HEADER_SIZE = 8;

    /** Minimum fmt chunk payload for PCM. */
    public static final int FMT_CHUNK_MIN_SIZE = 16;

    /** fmt audio format code for uncompressed PCM. */
    public static final int AUDIO_FORMAT_PCM = 1;

    private WavFormat() {
    }

    /**
     * Whether the payload starts with a RIFF/WAVE header.
     */
    public static boolean isWav(byte[] a) {
        return a != null && a.length >= RIFF_HEADER_SIZE
                && a[0] == 'R' && a[1] == 'I' && a[2] == 'F' && a[3] == 'F'
                && a[8] == 'W' && a[9] == 'A' && a[10] == 'V' && a[11] == 'E';
    }
}
