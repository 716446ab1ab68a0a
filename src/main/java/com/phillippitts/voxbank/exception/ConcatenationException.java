package com.phillippitts.voxbank.exception;

/**
 * Thrown when a clip cannot be assembled into the output buffer (empty or not aligned
 * to the PCM frame size). Aborts the whole request since the byte alignment of every
 * following clip would be corrupted.
 */
public class ConcatenationException extends VoxBankException {

    private final String word;
    private final int clipBytes;

    public ConcatenationException(String message) {
        super(message);
        this.word = null;
        this.clipBytes = 0;
    }

    public ConcatenationException(String word, int clipBytes, String reason) {
        super("Cannot concatenate clip for '" + word + "' (" + clipBytes + " bytes): " + reason);
        this.word = word;
        this.clipBytes = clipBytes;
    }

    public String getWord() {
        return word;
    }

    public int getClipBytes() {
        return clipBytes;
    }
}
