package com.phillippitts.voxbank.exception;

/**
 * Thrown when a synthesis, import or cache request is rejected before any work starts:
 * empty or oversized text, too many words, word gap out of range, malformed filter
 * settings or an unsafe scope/voice identifier.
 */
public class InvalidRequestException extends VoxBankException {

    private final String field;

    public InvalidRequestException(String message) {
        super(message);
        this.field = "request";
    }

    public InvalidRequestException(String field, String message) {
        super(message + " (field: " + field + ")");
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
