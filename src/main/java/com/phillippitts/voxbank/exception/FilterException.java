package com.phillippitts.voxbank.exception;

/**
 * Thrown when the effects chain fails. There is no unfiltered fallback.
 */
public class FilterException extends VoxBankException {

    public FilterException(String message) {
        super(message);
    }

    public FilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
