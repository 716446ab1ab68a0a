package com.phillippitts.voxbank.exception;

/**
 * Base exception for all voxbank application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class VoxBankException extends RuntimeException {

    public VoxBankException(String message) {
        super(message);
    }

    public VoxBankException(String message, Throwable cause) {
        super(message, cause);
    }

    public VoxBankException(Throwable cause) {
        super(cause);
    }
}
