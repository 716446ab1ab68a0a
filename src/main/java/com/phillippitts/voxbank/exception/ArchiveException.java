package com.phillippitts.voxbank.exception;

/**
 * Thrown when a word bank archive is unreadable or declares an incompatible audio format.
 * Individual bad entries inside an otherwise valid archive are reported in the import
 * report instead.
 */
public class ArchiveException extends VoxBankException {

    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
