package com.phillippitts.voxbank.exception;

/**
 * Thrown when the persistent word bank cannot be read or written.
 */
public class WordBankStorageException extends VoxBankException {

    private final String location;

    public WordBankStorageException(String message, String location, Throwable cause) {
        super(message + " (location: " + location + ")", cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
