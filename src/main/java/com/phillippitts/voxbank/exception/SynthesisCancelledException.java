package com.phillippitts.voxbank.exception;

/**
 * Thrown when a synthesis request observes its cancellation signal.
 */
public class SynthesisCancelledException extends VoxBankException {

    public SynthesisCancelledException(String message) {
        super(message);
    }
}
