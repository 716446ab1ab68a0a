package com.phillippitts.voxbank.exception;

import java.util.List;

/**
 * Thrown when no word of a request could be resolved to a clip, either because every
 * word was invalid or because every generation attempt failed. Fatal for the request.
 */
public class NoContentException extends VoxBankException {

    private final List<String> skippedWords;

    public NoContentException(List<String> skippedWords) {
        super("No content to synthesize: none of " + skippedWords.size() + " word(s) could be resolved");
        this.skippedWords = List.copyOf(skippedWords);
    }

    public List<String> getSkippedWords() {
        return skippedWords;
    }
}
