package com.phillippitts.voxbank.presentation.dto;

import com.phillippitts.voxbank.domain.Token;
import com.phillippitts.voxbank.exception.InvalidRequestException;

/**
 * One entry of a pre-tokenized composition: {@code {"word": "gate"}} or
 * {@code {"pause": ".", "pauseMs": 200}}.
 */
public record CompositionEntry(String word, String pause, Integer pauseMs) {

    public Token toToken() {
        if (word != null && pause == null && pauseMs == null) {
            return Token.word(word);
        }
        if (word == null && pauseMs != null) {
            if (pauseMs < 0) {
                throw new InvalidRequestException("composition", "pauseMs must be non-negative, got: " + pauseMs);
            }
            return Token.pause(pause == null ? "" : pause, pauseMs);
        }
        throw new InvalidRequestException("composition", "Entry must be either a word or a pause with pauseMs");
    }
}
