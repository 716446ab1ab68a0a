package com.phillippitts.voxbank.domain;

import java.util.Objects;

/**
 * One element of a tokenized announcement.
 *
 * <p>For {@link TokenKind#WORD} tokens {@code word} is the normalized word and
 * {@code pauseDurationMs} is 0. For {@link TokenKind#PAUSE} tokens {@code word} holds the
 * punctuation mark that produced the pause (for previews) and {@code pauseDurationMs} is
 * the silence to insert.
 *
 * @param word normalized word, or the punctuation mark of a pause
 * @param kind word or pause
 * @param pauseDurationMs silence duration for pauses, 0 for words
 */
public record Token(String word, TokenKind kind, int pauseDurationMs) {

    public Token {
        Objects.requireNonNull(word, "word must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == TokenKind.WORD && pauseDurationMs != 0) {
            throw new IllegalArgumentException("Word tokens carry no pause duration, got: " + pauseDurationMs);
        }
        if (kind == TokenKind.PAUSE && pauseDurationMs < 0) {
            throw new IllegalArgumentException("Pause duration must be non-negative, got: " + pauseDurationMs);
        }
    }

    public static Token word(String word) {
        return new Token(word, TokenKind.WORD, 0);
    }

    public static Token pause(String mark, int durationMs) {
        return new Token(mark, TokenKind.PAUSE, durationMs);
    }

    public boolean isWord() {
        return kind == TokenKind.WORD;
    }

    public boolean isPause() {
        return kind == TokenKind.PAUSE;
    }
}
