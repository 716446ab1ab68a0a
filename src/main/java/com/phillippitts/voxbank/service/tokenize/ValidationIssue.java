package com.phillippitts.voxbank.service.tokenize;

import java.util.Objects;

/**
 * A word rejected by the tokenizer. Rejected words never become tokens; they are reported
 * back to the caller alongside the accepted tokens.
 *
 * @param position zero-based index of the whitespace-separated chunk in the input
 * @param word the normalized word that failed validation
 * @param reason human-readable reason
 */
public record ValidationIssue(int position, String word, String reason) {

    public ValidationIssue {
        Objects.requireNonNull(word, "word must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }
}
