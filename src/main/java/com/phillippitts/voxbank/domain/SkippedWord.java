package com.phillippitts.voxbank.domain;

/**
 * A word left out of the assembled buffer, with the reason reported to the caller.
 *
 * @param word the word as the caller typed it (or normalized, once tokenized)
 * @param reason human-readable reason (validation failure, provider error, not cached)
 */
public record SkippedWord(String word, String reason) {
}
