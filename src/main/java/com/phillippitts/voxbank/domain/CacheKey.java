package com.phillippitts.voxbank.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * Composite identity of one cached clip: {@code (scopeId, word, voiceId)}.
 *
 * <p>The word is stored lower-case so lookups are case-insensitive. The scope isolates
 * tenants (one guild, one installation) from each other.
 */
public record CacheKey(String scopeId, String word, String voiceId) {

    public CacheKey {
        requireText(scopeId, "scopeId");
        requireText(word, "word");
        requireText(voiceId, "voiceId");
        word = word.toLowerCase(Locale.ROOT);
    }

    public static CacheKey of(String scopeId, String word, String voiceId) {
        return new CacheKey(scopeId, word, voiceId);
    }

    /**
     * Returns the same word and voice under another scope (used by archive import).
     */
    public CacheKey inScope(String otherScopeId) {
        return new CacheKey(otherScopeId, word, voiceId);
    }

    private static void requireText(String value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
