package com.phillippitts.voxbank.service.cache;

import com.phillippitts.voxbank.domain.CacheKey;
import com.phillippitts.voxbank.domain.ClipMetadata;
import com.phillippitts.voxbank.domain.WordClip;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Persistent store of synthesized word clips keyed by {@code (scopeId, word, voiceId)}.
 *
 * <p>Implementations must be thread-safe: the word bank is the only state shared between
 * concurrent synthesis requests. Writes to distinct keys never block or corrupt each other;
 * concurrent writes to the same key leave exactly one valid clip (last write wins).
 */
public interface WordBankCache {

    /** Default cap for {@link #search}. */
    int DEFAULT_SEARCH_RESULTS = 25;

    /**
     * Looks up a clip. No side effects.
     *
     * @param key clip identity
     * @return the clip, or empty on a miss
     */
    Optional<WordClip> get(CacheKey key);

    /**
     * Looks up clip metadata without reading the audio payload.
     */
    Optional<ClipMetadata> metadata(CacheKey key);

    /**
     * Stores a clip, atomically replacing any existing clip for the same key.
     *
     * @param clip clip to store; payload must be non-empty and frame-aligned
     */
    void put(WordClip clip);

    /**
     * Removes one clip.
     *
     * @return true if a clip was removed
     */
    boolean purgeWord(CacheKey key);

    /**
     * Removes all clips of one voice, or of the whole scope when {@code voiceId} is null.
     *
     * @return number of clips removed
     */
    int purge(String scopeId, String voiceId);

    /**
     * Lists clip metadata ordered by voice then word, without reading audio.
     *
     * @param scopeId scope to list
     * @param voiceId voice filter, or null for all voices
     */
    List<ClipMetadata> list(String scopeId, String voiceId);

    default CacheStats stats(String scopeId) {
        return CacheStats.of(scopeId, list(scopeId, null));
    }

    /**
     * Finds words by prefix first, then by substring, each group alphabetical.
     *
     * @param scopeId scope to search
     * @param voiceId voice filter, or null for all voices
     * @param query case-insensitive search text; blank returns the first words alphabetically
     * @param maxResults cap on returned entries
     */
    default List<ClipMetadata> search(String scopeId, String voiceId, String query, int maxResults) {
        if (maxResults <= 0) {
            return List.of();
        }
        List<ClipMetadata> all = new ArrayList<>(list(scopeId, voiceId));
        all.sort(Comparator.comparing((ClipMetadata m) -> m.key().word())
                .thenComparing(m -> m.key().voiceId()));
        String needle = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);

        List<ClipMetadata> prefix = new ArrayList<>();
        List<ClipMetadata> substring = new ArrayList<>();
        for (ClipMetadata clip : all) {
            String word = clip.key().word();
            if (word.startsWith(needle)) {
                prefix.add(clip);
            } else if (word.contains(needle)) {
                substring.add(clip);
            }
        }
        prefix.addAll(substring);
        return List.copyOf(prefix.subList(0, Math.min(maxResults, prefix.size())));
    }
}
