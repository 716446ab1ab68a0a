package com.phillippitts.voxbank.service.cache;

import com.phillippitts.voxbank.domain.ClipMetadata;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Aggregate view of one scope's word bank.
 *
 * @param scopeId scope the figures belong to
 * @param totalWords number of clips (a word cached for two voices counts twice)
 * @param totalBytes summed payload size
 * @param voicesUsed distinct voices, sorted
 */
public record CacheStats(String scopeId, int totalWords, long totalBytes, List<String> voicesUsed) {

    public CacheStats {
        voicesUsed = List.copyOf(voicesUsed);
    }

    static CacheStats of(String scopeId, Collection<ClipMetadata> clips) {
        long bytes = 0;
        TreeSet<String> voices = new TreeSet<>();
        for (ClipMetadata clip : clips) {
            bytes += clip.sizeBytes();
            voices.add(clip.key().voiceId());
        }
        return new CacheStats(scopeId, clips.size(), bytes, List.copyOf(voices));
    }
}
