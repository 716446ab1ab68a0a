package com.phillippitts.voxbank.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Metadata of a cached clip, tracked independently of the audio payload so listings
 * never read audio bytes.
 *
 * @param key clip identity
 * @param sizeBytes payload length in bytes
 * @param durationSeconds playback duration at the fixed audio format
 * @param createdAt when the clip was first written
 */
public record ClipMetadata(CacheKey key, long sizeBytes, double durationSeconds, Instant createdAt) {

    public ClipMetadata {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be non-negative, got: " + sizeBytes);
        }
    }
}
