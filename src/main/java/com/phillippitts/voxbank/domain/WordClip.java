package com.phillippitts.voxbank.domain;

import com.phillippitts.voxbank.service.audio.AudioFormat;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable audio clip for one word: raw PCM at the fixed system format plus metadata.
 *
 * <p>The payload is copied on construction and on access, so a clip handed out by the
 * cache can never be mutated by a caller.
 *
 * @param key clip identity
 * @param audioBytes raw PCM16LE stereo 48 kHz payload
 * @param durationSeconds playback duration
 * @param sizeBytes payload length
 * @param createdAt creation time
 */
public record WordClip(CacheKey key, byte[] audioBytes, double durationSeconds, int sizeBytes, Instant createdAt) {

    public WordClip {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(audioBytes, "audioBytes must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (sizeBytes != audioBytes.length) {
            throw new IllegalArgumentException("sizeBytes " + sizeBytes + " does not match payload length "
                    + audioBytes.length);
        }
        audioBytes = audioBytes.clone();
    }

    /**
     * Creates a clip whose duration and size are derived from the payload.
     */
    public static WordClip of(CacheKey key, byte[] pcm, Instant createdAt) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        return new WordClip(key, pcm, AudioFormat.durationSeconds(pcm.length), pcm.length, createdAt);
    }

    @Override
    public byte[] audioBytes() {
        return audioBytes.clone();
    }

    public ClipMetadata metadata() {
        return new ClipMetadata(key, sizeBytes, durationSeconds, createdAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WordClip other)) {
            return false;
        }
        return key.equals(other.key)
                && Arrays.equals(audioBytes, other.audioBytes)
                && createdAt.equals(other.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, Arrays.hashCode(audioBytes), createdAt);
    }

    @Override
    public String toString() {
        return "WordClip[key=" + key + ", sizeBytes=" + sizeBytes + ", durationSeconds=" + durationSeconds
                + ", createdAt=" + createdAt + "]";
    }
}
