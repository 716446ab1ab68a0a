package com.phillippitts.voxbank.service.audio;

import java.util.List;

/**
 * Output of {@link PcmConcatenator}: the assembled PCM buffer plus its segment layout.
 *
 * @param pcm assembled PCM16LE stereo 48 kHz audio
 * @param segments clip and silence segments in buffer order
 */
public record ConcatenatedAudio(byte[] pcm, List<Segment> segments) {

    public ConcatenatedAudio {
        segments = List.copyOf(segments);
    }

    /** Exact playback duration of {@link #pcm()}. */
    public double durationSeconds() {
        return AudioFormat.durationSeconds(pcm.length);
    }

    public long silenceBytes() {
        return segments.stream().filter(Segment::silence).mapToLong(Segment::length).sum();
    }

    /**
     * One contiguous region of the buffer.
     *
     * @param label word for clip segments, "gap" or the pause mark for silence
     * @param offset first byte
     * @param length byte count
     * @param silence whether the region is zero-filled silence
     */
    public record Segment(String label, int offset, int length, boolean silence) {
    }
}
