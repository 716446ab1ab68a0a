package com.phillippitts.voxbank.testutil;

import com.phillippitts.voxbank.domain.CacheKey;
import com.phillippitts.voxbank.domain.WordClip;
import com.phillippitts.voxbank.service.audio.AudioFormat;

import java.time.Instant;
import java.util.Arrays;

/**
 * Builders for 48 kHz / 16-bit / stereo PCM test payloads.
 */
public final class PcmFixtures {

    public static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");

    private PcmFixtures() {
    }

    /**
     * A clip of {@code seconds} filled with a constant non-zero byte so it is
     * distinguishable from inserted silence.
     */
    public static byte[] pcm(double seconds, byte fill) {
        int frames = (int) Math.round(seconds * AudioFormat.SAMPLE_RATE);
        byte[] data = new byte[frames * AudioFormat.BLOCK_ALIGN];
        Arrays.fill(data, fill);
        return data;
    }

    public static byte[] pcmMillis(int millis, byte fill) {
        byte[] data = new byte[AudioFormat.silenceBytes(millis)];
        Arrays.fill(data, fill);
        return data;
    }

    /**
     * A stereo sine tone at the given amplitude (0..1).
     */
    public static byte[] sine(double hz, double seconds, double amplitude) {
        int frames = (int) Math.round(seconds * AudioFormat.SAMPLE_RATE);
        byte[] data = new byte[frames * AudioFormat.BLOCK_ALIGN];
        for (int i = 0; i < frames; i++) {
            short s = (short) Math.round(Math.sin(2 * Math.PI * hz * i / AudioFormat.SAMPLE_RATE) * amplitude * 32767);
            for (int ch = 0; ch < AudioFormat.CHANNELS; ch++) {
                int off = i * AudioFormat.BLOCK_ALIGN + ch * 2;
                data[off] = (byte) (s & 0xFF);
                data[off + 1] = (byte) ((s >> 8) & 0xFF);
            }
        }
        return data;
    }

    public static WordClip clip(String scope, String word, String voice, double seconds) {
        return WordClip.of(CacheKey.of(scope, word, voice), pcm(seconds, (byte) 1), CREATED);
    }
}
