package com.phillippitts.voxbank.service.audio;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

import static com.phillippitts.voxbank.service.audio.AudioFormat.BITS_PER_SAMPLE;
import static com.phillippitts.voxbank.service.audio.AudioFormat.BLOCK_ALIGN;
import static com.phillippitts.voxbank.service.audio.AudioFormat.BYTE_RATE;
import static com.phillippitts.voxbank.service.audio.AudioFormat.CHANNELS;
import static com.phillippitts.voxbank.service.audio.AudioFormat.SAMPLE_RATE;
import static com.phillippitts.voxbank.service.audio.AudioFormat.WAV_HEADER_SIZE;

/**
 * Wraps raw PCM in a minimal 44-byte WAV header for the fixed format
 * (48 kHz, 16-bit signed PCM, stereo, little-endian). Used when the playback consumer
 * wants a self-describing file instead of raw PCM.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Returns a WAV file containing the given PCM payload.
     *
     * @param pcm raw PCM16LE stereo 48 kHz audio
     * @return header followed by the payload
     */
    public static byte[] toWav(byte[] pcm) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        ByteArrayOutputStream out = new ByteArrayOutputStream(WAV_HEADER_SIZE + pcm.length);
        try {
            write(pcm, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to build WAV buffer", e);
        }
        return out.toByteArray();
    }

    /**
     * Writes header and payload to the stream. The stream is not closed.
     */
    public static void write(byte[] pcm, OutputStream os) throws IOException {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(os, "os must not be null");

        os.write(new byte[] { 'R', 'I', 'F', 'F' });
        writeLEInt(os, 36 + pcm.length);                 // ChunkSize
        os.write(new byte[] { 'W', 'A', 'V', 'E' });

        os.write(new byte[] { 'f', 'm', 't', ' ' });
        writeLEInt(os, 16);                              // Subchunk1Size for PCM
        writeLEShort(os, (short) WavFormat.AUDIO_FORMAT_PCM);
        writeLEShort(os, (short) CHANNELS);
        writeLEInt(os, SAMPLE_RATE);
        writeLEInt(os, BYTE_RATE);
        writeLEShort(os, (short) BLOCK_ALIGN);
        writeLEShort(os, (short) BITS_PER_SAMPLE);

        os.write(new byte[] { 'd', 'a', 't', 'a' });
        writeLEInt(os, pcm.length);

        os.write(pcm);
        os.flush();
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
