package com.phillippitts.voxbank.service.generation;

import com.phillippitts.voxbank.config.properties.WordBankProperties;
import com.phillippitts.voxbank.exception.SynthesisExceptionBuilder;
import com.phillippitts.voxbank.exception.SynthesisProviderException;
import com.phillippitts.voxbank.service.audio.WavFormat;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static com.phillippitts.voxbank.service.audio.AudioFormat.BITS_PER_SAMPLE;
import static com.phillippitts.voxbank.service.audio.AudioFormat.BLOCK_ALIGN;
import static com.phillippitts.voxbank.service.audio.AudioFormat.BYTE_RATE;
import static com.phillippitts.voxbank.service.audio.AudioFormat.CHANNELS;
import static com.phillippitts.voxbank.service.audio.AudioFormat.SAMPLE_RATE;

/**
 * Checks provider output before it enters the word bank and normalizes it to raw PCM.
 *
 * <p>WAV: parses the chunk structure to locate fmt and data chunks, validates format
 * fields and returns the data chunk. Handles extra chunks and extended fmt chunks.
 *
 * <p>PCM: must be non-empty and aligned to the 4-byte frame.
 *
 * <p>Either way the clip must not exceed {@code vox.cache.max-clip-seconds}. Every
 * violation is reported as a non-retryable {@link SynthesisProviderException}, so the
 * word fails without poisoning the cache.
 */
@Component
public class ClipAudioValidator {

    private final WordBankProperties props;

    public ClipAudioValidator(WordBankProperties props) {
        this.props = props;
    }

    /**
     * Validates provider output and returns the raw PCM payload.
     *
     * @param data provider bytes, either WAV (RIFF/WAVE) or raw PCM16LE stereo 48 kHz
     * @param word word the audio belongs to (diagnostics only)
     * @param voiceId voice the audio belongs to (diagnostics only)
     * @return raw PCM
     * @throws SynthesisProviderException when format or duration constraints are violated
     */
    public byte[] toPcm(byte[] data, String word, String voiceId) {
        if (data == null || data.length == 0) {
            throw invalid("Provider returned no audio", word, voiceId);
        }
        byte[] pcm = WavFormat.isWav(data) ? extractWavData(data, word, voiceId) : data;
        if (pcm.length == 0) {
            throw invalid("Provider audio has no samples", word, voiceId);
        }
        if (pcm.length % BLOCK_ALIGN != 0) {
            throw invalid("PCM not aligned to frame size (" + BLOCK_ALIGN + " bytes), size: " + pcm.length,
                    word, voiceId);
        }
        long maxBytes = (long) props.getMaxClipSeconds() * BYTE_RATE;
        if (pcm.length > maxBytes) {
            throw invalid("Clip too long: " + pcm.length + " bytes, max " + props.getMaxClipSeconds() + "s",
                    word, voiceId);
        }
        return pcm;
    }

    private byte[] extractWavData(byte[] wav, String word, String voiceId) {
        int offset = WavFormat.RIFF_HEADER_SIZE;
        int fmtOffset = -1;
        int fmtSize = 0;

        while (offset + WavFormat.CHUNK_HEADER_SIZE <= wav.length) {
            String chunkId = readChunkId(wav, offset);
            int chunkSize = readLEInt(wav, offset + 4);
            if (chunkSize < 0 || offset + WavFormat.CHUNK_HEADER_SIZE + chunkSize > wav.length) {
                throw invalid("Invalid WAV chunk size: " + chunkSize + " at offset " + offset, word, voiceId);
            }
            int body = offset + WavFormat.CHUNK_HEADER_SIZE;
            if ("fmt ".equals(chunkId)) {
                fmtOffset = body;
                fmtSize = chunkSize;
            } else if ("data".equals(chunkId)) {
                if (fmtOffset == -1) {
                    throw invalid("WAV data chunk precedes fmt chunk", word, voiceId);
                }
                validateFmtChunk(wav, fmtOffset, fmtSize, word, voiceId);
                return Arrays.copyOfRange(wav, body, body + chunkSize);
            }
            // Chunks are padded to even byte boundaries
            offset = body + chunkSize + (chunkSize % 2);
        }
        throw invalid("Missing " + (fmtOffset == -1 ? "fmt" : "data") + " chunk in WAV payload", word, voiceId);
    }

    private void validateFmtChunk(byte[] wav, int offset, int size, String word, String voiceId) {
        if (size < WavFormat.FMT_CHUNK_MIN_SIZE) {
            throw invalid("fmt chunk too small: " + size + " bytes", word, voiceId);
        }
        int audioFormat = readLEShort(wav, offset);
        int channels = readLEShort(wav, offset + 2);
        int sampleRate = readLEInt(wav, offset + 4);
        int byteRate = readLEInt(wav, offset + 8);
        int blockAlign = readLEShort(wav, offset + 12);
        int bitsPerSample = readLEShort(wav, offset + 14);

        if (audioFormat != WavFormat.AUDIO_FORMAT_PCM) {
            throw invalid("Unsupported audio format: " + audioFormat, word, voiceId);
        }
        if (channels != CHANNELS || sampleRate != SAMPLE_RATE || bitsPerSample != BITS_PER_SAMPLE) {
            throw invalid("Unexpected format " + sampleRate + " Hz/" + bitsPerSample + "-bit/" + channels
                    + "ch, expected " + SAMPLE_RATE + " Hz/" + BITS_PER_SAMPLE + "-bit/" + CHANNELS + "ch",
                    word, voiceId);
        }
        if (blockAlign != BLOCK_ALIGN || byteRate != BYTE_RATE) {
            throw invalid("Inconsistent block align/byte rate: " + blockAlign + "/" + byteRate, word, voiceId);
        }
    }

    private static SynthesisProviderException invalid(String message, String word, String voiceId) {
        return SynthesisExceptionBuilder.create(message).word(word).voice(voiceId).retryable(false).build();
    }

    private static String readChunkId(byte[] wav, int offset) {
        return new String(wav, offset, 4, StandardCharsets.US_ASCII);
    }

    private static int readLEShort(byte[] a, int off) {
        return (a[off] & 0xFF) | ((a[off + 1] & 0xFF) << 8);
    }

    private static int readLEInt(byte[] a, int off) {
        return (a[off] & 0xFF)
             | ((a[off + 1] & 0xFF) << 8)
             | ((a[off + 2] & 0xFF) << 16)
             | ((a[off + 3] & 0xFF) << 24);
    }
}
