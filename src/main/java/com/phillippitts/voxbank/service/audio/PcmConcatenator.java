package com.phillippitts.voxbank.service.audio;

import com.phillippitts.voxbank.domain.CancellationSignal;
import com.phillippitts.voxbank.domain.Composition;
import com.phillippitts.voxbank.domain.Token;
import com.phillippitts.voxbank.domain.WordClip;
import com.phillippitts.voxbank.exception.ConcatenationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

/**
 * Assembles a {@link Composition} into one PCM buffer with exact silence gaps.
 *
 * <p>Entries are written strictly in composition order. Silence is zero-filled and sized by
 * {@link AudioFormat#silenceBytes(int)} ({@code durationMs * 192} bytes at the fixed format).
 * Gap placement depends on {@link PauseMode}:
 * <ul>
 *   <li>{@code ADDITIVE}: a word gap follows every word except the last entry; pause entries
 *       add their own silence on top, so "a, b" is laid out as {@code a, gap, pause, b}.</li>
 *   <li>{@code OVERRIDE}: a word gap is inserted only between two consecutive words; at a
 *       pause boundary the pause silence is the only separator.</li>
 * </ul>
 *
 * <p>All clips are validated before any byte is written: an empty or frame-misaligned clip
 * fails the whole call with {@link ConcatenationException}.
 *
 * <p>Thread-safe: stateless.
 */
@Component
public class PcmConcatenator {

    private static final Logger LOG = LogManager.getLogger(PcmConcatenator.class);
    private static final String GAP_LABEL = "gap";

    /**
     * Concatenates the composition.
     *
     * @param composition resolved words and pauses in order
     * @param wordGapMs default silence between entries, non-negative
     * @param pauseMode how pauses combine with the word gap
     * @param cancellation checked before assembly starts
     * @return assembled buffer and layout
     * @throws ConcatenationException if the composition holds no words or a clip is malformed
     */
    public ConcatenatedAudio concatenate(Composition composition, int wordGapMs, PauseMode pauseMode,
                                         CancellationSignal cancellation) {
        Objects.requireNonNull(composition, "composition");
        Objects.requireNonNull(pauseMode, "pauseMode");
        if (wordGapMs < 0) {
            throw new IllegalArgumentException("wordGapMs must be non-negative, got: " + wordGapMs);
        }
        if (composition.wordCount() == 0) {
            throw new ConcatenationException("Composition contains no words to concatenate");
        }
        validateClips(composition);
        if (cancellation != null) {
            cancellation.throwIfCancelled("concatenation");
        }

        List<ConcatenatedAudio.Segment> layout = plan(composition.tokens(), i -> composition.clipAt(i).sizeBytes(),
                AudioFormat.silenceBytes(wordGapMs), pauseMode);
        int total = 0;
        for (ConcatenatedAudio.Segment segment : layout) {
            total = Math.addExact(total, segment.length());
        }

        byte[] out = new byte[total]; // zero-filled: silence needs no writes
        int clipIndex = 0;
        for (ConcatenatedAudio.Segment segment : layout) {
            if (!segment.silence()) {
                clipIndex = nextWordIndex(composition, clipIndex);
                byte[] pcm = composition.clipAt(clipIndex).audioBytes();
                System.arraycopy(pcm, 0, out, segment.offset(), pcm.length);
                clipIndex++;
            }
        }

        LOG.debug("Concatenated {} clips into {} bytes ({} segments, gap={}ms, mode={})",
                composition.wordCount(), total, layout.size(), wordGapMs, pauseMode);
        return new ConcatenatedAudio(out, layout);
    }

    /**
     * Length of the buffer {@link #concatenate} would build for clips of the given sizes,
     * computed without assembling anything. Used for previews.
     *
     * @param tokens words and pauses in order
     * @param clipBytes clip size for the word token at an index
     * @param wordGapMs default silence between entries
     * @param pauseMode how pauses combine with the word gap
     * @return total bytes
     */
    public long plannedLength(List<Token> tokens, IntUnaryOperator clipBytes, int wordGapMs, PauseMode pauseMode) {
        long total = 0;
        for (ConcatenatedAudio.Segment segment
                : plan(tokens, clipBytes, AudioFormat.silenceBytes(wordGapMs), pauseMode)) {
            total += segment.length();
        }
        return total;
    }

    private List<ConcatenatedAudio.Segment> plan(List<Token> tokens, IntUnaryOperator clipBytes, int gapBytes,
                                                 PauseMode mode) {
        List<ConcatenatedAudio.Segment> layout = new ArrayList<>(tokens.size() * 2);
        int offset = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isWord()) {
                int len = clipBytes.applyAsInt(i);
                layout.add(new ConcatenatedAudio.Segment(token.word(), offset, len, false));
                offset += len;
            } else {
                int len = AudioFormat.silenceBytes(token.pauseDurationMs());
                if (len > 0) {
                    layout.add(new ConcatenatedAudio.Segment(token.word(), offset, len, true));
                    offset += len;
                }
            }

            boolean last = i == tokens.size() - 1;
            if (last || gapBytes == 0) {
                continue;
            }
            boolean insertGap = token.isWord()
                    && (mode == PauseMode.ADDITIVE || tokens.get(i + 1).isWord());
            if (insertGap) {
                layout.add(new ConcatenatedAudio.Segment(GAP_LABEL, offset, gapBytes, true));
                offset += gapBytes;
            }
        }
        return layout;
    }

    private void validateClips(Composition composition) {
        List<Token> tokens = composition.tokens();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.isWord()) {
                continue;
            }
            WordClip clip = composition.clipAt(i);
            if (clip == null) {
                throw new ConcatenationException(token.word(), 0, "no clip resolved");
            }
            if (clip.sizeBytes() == 0) {
                throw new ConcatenationException(token.word(), 0, "clip is empty");
            }
            if (!AudioFormat.isFrameAligned(clip.sizeBytes())) {
                throw new ConcatenationException(token.word(), clip.sizeBytes(),
                        "not aligned to " + AudioFormat.BLOCK_ALIGN + "-byte frames");
            }
        }
    }

    private static int nextWordIndex(Composition composition, int from) {
        int i = from;
        while (!composition.tokens().get(i).isWord()) {
            i++;
        }
        return i;
    }
}
