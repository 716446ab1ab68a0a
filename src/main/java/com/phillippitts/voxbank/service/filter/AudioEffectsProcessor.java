package com.phillippitts.voxbank.service.filter;

import com.phillippitts.voxbank.domain.CustomFilterSettings;

/**
 * DSP backend that applies highpass, lowpass, compression and distortion in sequence.
 */
public interface AudioEffectsProcessor {

    /**
     * Processes a complete buffer.
     *
     * @param pcm PCM16LE stereo 48 kHz input, not modified
     * @param settings effect parameters
     * @return processed buffer of the same length
     */
    byte[] process(byte[] pcm, CustomFilterSettings settings);

    String name();
}
