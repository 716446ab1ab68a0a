package com.phillippitts.voxbank.service.generation;

import com.phillippitts.voxbank.exception.SynthesisProviderException;

/**
 * External text-to-speech service that renders one word at a time.
 *
 * <p>Implementations are called concurrently from the generation pool; the caller bounds
 * the number of in-flight calls, so implementations need no throttling of their own.
 */
public interface SynthesisProvider {

    /**
     * Synthesizes a single word.
     *
     * @param word normalized word
     * @param voiceId provider voice
     * @return raw PCM16LE stereo 48 kHz audio, or the same wrapped in a RIFF/WAVE container
     * @throws SynthesisProviderException when the provider fails or is unreachable
     */
    byte[] synthesizeWord(String word, String voiceId);

    /**
     * Short provider name for logs, events and metrics.
     */
    String name();
}
