package com.phillippitts.voxbank.service.filter;

import com.phillippitts.voxbank.domain.CustomFilterSettings;
import com.phillippitts.voxbank.service.audio.AudioFormat;
import org.springframework.stereotype.Component;

/**
 * In-process public-address effects chain.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>Second-order highpass at {@code highpassHz} (RBJ cookbook biquad, Q = 0.707)</li>
 *   <li>Second-order lowpass at {@code lowpassHz}</li>
 *   <li>Feed-forward RMS compressor, threshold -18 dB, 5 ms attack, 80 ms release, with
 *       makeup gain restoring half of the reduction at threshold</li>
 *   <li>tanh soft clipper, drive {@code 1 + 9 * distortion}, normalized to unity peak</li>
 * </ol>
 *
 * <p>Biquads run in Direct Form II Transposed with independent state per channel. Every
 * call starts from silent state, so the chain holds no state between buffers and the
 * component is safe for concurrent use.
 */
@Component
public class PaEffectsChain implements AudioEffectsProcessor {

    private static final double Q = Math.sqrt(0.5);
    private static final double THRESHOLD_DB = -18.0;
    private static final double ATTACK_MS = 5.0;
    private static final double RELEASE_MS = 80.0;
    private static final double RMS_SMOOTHING = 0.001;
    private static final int CHANNELS = AudioFormat.CHANNELS;

    @Override
    public byte[] process(byte[] pcm, CustomFilterSettings settings) {
        if (!AudioFormat.isFrameAligned(pcm.length)) {
            throw new IllegalArgumentException("PCM buffer not frame-aligned: " + pcm.length + " bytes");
        }
        float[] samples = toFloat(pcm);
        biquad(samples, Biquad.highpass(settings.highpassHz()));
        biquad(samples, Biquad.lowpass(settings.lowpassHz()));
        compress(samples, settings.compressionRatio());
        distort(samples, settings.distortion());
        return toPcm(samples);
    }

    @Override
    public String name() {
        return "pa-chain";
    }

    private static void biquad(float[] samples, Biquad c) {
        int frames = samples.length / CHANNELS;
        for (int ch = 0; ch < CHANNELS; ch++) {
            double z1 = 0;
            double z2 = 0;
            for (int frame = 0; frame < frames; frame++) {
                int idx = frame * CHANNELS + ch;
                double x = samples[idx];
                // Direct Form II Transposed
                double y = c.b0 * x + z1;
                z1 = c.b1 * x - c.a1 * y + z2;
                z2 = c.b2 * x - c.a2 * y;
                samples[idx] = (float) y;
            }
        }
    }

    private static void compress(float[] samples, double ratio) {
        if (ratio <= 1.0) {
            return;
        }
        double attack = 1.0 - Math.exp(-1.0 / (ATTACK_MS / 1000.0 * AudioFormat.SAMPLE_RATE));
        double release = 1.0 - Math.exp(-1.0 / (RELEASE_MS / 1000.0 * AudioFormat.SAMPLE_RATE));
        double makeup = Math.pow(10.0, (-THRESHOLD_DB * (1.0 - 1.0 / ratio) / 2.0) / 20.0);
        double rmsSquared = 0;
        double gain = 1.0;
        int frames = samples.length / CHANNELS;
        for (int frame = 0; frame < frames; frame++) {
            double sumSq = 0;
            for (int ch = 0; ch < CHANNELS; ch++) {
                double s = samples[frame * CHANNELS + ch];
                sumSq += s * s;
            }
            rmsSquared += (sumSq / CHANNELS - rmsSquared) * RMS_SMOOTHING;
            double levelDb = rmsSquared > 1e-10 ? 10.0 * Math.log10(rmsSquared) : -100.0;
            double target = 1.0;
            if (levelDb > THRESHOLD_DB) {
                double gainDb = THRESHOLD_DB + (levelDb - THRESHOLD_DB) / ratio - levelDb;
                target = Math.pow(10.0, gainDb / 20.0);
            }
            gain += (target - gain) * (target < gain ? attack : release);
            for (int ch = 0; ch < CHANNELS; ch++) {
                int idx = frame * CHANNELS + ch;
                samples[idx] = (float) (samples[idx] * gain * makeup);
            }
        }
    }

    private static void distort(float[] samples, double amount) {
        if (amount <= 0.0) {
            return;
        }
        double drive = 1.0 + 9.0 * amount;
        double norm = Math.tanh(drive);
        for (int i = 0; i < samples.length; i++) {
            samples[i] = (float) (Math.tanh(samples[i] * drive) / norm);
        }
    }

    private static float[] toFloat(byte[] pcm) {
        float[] out = new float[pcm.length / AudioFormat.BYTES_PER_SAMPLE];
        for (int i = 0; i < out.length; i++) {
            int lo = pcm[2 * i] & 0xFF;
            int hi = pcm[2 * i + 1];
            out[i] = (short) ((hi << 8) | lo) / 32768f;
        }
        return out;
    }

    private static byte[] toPcm(float[] samples) {
        byte[] out = new byte[samples.length * AudioFormat.BYTES_PER_SAMPLE];
        for (int i = 0; i < samples.length; i++) {
            float s = Math.max(-1f, Math.min(1f, samples[i]));
            int v = Math.round(s * 32767f);
            out[2 * i] = (byte) (v & 0xFF);
            out[2 * i + 1] = (byte) ((v >> 8) & 0xFF);
        }
        return out;
    }

    /**
     * Normalized biquad coefficients (a0 = 1), Audio EQ Cookbook (Robert Bristow-Johnson).
     */
    private record Biquad(double b0, double b1, double b2, double a1, double a2) {

        static Biquad highpass(double freq) {
            double w0 = 2.0 * Math.PI * freq / AudioFormat.SAMPLE_RATE;
            double cos = Math.cos(w0);
            double alpha = Math.sin(w0) / (2.0 * Q);
            double a0 = 1.0 + alpha;
            return new Biquad((1.0 + cos) / 2.0 / a0, -(1.0 + cos) / a0, (1.0 + cos) / 2.0 / a0,
                    -2.0 * cos / a0, (1.0 - alpha) / a0);
        }

        static Biquad lowpass(double freq) {
            double w0 = 2.0 * Math.PI * Math.min(freq, AudioFormat.SAMPLE_RATE * 0.45) / AudioFormat.SAMPLE_RATE;
            double cos = Math.cos(w0);
            double alpha = Math.sin(w0) / (2.0 * Q);
            double a0 = 1.0 + alpha;
            return new Biquad((1.0 - cos) / 2.0 / a0, (1.0 - cos) / a0, (1.0 - cos) / 2.0 / a0,
                    -2.0 * cos / a0, (1.0 - alpha) / a0);
        }
    }
}
