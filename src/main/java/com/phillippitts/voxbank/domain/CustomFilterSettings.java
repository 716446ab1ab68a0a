package com.phillippitts.voxbank.domain;

/**
 * Parameters of the public-address effects chain.
 *
 * @param highpassHz highpass cutoff in Hz
 * @param lowpassHz lowpass cutoff in Hz, above {@code highpassHz}
 * @param compressionRatio compressor ratio, 1.0 = no compression
 * @param distortion distortion amount in [0, 1], 0 = clean
 */
public record CustomFilterSettings(double highpassHz, double lowpassHz, double compressionRatio, double distortion) {

    /** Lowest cutoff accepted for either filter. */
    public static final double MIN_CUTOFF_HZ = 20.0;
    /** Highest cutoff accepted; just below Nyquist at 48 kHz. */
    public static final double MAX_CUTOFF_HZ = 20_000.0;
    /** Highest compression ratio accepted. */
    public static final double MAX_COMPRESSION_RATIO = 20.0;

    public CustomFilterSettings {
        if (!Double.isFinite(highpassHz) || highpassHz < MIN_CUTOFF_HZ || highpassHz > MAX_CUTOFF_HZ) {
            throw new IllegalArgumentException("highpassHz must be in [" + MIN_CUTOFF_HZ + ", " + MAX_CUTOFF_HZ
                    + "], got: " + highpassHz);
        }
        if (!Double.isFinite(lowpassHz) || lowpassHz < MIN_CUTOFF_HZ || lowpassHz > MAX_CUTOFF_HZ) {
            throw new IllegalArgumentException("lowpassHz must be in [" + MIN_CUTOFF_HZ + ", " + MAX_CUTOFF_HZ
                    + "], got: " + lowpassHz);
        }
        if (highpassHz >= lowpassHz) {
            throw new IllegalArgumentException("highpassHz (" + highpassHz + ") must be below lowpassHz ("
                    + lowpassHz + ")");
        }
        if (!Double.isFinite(compressionRatio) || compressionRatio < 1.0 || compressionRatio > MAX_COMPRESSION_RATIO) {
            throw new IllegalArgumentException("compressionRatio must be in [1, " + MAX_COMPRESSION_RATIO
                    + "], got: " + compressionRatio);
        }
        if (!Double.isFinite(distortion) || distortion < 0.0 || distortion > 1.0) {
            throw new IllegalArgumentException("distortion must be in [0, 1], got: " + distortion);
        }
    }
}
