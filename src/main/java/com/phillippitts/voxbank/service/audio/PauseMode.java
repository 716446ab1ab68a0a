package com.phillippitts.voxbank.service.audio;

/**
 * How an explicit pause token combines with the default word gap.
 */
public enum PauseMode {
    /** The word gap follows every word that is not the last entry; a pause adds its own silence. */
    ADDITIVE,
    /** At a pause boundary the pause duration replaces the word gap. */
    OVERRIDE
}
