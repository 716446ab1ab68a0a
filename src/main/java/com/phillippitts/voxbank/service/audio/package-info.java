/**
 * Audio format constants and PCM assembly.
 *
 * <p>All audio in the system is 48 kHz, 16-bit signed PCM, stereo, little-endian:
 * 192,000 bytes per second, 192 bytes per millisecond, 4-byte frames.
 *
 * <ul>
 *   <li>{@link com.phillippitts.voxbank.service.audio.AudioFormat} - format constants and
 *       silence/duration arithmetic</li>
 *   <li>{@link com.phillippitts.voxbank.service.audio.PcmConcatenator} - ordered clip and
 *       silence assembly</li>
 *   <li>{@link com.phillippitts.voxbank.service.audio.WavWriter} - WAV header wrapping for
 *       the playback consumer</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.voxbank.service.audio;
