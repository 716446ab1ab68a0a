/**
 * Synthesis of missing words.
 *
 * <p>The generator submits one task per distinct missing word to the generation pool; a
 * shared {@link com.phillippitts.voxbank.service.generation.ConcurrencyGuard} caps the
 * number of in-flight provider calls. Provider output is checked by
 * {@link com.phillippitts.voxbank.service.generation.ClipAudioValidator} before it is
 * written to the word bank. Failures are per word and never abort the other words.
 */
package com.phillippitts.voxbank.service.generation;
