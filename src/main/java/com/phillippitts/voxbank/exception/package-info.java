/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voxbank.exception.VoxBankException} - base for all errors</li>
 *   <li>{@link com.phillippitts.voxbank.exception.InvalidRequestException} - request rejected
 *       before any work (text, word gap, filter settings, identifiers)</li>
 *   <li>{@link com.phillippitts.voxbank.exception.SynthesisProviderException} - provider call
 *       failed for one word; recovered per word</li>
 *   <li>{@link com.phillippitts.voxbank.exception.NoContentException} - nothing resolvable</li>
 *   <li>{@link com.phillippitts.voxbank.exception.ConcatenationException} - malformed clip bytes</li>
 *   <li>{@link com.phillippitts.voxbank.exception.FilterException} - effects chain failure</li>
 *   <li>{@link com.phillippitts.voxbank.exception.WordBankStorageException} - cache I/O failure</li>
 *   <li>{@link com.phillippitts.voxbank.exception.ArchiveException} - unusable import archive</li>
 *   <li>{@link com.phillippitts.voxbank.exception.SynthesisCancelledException} - request cancelled</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to HTTP statuses in
 * {@code presentation.exception.GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.voxbank.exception;
