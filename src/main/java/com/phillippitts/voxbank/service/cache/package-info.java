/**
 * Persistent word bank keyed by {@code (scopeId, word, voiceId)}.
 *
 * <p>{@link com.phillippitts.voxbank.service.cache.FileSystemWordBankCache} stores one raw
 * PCM file plus a JSON sidecar per clip under {@code <base>/<scope>/<voice>/}. Writes are
 * atomic replacements, so readers never observe a partial clip.
 * {@link com.phillippitts.voxbank.service.cache.WordBankArchiver} moves a scope between
 * installations as a ZIP archive with a versioned manifest.
 */
package com.phillippitts.voxbank.service.cache;
