package com.phillippitts.voxbank.service.cache;

import java.util.List;

/**
 * Result of importing an archive into a scope.
 *
 * @param sourceScope scope named in the archive manifest
 * @param targetScope scope the clips were written to
 * @param imported imported clips as {@code voice/word}, in manifest order
 * @param rejected manifest entries that were not imported
 */
public record ImportReport(String sourceScope, String targetScope, List<String> imported, List<Rejection> rejected) {

    public ImportReport {
        imported = List.copyOf(imported);
        rejected = List.copyOf(rejected);
    }

    public int importedCount() {
        return imported.size();
    }

    /**
     * @param word word named by the manifest entry
     * @param voice voice named by the manifest entry
     * @param reason why the entry was skipped
     */
    public record Rejection(String word, String voice, String reason) {
    }
}
