package com.phillippitts.voxbank.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Persistent word bank settings.
 *
 * <p>Properties:
 * <ul>
 *   <li>vox.cache.base-dir - root directory of the file-per-clip store (default: ./data/wordbank)</li>
 *   <li>vox.cache.max-import-bytes - largest accepted import archive (default: 64 MiB)</li>
 *   <li>vox.cache.max-clip-seconds - longest accepted single clip (default: 10)</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "vox.cache")
public class WordBankProperties {

    @NotBlank
    private String baseDir = "./data/wordbank";

    @Positive
    private long maxImportBytes = 64L * 1024 * 1024;

    @Positive
    private int maxClipSeconds = 10;

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public long getMaxImportBytes() {
        return maxImportBytes;
    }

    public void setMaxImportBytes(long maxImportBytes) {
        this.maxImportBytes = maxImportBytes;
    }

    public int getMaxClipSeconds() {
        return maxClipSeconds;
    }

    public void setMaxClipSeconds(int maxClipSeconds) {
        this.maxClipSeconds = maxClipSeconds;
    }
}
