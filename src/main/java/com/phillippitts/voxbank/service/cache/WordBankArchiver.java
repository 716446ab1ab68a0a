package com.phillippitts.voxbank.service.cache;

import com.phillippitts.voxbank.config.properties.WordBankProperties;
import com.phillippitts.voxbank.domain.CacheKey;
import com.phillippitts.voxbank.domain.ClipMetadata;
import com.phillippitts.voxbank.domain.WordClip;
import com.phillippitts.voxbank.exception.ArchiveException;
import com.phillippitts.voxbank.exception.InvalidRequestException;
import com.phillippitts.voxbank.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Moves word bank content between scopes and installations as a ZIP archive.
 *
 * <p>Archive layout: {@code manifest.json} first, then one {@code clips/<voice>/<word>.pcm}
 * entry per clip. Import validates the manifest against the actual payloads before
 * writing anything for an entry; entries the manifest does not name are ignored, and file
 * system paths are always rebuilt from validated cache keys, never from entry names.
 */
@Component
public class WordBankArchiver {

    private static final Logger LOG = LogManager.getLogger(WordBankArchiver.class);

    private final WordBankCache cache;
    private final WordBankProperties properties;
    private final Clock clock;

    @Autowired
    public WordBankArchiver(WordBankCache cache, WordBankProperties properties) {
        this(cache, properties, Clock.systemUTC());
    }

    WordBankArchiver(WordBankCache cache, WordBankProperties properties, Clock clock) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Writes one voice (or every voice when {@code voiceId} is null) of a scope to {@code out}.
     *
     * @return the manifest that was written
     */
    public ArchiveManifest exportArchive(String scopeId, String voiceId, OutputStream out) throws IOException {
        List<WordClip> clips = new ArrayList<>();
        for (ClipMetadata meta : cache.list(scopeId, voiceId)) {
            // A clip purged between listing and reading is left out
            cache.get(meta.key()).ifPresent(clips::add);
        }
        ArchiveManifest manifest = ArchiveManifest.forClips(scopeId, Instant.now(clock),
                clips.stream().map(WordClip::metadata).toList());

        ZipOutputStream zip = new ZipOutputStream(out, StandardCharsets.UTF_8);
        zip.putNextEntry(new ZipEntry(ArchiveManifest.MANIFEST_NAME));
        zip.write(manifest.toJson().getBytes(StandardCharsets.UTF_8));
        zip.closeEntry();
        for (int i = 0; i < clips.size(); i++) {
            zip.putNextEntry(new ZipEntry(manifest.clips().get(i).path()));
            zip.write(clips.get(i).audioBytes());
            zip.closeEntry();
        }
        zip.finish();
        LOG.info("Exported {} clip(s) from scope {}{}", clips.size(), scopeId,
                voiceId == null ? "" : " voice " + voiceId);
        return manifest;
    }

    /**
     * Reads an archive and writes every valid clip into {@code targetScope}.
     *
     * @throws ArchiveException when the archive is unreadable, too large, lacks a manifest,
     *                          or declares an incompatible format
     */
    public ImportReport importArchive(String targetScope, InputStream in) {
        FileSystemWordBankCache.validateSegment(targetScope, "scopeId");
        Map<String, byte[]> entries = readEntries(in);
        byte[] manifestBytes = entries.get(ArchiveManifest.MANIFEST_NAME);
        if (manifestBytes == null) {
            throw new ArchiveException("Archive has no " + ArchiveManifest.MANIFEST_NAME);
        }
        ArchiveManifest manifest = ArchiveManifest.fromJson(new String(manifestBytes, StandardCharsets.UTF_8));
        if (!manifest.isCompatible()) {
            throw new ArchiveException("Incompatible archive: version " + manifest.formatVersion() + ", "
                    + manifest.sampleRateHz() + " Hz, " + manifest.bitsPerSample() + " bit, "
                    + manifest.channels() + " channel(s)");
        }

        List<String> imported = new ArrayList<>();
        List<ImportReport.Rejection> rejected = new ArrayList<>();
        for (ArchiveManifest.Entry entry : manifest.clips()) {
            Optional<String> problem = check(entry, entries.get(entry.path()));
            if (problem.isPresent()) {
                rejected.add(new ImportReport.Rejection(entry.word(), entry.voice(), problem.get()));
                continue;
            }
            try {
                CacheKey key = CacheKey.of(targetScope, entry.word(), entry.voice());
                cache.put(new WordClip(key, entries.get(entry.path()), AudioFormat.durationSeconds(entry.sizeBytes()),
                        (int) entry.sizeBytes(), entry.createdAt()));
                imported.add(entry.voice() + "/" + entry.word());
            } catch (InvalidRequestException | IllegalArgumentException e) {
                rejected.add(new ImportReport.Rejection(entry.word(), entry.voice(), e.getMessage()));
            }
        }
        LOG.info("Imported {} clip(s) into scope {} from {} ({} rejected)",
                imported.size(), targetScope, manifest.sourceScope(), rejected.size());
        return new ImportReport(manifest.sourceScope(), targetScope, imported, rejected);
    }

    private Optional<String> check(ArchiveManifest.Entry entry, byte[] payload) {
        if (payload == null) {
            return Optional.of("payload missing: " + entry.path());
        }
        if (payload.length != entry.sizeBytes()) {
            return Optional.of("size mismatch: manifest " + entry.sizeBytes() + " bytes, payload "
                    + payload.length + " bytes");
        }
        if (payload.length == 0 || !AudioFormat.isFrameAligned(payload.length)) {
            return Optional.of("payload not frame-aligned (" + payload.length + " bytes)");
        }
        if (AudioFormat.durationSeconds(payload.length) > properties.getMaxClipSeconds()) {
            return Optional.of("clip longer than " + properties.getMaxClipSeconds() + "s");
        }
        return Optional.empty();
    }

    private Map<String, byte[]> readEntries(InputStream in) {
        long limit = properties.getMaxImportBytes();
        long total = 0;
        Map<String, byte[]> entries = new HashMap<>();
        byte[] buffer = new byte[8192];
        try (ZipInputStream zip = new ZipInputStream(in, StandardCharsets.UTF_8)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                ByteArrayOutputStream content = new ByteArrayOutputStream();
                int n;
                while ((n = zip.read(buffer)) > 0) {
                    total += n;
                    if (total > limit) {
                        throw new ArchiveException("Archive exceeds " + limit + " bytes uncompressed");
                    }
                    content.write(buffer, 0, n);
                }
                entries.put(entry.getName(), content.toByteArray());
            }
        } catch (IOException e) {
            throw new ArchiveException("Unreadable archive: " + e.getMessage(), e);
        }
        return entries;
    }
}
