package com.phillippitts.voxbank.service.cache;

import com.phillippitts.voxbank.domain.CacheKey;
import com.phillippitts.voxbank.domain.ClipMetadata;
import com.phillippitts.voxbank.domain.WordClip;
import com.phillippitts.voxbank.exception.InvalidRequestException;
import com.phillippitts.voxbank.exception.WordBankStorageException;
import com.phillippitts.voxbank.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * File-per-clip word bank.
 *
 * <p>Layout: {@code <baseDir>/<scopeId>/<voiceId>/<word>.pcm} holds the raw payload and a
 * sibling {@code <word>.json} holds size, duration and creation time, so listings never
 * touch audio. Each scope is indexed in memory on first access (one directory scan) and
 * kept in a {@link ConcurrentHashMap} keyed by {@link CacheKey}, so lookups are O(1).
 *
 * <p>Files are written to a temp file in the target directory and moved into place, so a
 * reader never sees a partially written clip. Writers of the same key are serialized on
 * a striped monitor so payload and metadata always come from the same writer; the stripe
 * count is fixed, so purging never leaves lock objects behind.
 *
 * <p>Purges delete only the files of the purged keys. A scope or voice directory is removed
 * only once it is empty, so a clip written concurrently for that scope survives.
 */
public class FileSystemWordBankCache implements WordBankCache {

    private static final Logger LOG = LogManager.getLogger(FileSystemWordBankCache.class);

    private static final String PCM_SUFFIX = ".pcm";
    private static final String META_SUFFIX = ".json";
    private static final Pattern SAFE_SEGMENT = Pattern.compile("[A-Za-z0-9._-]{1,64}");
    private static final Pattern SAFE_WORD = Pattern.compile("[a-z0-9_-]{1,64}");
    static final int LOCK_STRIPES = 64;

    private final Path baseDir;
    private final Map<String, Map<CacheKey, ClipMetadata>> scopes = new ConcurrentHashMap<>();
    private final Object[] keyLocks = new Object[LOCK_STRIPES];

    public FileSystemWordBankCache(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir must not be null").toAbsolutePath().normalize();
        for (int i = 0; i < keyLocks.length; i++) {
            keyLocks[i] = new Object();
        }
        try {
            Files.createDirectories(this.baseDir);
        } catch (IOException e) {
            throw new WordBankStorageException("Cannot create word bank directory", this.baseDir.toString(), e);
        }
        LOG.info("Word bank stored under {}", this.baseDir);
    }

    public Path getBaseDir() {
        return baseDir;
    }

    @Override
    public Optional<WordClip> get(CacheKey key) {
        validateKey(key);
        ClipMetadata meta = index(key.scopeId()).get(key);
        if (meta == null) {
            return Optional.empty();
        }
        Path pcm = pcmPath(key);
        try {
            byte[] bytes = Files.readAllBytes(pcm);
            return Optional.of(WordClip.of(key, bytes, meta.createdAt()));
        } catch (NoSuchFileException e) {
            // Deleted behind our back; treat as a miss and forget it
            LOG.warn("Clip file vanished for {}/{}/{}, dropping index entry",
                    key.scopeId(), key.voiceId(), key.word());
            index(key.scopeId()).remove(key, meta);
            return Optional.empty();
        } catch (IOException e) {
            throw new WordBankStorageException("Failed to read clip", pcm.toString(), e);
        }
    }

    @Override
    public Optional<ClipMetadata> metadata(CacheKey key) {
        validateKey(key);
        return Optional.ofNullable(index(key.scopeId()).get(key));
    }

    @Override
    public void put(WordClip clip) {
        Objects.requireNonNull(clip, "clip must not be null");
        CacheKey key = clip.key();
        validateKey(key);
        if (clip.sizeBytes() == 0 || !AudioFormat.isFrameAligned(clip.sizeBytes())) {
            throw new IllegalArgumentException("Clip payload must be non-empty and frame-aligned, got "
                    + clip.sizeBytes() + " bytes for '" + key.word() + "'");
        }
        Path dir = pcmPath(key).getParent();
        synchronized (lockFor(key)) {
            try {
                writeClip(clip, dir);
            } catch (NoSuchFileException e) {
                // Directory removed by a concurrent purge between create and write
                LOG.debug("Clip directory {} vanished during write, retrying once", dir);
                try {
                    writeClip(clip, dir);
                } catch (IOException retry) {
                    throw new WordBankStorageException("Failed to write clip", dir.toString(), retry);
                }
            } catch (IOException e) {
                throw new WordBankStorageException("Failed to write clip", dir.toString(), e);
            }
            index(key.scopeId()).put(key, clip.metadata());
        }
        LOG.debug("Stored clip {}/{}/{} ({} bytes)", key.scopeId(), key.voiceId(), key.word(), clip.sizeBytes());
    }

    @Override
    public boolean purgeWord(CacheKey key) {
        validateKey(key);
        synchronized (lockFor(key)) {
            ClipMetadata removed = index(key.scopeId()).remove(key);
            boolean deleted = deleteFile(pcmPath(key)) | deleteFile(metaPath(key));
            return removed != null || deleted;
        }
    }

    @Override
    public int purge(String scopeId, String voiceId) {
        validateSegment(scopeId, "scopeId");
        if (voiceId != null) {
            validateSegment(voiceId, "voiceId");
        }
        Map<CacheKey, ClipMetadata> index = index(scopeId);
        int removed = 0;
        for (CacheKey key : List.copyOf(index.keySet())) {
            if (voiceId == null || voiceId.equals(key.voiceId())) {
                if (purgeWord(key)) {
                    removed++;
                }
            }
        }
        Path scopeDir = baseDir.resolve(scopeId);
        if (voiceId != null) {
            deleteIfEmpty(scopeDir.resolve(voiceId));
        } else {
            deleteEmptyVoiceDirs(scopeDir);
        }
        deleteIfEmpty(scopeDir);
        LOG.info("Purged {} clip(s) from scope {}{}", removed, scopeId, voiceId == null ? "" : " voice " + voiceId);
        return removed;
    }

    @Override
    public List<ClipMetadata> list(String scopeId, String voiceId) {
        validateSegment(scopeId, "scopeId");
        List<ClipMetadata> out = new ArrayList<>();
        for (ClipMetadata meta : index(scopeId).values()) {
            if (voiceId == null || voiceId.equals(meta.key().voiceId())) {
                out.add(meta);
            }
        }
        out.sort(Comparator.comparing((ClipMetadata m) -> m.key().voiceId()).thenComparing(m -> m.key().word()));
        return out;
    }

    private Map<CacheKey, ClipMetadata> index(String scopeId) {
        return scopes.computeIfAbsent(scopeId, this::loadScope);
    }

    Object lockFor(CacheKey key) {
        return keyLocks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
    }

    private void writeClip(WordClip clip, Path dir) throws IOException {
        Files.createDirectories(dir);
        writeAtomically(pcmPath(clip.key()), clip.audioBytes());
        writeAtomically(metaPath(clip.key()), toJson(clip.metadata()).getBytes(StandardCharsets.UTF_8));
    }

    private Map<CacheKey, ClipMetadata> loadScope(String scopeId) {
        Map<CacheKey, ClipMetadata> index = new ConcurrentHashMap<>();
        Path scopeDir = baseDir.resolve(scopeId);
        if (!Files.isDirectory(scopeDir)) {
            return index;
        }
        try (DirectoryStream<Path> voices = Files.newDirectoryStream(scopeDir, Files::isDirectory)) {
            for (Path voiceDir : voices) {
                String voiceId = voiceDir.getFileName().toString();
                if (!SAFE_SEGMENT.matcher(voiceId).matches()) {
                    continue;
                }
                loadVoice(scopeId, voiceId, voiceDir, index);
            }
        } catch (IOException e) {
            throw new WordBankStorageException("Failed to index scope", scopeDir.toString(), e);
        }
        LOG.debug("Indexed {} clip(s) for scope {}", index.size(), scopeId);
        return index;
    }

    private void loadVoice(String scopeId, String voiceId, Path voiceDir, Map<CacheKey, ClipMetadata> index)
            throws IOException {
        try (DirectoryStream<Path> clips = Files.newDirectoryStream(voiceDir, "*" + PCM_SUFFIX)) {
            for (Path pcm : clips) {
                String name = pcm.getFileName().toString();
                String word = name.substring(0, name.length() - PCM_SUFFIX.length());
                if (!SAFE_WORD.matcher(word).matches()) {
                    continue;
                }
                CacheKey key = CacheKey.of(scopeId, word, voiceId);
                index.put(key, readMetadata(key, pcm));
            }
        }
    }

    private ClipMetadata readMetadata(CacheKey key, Path pcm) throws IOException {
        long size = Files.size(pcm);
        Path meta = metaPath(key);
        if (Files.exists(meta)) {
            try {
                JSONObject json = new JSONObject(Files.readString(meta, StandardCharsets.UTF_8));
                Instant createdAt = Instant.parse(json.getString("createdAt"));
                return new ClipMetadata(key, size, AudioFormat.durationSeconds(size), createdAt);
            } catch (JSONException | DateTimeParseException e) {
                LOG.warn("Unreadable metadata {}, rebuilding from payload: {}", meta, e.getMessage());
            }
        }
        // Size and duration always follow the payload; only the creation time needs the sidecar
        Instant createdAt = Files.getLastModifiedTime(pcm).toInstant();
        return new ClipMetadata(key, size, AudioFormat.durationSeconds(size), createdAt);
    }

    private static String toJson(ClipMetadata meta) {
        JSONObject json = new JSONObject();
        json.put("scope", meta.key().scopeId());
        json.put("voice", meta.key().voiceId());
        json.put("word", meta.key().word());
        json.put("sizeBytes", meta.sizeBytes());
        json.put("durationSeconds", meta.durationSeconds());
        json.put("createdAt", meta.createdAt().toString());
        return json.toString();
    }

    private static void writeAtomically(Path target, byte[] data) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, data);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static boolean deleteFile(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new WordBankStorageException("Failed to delete clip file", path.toString(), e);
        }
    }

    private static void deleteEmptyVoiceDirs(Path scopeDir) {
        if (!Files.isDirectory(scopeDir)) {
            return;
        }
        try (DirectoryStream<Path> voices = Files.newDirectoryStream(scopeDir, Files::isDirectory)) {
            for (Path voiceDir : voices) {
                deleteIfEmpty(voiceDir);
            }
        } catch (IOException e) {
            throw new WordBankStorageException("Failed to list scope directory", scopeDir.toString(), e);
        }
    }

    private static void deleteIfEmpty(Path dir) {
        try {
            Files.deleteIfExists(dir);
        } catch (DirectoryNotEmptyException e) {
            LOG.debug("Keeping non-empty directory {}", dir);
        } catch (IOException e) {
            throw new WordBankStorageException("Failed to delete directory", dir.toString(), e);
        }
    }

    private Path pcmPath(CacheKey key) {
        return baseDir.resolve(key.scopeId()).resolve(key.voiceId()).resolve(key.word() + PCM_SUFFIX);
    }

    private Path metaPath(CacheKey key) {
        return baseDir.resolve(key.scopeId()).resolve(key.voiceId()).resolve(key.word() + META_SUFFIX);
    }

    private static void validateKey(CacheKey key) {
        Objects.requireNonNull(key, "key must not be null");
        validateSegment(key.scopeId(), "scopeId");
        validateSegment(key.voiceId(), "voiceId");
        if (!SAFE_WORD.matcher(key.word()).matches()) {
            throw new InvalidRequestException("word", "Word must match [a-z0-9_-]{1,64}");
        }
    }

    static void validateSegment(String value, String field) {
        if (value == null || !SAFE_SEGMENT.matcher(value).matches() || value.equals(".") || value.equals("..")) {
            throw new InvalidRequestException(field, field + " must match [A-Za-z0-9._-]{1,64}");
        }
    }
}
