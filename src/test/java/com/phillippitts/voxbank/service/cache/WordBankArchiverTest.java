package com.phillippitts.voxbank.service.cache;

import com.phillippitts.voxbank.config.properties.WordBankProperties;
import com.phillippitts.voxbank.domain.CacheKey;
import com.phillippitts.voxbank.domain.ClipMetadata;
import com.phillippitts.voxbank.exception.ArchiveException;
import com.phillippitts.voxbank.service.audio.AudioFormat;
import com.phillippitts.voxbank.testutil.PcmFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WordBankArchiverTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @TempDir
    Path baseDir;

    private FileSystemWordBankCache cache;
    private WordBankProperties props;
    private WordBankArchiver archiver;

    @BeforeEach
    void setUp() {
        cache = new FileSystemWordBankCache(baseDir);
        props = new WordBankProperties();
        archiver = new WordBankArchiver(cache, props, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void exportWritesManifestFirstThenOneEntryPerClip() throws IOException {
        cache.put(PcmFixtures.clip("src", "gate", "amy", 0.25));
        cache.put(PcmFixtures.clip("src", "open", "amy", 0.5));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ArchiveManifest manifest = archiver.exportArchive("src", null, out);

        assertThat(entryNames(out.toByteArray()))
                .containsExactly("manifest.json", "clips/amy/gate.pcm", "clips/amy/open.pcm");
        assertThat(manifest.sourceScope()).isEqualTo("src");
        assertThat(manifest.exportedAt()).isEqualTo(NOW);
        assertThat(manifest.isCompatible()).isTrue();
        assertThat(manifest.clips()).extracting(ArchiveManifest.Entry::sizeBytes).containsExactly(48_000L, 96_000L);
    }

    @Test
    void exportCanBeLimitedToOneVoice() throws IOException {
        cache.put(PcmFixtures.clip("src", "gate", "amy", 0.1));
        cache.put(PcmFixtures.clip("src", "gate", "bob", 0.1));

        ArchiveManifest manifest = archiver.exportArchive("src", "bob", new ByteArrayOutputStream());

        assertThat(manifest.clips()).extracting(ArchiveManifest.Entry::voice).containsExactly("bob");
    }

    @Test
    void exportedArchiveImportsIntoAnotherScopeUnchanged() throws IOException {
        cache.put(PcmFixtures.clip("src", "gate", "amy", 0.25));
        cache.put(PcmFixtures.clip("src", "open", "bob", 0.5));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        archiver.exportArchive("src", null, out);

        ImportReport report = archiver.importArchive("dst", new ByteArrayInputStream(out.toByteArray()));

        assertThat(report.sourceScope()).isEqualTo("src");
        assertThat(report.targetScope()).isEqualTo("dst");
        assertThat(report.imported()).containsExactly("amy/gate", "bob/open");
        assertThat(report.rejected()).isEmpty();
        assertThat(cache.get(CacheKey.of("dst", "open", "bob")).orElseThrow().audioBytes())
                .isEqualTo(cache.get(CacheKey.of("src", "open", "bob")).orElseThrow().audioBytes());
        assertThat(cache.metadata(CacheKey.of("dst", "gate", "amy")).orElseThrow().createdAt())
                .isEqualTo(PcmFixtures.CREATED);
    }

    @Test
    void importRejectsEntriesThatDoNotMatchTheManifest() throws IOException {
        byte[] good = PcmFixtures.pcm(0.1, (byte) 3);
        List<ClipMetadata> declared = List.of(
                meta("good", good.length),
                meta("short", 400),
                meta("missing", 400),
                meta("ragged", 6));
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("manifest.json", manifestJson(declared));
        entries.put("clips/amy/good.pcm", good);
        entries.put("clips/amy/short.pcm", new byte[200]);
        entries.put("clips/amy/ragged.pcm", new byte[6]);

        ImportReport report = archiver.importArchive("dst", new ByteArrayInputStream(zip(entries)));

        assertThat(report.imported()).containsExactly("amy/good");
        assertThat(report.rejected()).extracting(ImportReport.Rejection::word)
                .containsExactly("short", "missing", "ragged");
        assertThat(report.rejected().get(0).reason()).startsWith("size mismatch");
        assertThat(report.rejected().get(1).reason()).startsWith("payload missing");
        assertThat(report.rejected().get(2).reason()).contains("frame-aligned");
        assertThat(cache.list("dst", null)).hasSize(1);
    }

    @Test
    void importRejectsClipsLongerThanTheLimit() throws IOException {
        props.setMaxClipSeconds(1);
        byte[] longClip = PcmFixtures.pcm(1.5, (byte) 3);
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("manifest.json", manifestJson(List.of(meta("long", longClip.length))));
        entries.put("clips/amy/long.pcm", longClip);

        ImportReport report = archiver.importArchive("dst", new ByteArrayInputStream(zip(entries)));

        assertThat(report.importedCount()).isZero();
        assertThat(report.rejected()).singleElement()
                .extracting(ImportReport.Rejection::reason).isEqualTo("clip longer than 1s");
    }

    @Test
    void importIgnoresEntriesNotNamedByTheManifest() throws IOException {
        byte[] good = PcmFixtures.pcm(0.1, (byte) 3);
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("manifest.json", manifestJson(List.of(meta("good", good.length))));
        entries.put("clips/amy/good.pcm", good);
        entries.put("../outside.pcm", good);

        ImportReport report = archiver.importArchive("dst", new ByteArrayInputStream(zip(entries)));

        assertThat(report.imported()).containsExactly("amy/good");
        assertThat(baseDir.getParent().resolve("outside.pcm")).doesNotExist();
    }

    @Test
    void importFailsWithoutManifest() throws IOException {
        byte[] archive = zip(Map.of("clips/amy/gate.pcm", new byte[4]));

        assertThatThrownBy(() -> archiver.importArchive("dst", new ByteArrayInputStream(archive)))
                .isInstanceOf(ArchiveException.class)
                .hasMessageContaining("manifest.json");
    }

    @Test
    void importFailsForIncompatibleFormat() throws IOException {
        ArchiveManifest mono = new ArchiveManifest(ArchiveManifest.FORMAT_VERSION, AudioFormat.SAMPLE_RATE,
                AudioFormat.BITS_PER_SAMPLE, 1, "src", NOW, List.of());
        byte[] archive = zip(Map.of("manifest.json", mono.toJson().getBytes(StandardCharsets.UTF_8)));

        assertThatThrownBy(() -> archiver.importArchive("dst", new ByteArrayInputStream(archive)))
                .isInstanceOf(ArchiveException.class)
                .hasMessageContaining("Incompatible");
    }

    @Test
    void importFailsForUnknownVersion() throws IOException {
        ArchiveManifest future = new ArchiveManifest(99, AudioFormat.SAMPLE_RATE,
                AudioFormat.BITS_PER_SAMPLE, AudioFormat.CHANNELS, "src", NOW, List.of());
        byte[] archive = zip(Map.of("manifest.json", future.toJson().getBytes(StandardCharsets.UTF_8)));

        assertThatThrownBy(() -> archiver.importArchive("dst", new ByteArrayInputStream(archive)))
                .isInstanceOf(ArchiveException.class);
    }

    @Test
    void importFailsForMalformedManifest() throws IOException {
        byte[] archive = zip(Map.of("manifest.json", "{not json".getBytes(StandardCharsets.UTF_8)));

        assertThatThrownBy(() -> archiver.importArchive("dst", new ByteArrayInputStream(archive)))
                .isInstanceOf(ArchiveException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    void importFailsWhenArchiveExceedsSizeLimit() throws IOException {
        props.setMaxImportBytes(1024);
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("manifest.json", manifestJson(List.of(meta("big", 4096))));
        entries.put("clips/amy/big.pcm", new byte[4096]);
        byte[] archive = zip(entries);

        assertThatThrownBy(() -> archiver.importArchive("dst", new ByteArrayInputStream(archive)))
                .isInstanceOf(ArchiveException.class)
                .hasMessageContaining("exceeds");
    }

    private static ClipMetadata meta(String word, long size) {
        return new ClipMetadata(CacheKey.of("src", word, "amy"), size, AudioFormat.durationSeconds(size),
                PcmFixtures.CREATED);
    }

    private static byte[] manifestJson(List<ClipMetadata> clips) {
        return ArchiveManifest.forClips("src", NOW, clips).toJson().getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] zip(Map<String, byte[]> entries) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Map.Entry<String, byte[]> e : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(e.getKey()));
                zip.write(e.getValue());
                zip.closeEntry();
            }
        }
        return out.toByteArray();
    }

    private static List<String> entryNames(byte[] archive) throws IOException {
        List<String> names = new ArrayList<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        return names;
    }
}
