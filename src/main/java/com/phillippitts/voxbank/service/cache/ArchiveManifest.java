package com.phillippitts.voxbank.service.cache;

import com.phillippitts.voxbank.domain.ClipMetadata;
import com.phillippitts.voxbank.exception.ArchiveException;
import com.phillippitts.voxbank.service.audio.AudioFormat;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Table of contents of a word bank archive ({@code manifest.json}).
 *
 * @param formatVersion archive layout version, currently {@value #FORMAT_VERSION}
 * @param sampleRateHz sample rate of every clip
 * @param bitsPerSample bit depth of every clip
 * @param channels channel count of every clip
 * @param sourceScope scope the archive was exported from
 * @param exportedAt export time
 * @param clips one entry per clip payload
 */
public record ArchiveManifest(
        int formatVersion,
        int sampleRateHz,
        int bitsPerSample,
        int channels,
        String sourceScope,
        Instant exportedAt,
        List<Entry> clips
) {

    public static final int FORMAT_VERSION = 1;
    public static final String MANIFEST_NAME = "manifest.json";

    public ArchiveManifest {
        Objects.requireNonNull(sourceScope, "sourceScope must not be null");
        Objects.requireNonNull(exportedAt, "exportedAt must not be null");
        clips = List.copyOf(clips);
    }

    /**
     * Manifest for clips at the fixed system format.
     */
    public static ArchiveManifest forClips(String sourceScope, Instant exportedAt, List<ClipMetadata> clips) {
        List<Entry> entries = new ArrayList<>(clips.size());
        for (ClipMetadata clip : clips) {
            entries.add(new Entry(clip.key().word(), clip.key().voiceId(), clip.sizeBytes(),
                    clip.durationSeconds(), clip.createdAt(), Entry.pathFor(clip.key().voiceId(), clip.key().word())));
        }
        return new ArchiveManifest(FORMAT_VERSION, AudioFormat.SAMPLE_RATE, AudioFormat.BITS_PER_SAMPLE,
                AudioFormat.CHANNELS, sourceScope, exportedAt, entries);
    }

    /**
     * True when the archive declares this build's version and the fixed audio format.
     */
    public boolean isCompatible() {
        return formatVersion == FORMAT_VERSION
                && sampleRateHz == AudioFormat.SAMPLE_RATE
                && bitsPerSample == AudioFormat.BITS_PER_SAMPLE
                && channels == AudioFormat.CHANNELS;
    }

    public String toJson() {
        JSONArray entries = new JSONArray();
        for (Entry clip : clips) {
            JSONObject e = new JSONObject();
            e.put("word", clip.word());
            e.put("voice", clip.voice());
            e.put("sizeBytes", clip.sizeBytes());
            e.put("durationSeconds", clip.durationSeconds());
            e.put("createdAt", clip.createdAt().toString());
            e.put("path", clip.path());
            entries.put(e);
        }
        JSONObject root = new JSONObject();
        root.put("formatVersion", formatVersion);
        root.put("sampleRateHz", sampleRateHz);
        root.put("bitsPerSample", bitsPerSample);
        root.put("channels", channels);
        root.put("sourceScope", sourceScope);
        root.put("exportedAt", exportedAt.toString());
        root.put("clips", entries);
        return root.toString(2);
    }

    /**
     * Parses a manifest.
     *
     * @throws ArchiveException if the JSON is malformed or a required field is missing
     */
    public static ArchiveManifest fromJson(String json) {
        try {
            JSONObject root = new JSONObject(json);
            JSONArray array = root.getJSONArray("clips");
            List<Entry> entries = new ArrayList<>(array.length());
            for (int i = 0; i < array.length(); i++) {
                JSONObject e = array.getJSONObject(i);
                entries.add(new Entry(
                        e.getString("word"),
                        e.getString("voice"),
                        e.getLong("sizeBytes"),
                        e.optDouble("durationSeconds", 0.0),
                        parseInstant(e.optString("createdAt", null)),
                        e.optString("path", Entry.pathFor(e.getString("voice"), e.getString("word")))));
            }
            return new ArchiveManifest(
                    root.getInt("formatVersion"),
                    root.getInt("sampleRateHz"),
                    root.getInt("bitsPerSample"),
                    root.getInt("channels"),
                    root.optString("sourceScope", "unknown"),
                    parseInstant(root.optString("exportedAt", null)),
                    entries);
        } catch (JSONException | DateTimeParseException e) {
            throw new ArchiveException("Malformed archive manifest: " + e.getMessage(), e);
        }
    }

    private static Instant parseInstant(String value) {
        return value == null || value.isBlank() ? Instant.EPOCH : Instant.parse(value);
    }

    /**
     * @param word normalized word
     * @param voice voice identifier
     * @param sizeBytes declared payload length
     * @param durationSeconds declared duration
     * @param createdAt original creation time
     * @param path archive entry holding the payload
     */
    public record Entry(String word, String voice, long sizeBytes, double durationSeconds,
                        Instant createdAt, String path) {

        static String pathFor(String voice, String word) {
            return "clips/" + voice + "/" + word + ".pcm";
        }
    }
}
