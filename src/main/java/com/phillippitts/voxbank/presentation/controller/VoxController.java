package com.phillippitts.voxbank.presentation.controller;

import com.phillippitts.voxbank.domain.CacheKey;
import com.phillippitts.voxbank.domain.ClipMetadata;
import com.phillippitts.voxbank.domain.FailureReason;
import com.phillippitts.voxbank.domain.SynthesisPreview;
import com.phillippitts.voxbank.domain.SynthesisRequest;
import com.phillippitts.voxbank.domain.SynthesisResult;
import com.phillippitts.voxbank.domain.Token;
import com.phillippitts.voxbank.exception.InvalidRequestException;
import com.phillippitts.voxbank.presentation.dto.CompositionEntry;
import com.phillippitts.voxbank.presentation.dto.FilterRequest;
import com.phillippitts.voxbank.presentation.dto.PreviewRequest;
import com.phillippitts.voxbank.presentation.dto.SynthesisFailureResponse;
import com.phillippitts.voxbank.presentation.dto.SynthesizeRequest;
import com.phillippitts.voxbank.service.audio.WavWriter;
import com.phillippitts.voxbank.service.cache.CacheStats;
import com.phillippitts.voxbank.service.cache.ImportReport;
import com.phillippitts.voxbank.service.cache.WordBankArchiver;
import com.phillippitts.voxbank.service.cache.WordBankCache;
import com.phillippitts.voxbank.service.orchestration.VoxOrchestrator;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Thin REST surface over the word bank pipeline. All behavior lives in the services;
 * this class maps bodies to domain requests and results to HTTP.
 */
@RestController
@RequestMapping("/api/vox/{scopeId}")
class VoxController {

    private static final Logger LOG = LogManager.getLogger(VoxController.class);
    static final MediaType AUDIO_WAV = MediaType.parseMediaType("audio/wav");
    static final MediaType APPLICATION_ZIP = MediaType.parseMediaType("application/zip");

    private final VoxOrchestrator orchestrator;
    private final WordBankCache cache;
    private final WordBankArchiver archiver;

    VoxController(VoxOrchestrator orchestrator, WordBankCache cache, WordBankArchiver archiver) {
        this.orchestrator = orchestrator;
        this.cache = cache;
        this.archiver = archiver;
    }

    /**
     * Runs the pipeline. Returns the audio ({@code format=wav} by default, or raw
     * {@code pcm}) with counts in {@code X-Vox-*} headers, or a JSON failure body.
     */
    @PostMapping("/synthesize")
    ResponseEntity<?> synthesize(@PathVariable String scopeId,
                                 @RequestParam(defaultValue = "wav") String format,
                                 @Valid @RequestBody SynthesizeRequest body) {
        boolean wav = switch (format.toLowerCase(Locale.ROOT)) {
            case "wav" -> true;
            case "pcm" -> false;
            default -> throw new InvalidRequestException("format", "format must be wav or pcm");
        };
        SynthesisResult result = orchestrator.synthesize(toDomain(scopeId, body));

        if (!result.success()) {
            return ResponseEntity.status(statusFor(result.failureReason()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(SynthesisFailureResponse.of(result));
        }
        byte[] audio = wav ? WavWriter.toWav(result.buffer()) : result.buffer();
        return ResponseEntity.ok()
                .contentType(wav ? AUDIO_WAV : MediaType.APPLICATION_OCTET_STREAM)
                .header("X-Vox-Matched-Words", String.valueOf(result.matchedWords().size()))
                .header("X-Vox-Skipped-Words", String.valueOf(result.skipped().size()))
                .header("X-Vox-Cached-Words", String.valueOf(result.cachedCount()))
                .header("X-Vox-Generated-Words", String.valueOf(result.generatedCount()))
                .header("X-Vox-Duration-Seconds", String.format(Locale.ROOT, "%.3f",
                        result.durationEstimateSeconds()))
                .body(audio);
    }

    @PostMapping("/preview")
    ResponseEntity<SynthesisPreview> preview(@PathVariable String scopeId,
                                             @Valid @RequestBody PreviewRequest body) {
        return ResponseEntity.ok(orchestrator.preview(scopeId, body.voiceId(), body.text(), body.wordGapMs()));
    }

    @GetMapping("/stats")
    ResponseEntity<CacheStats> stats(@PathVariable String scopeId) {
        return ResponseEntity.ok(cache.stats(scopeId));
    }

    /**
     * Lists clip metadata, or searches words when {@code q} is given.
     */
    @GetMapping("/clips")
    ResponseEntity<List<ClipMetadata>> clips(@PathVariable String scopeId,
                                             @RequestParam(required = false) String voice,
                                             @RequestParam(required = false) String q,
                                             @RequestParam(defaultValue = "" + WordBankCache.DEFAULT_SEARCH_RESULTS)
                                             int limit) {
        if (q == null) {
            return ResponseEntity.ok(cache.list(scopeId, voice));
        }
        return ResponseEntity.ok(cache.search(scopeId, voice, q, limit));
    }

    /**
     * Purges one word ({@code word} and {@code voice}), one voice, or the whole scope.
     */
    @DeleteMapping("/clips")
    ResponseEntity<Map<String, Integer>> purge(@PathVariable String scopeId,
                                               @RequestParam(required = false) String voice,
                                               @RequestParam(required = false) String word) {
        int deleted;
        if (word != null) {
            if (voice == null) {
                throw new InvalidRequestException("voice", "voice is required when purging a single word");
            }
            deleted = cache.purgeWord(CacheKey.of(scopeId, word, voice)) ? 1 : 0;
        } else {
            deleted = cache.purge(scopeId, voice);
        }
        LOG.info("Purged {} clip(s) from scope {} (voice={})", deleted, scopeId, voice == null ? "*" : voice);
        return ResponseEntity.ok(Map.of("deleted", deleted));
    }

    @GetMapping("/export")
    ResponseEntity<byte[]> export(@PathVariable String scopeId,
                                  @RequestParam(required = false) String voice) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        archiver.exportArchive(scopeId, voice, out);
        return ResponseEntity.ok()
                .contentType(APPLICATION_ZIP)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + scopeId + "-wordbank.zip\"")
                .body(out.toByteArray());
    }

    @PostMapping(value = "/import", consumes = {"application/zip", MediaType.APPLICATION_OCTET_STREAM_VALUE})
    ResponseEntity<ImportReport> importArchive(@PathVariable String scopeId, @RequestBody byte[] archive) {
        return ResponseEntity.ok(archiver.importArchive(scopeId, new ByteArrayInputStream(archive)));
    }

    private static SynthesisRequest toDomain(String scopeId, SynthesizeRequest body) {
        if ((body.text() == null) == (body.composition() == null)) {
            throw new InvalidRequestException("Exactly one of text or composition must be provided");
        }
        SynthesisRequest request;
        if (body.text() != null) {
            request = SynthesisRequest.forText(scopeId, body.voiceId(), body.text());
        } else {
            List<Token> tokens = body.composition().stream().map(CompositionEntry::toToken).toList();
            request = SynthesisRequest.forComposition(scopeId, body.voiceId(), tokens);
        }
        return request.withFilter(FilterRequest.toSpec(body.filter())).withWordGapMs(body.wordGapMs());
    }

    static HttpStatus statusFor(FailureReason reason) {
        return switch (reason) {
            case NO_CONTENT -> HttpStatus.UNPROCESSABLE_ENTITY;
            case CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
            case CONCATENATION, FILTER, STORAGE, INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
