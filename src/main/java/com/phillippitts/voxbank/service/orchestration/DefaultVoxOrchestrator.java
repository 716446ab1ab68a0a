package com.phillippitts.voxbank.service.orchestration;

import com.phillippitts.voxbank.config.properties.RequestProperties;
import com.phillippitts.voxbank.domain.CacheKey;
import com.phillippitts.voxbank.domain.ClipMetadata;
import com.phillippitts.voxbank.domain.Composition;
import com.phillippitts.voxbank.domain.FailureReason;
import com.phillippitts.voxbank.domain.GenerationResult;
import com.phillippitts.voxbank.domain.GenerationStatus;
import com.phillippitts.voxbank.domain.PipelineStage;
import com.phillippitts.voxbank.domain.SkippedWord;
import com.phillippitts.voxbank.domain.SynthesisPreview;
import com.phillippitts.voxbank.domain.SynthesisRequest;
import com.phillippitts.voxbank.domain.SynthesisResult;
import com.phillippitts.voxbank.domain.Token;
import com.phillippitts.voxbank.exception.ConcatenationException;
import com.phillippitts.voxbank.exception.FilterException;
import com.phillippitts.voxbank.exception.InvalidRequestException;
import com.phillippitts.voxbank.exception.NoContentException;
import com.phillippitts.voxbank.exception.SynthesisCancelledException;
import com.phillippitts.voxbank.exception.WordBankStorageException;
import com.phillippitts.voxbank.service.audio.AudioFormat;
import com.phillippitts.voxbank.service.audio.ConcatenatedAudio;
import com.phillippitts.voxbank.service.audio.PcmConcatenator;
import com.phillippitts.voxbank.service.cache.WordBankCache;
import com.phillippitts.voxbank.service.filter.FilterEngine;
import com.phillippitts.voxbank.service.generation.ConcurrentWordGenerator;
import com.phillippitts.voxbank.service.generation.GenerationProgress;
import com.phillippitts.voxbank.service.generation.GenerationProgressListener;
import com.phillippitts.voxbank.service.metrics.VoxMetrics;
import com.phillippitts.voxbank.service.orchestration.event.SynthesisCompletedEvent;
import com.phillippitts.voxbank.service.orchestration.event.SynthesisFailedEvent;
import com.phillippitts.voxbank.service.tokenize.TokenizationResult;
import com.phillippitts.voxbank.service.tokenize.ValidationIssue;
import com.phillippitts.voxbank.service.tokenize.VoxTokenizer;
import com.phillippitts.voxbank.util.LogSanitizer;
import com.phillippitts.voxbank.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Default {@link VoxOrchestrator}: runs the stages of one request sequentially on the
 * calling thread; only word generation fans out to the generation pool.
 *
 * <p><b>Ordering:</b> the final clip order is always the token order. Generation results
 * are keyed by word and re-indexed through the token list ({@link Composition#resolve}),
 * never taken in completion order.
 *
 * <p><b>Error Handling:</b> limits are checked up front and violations thrown as
 * {@link InvalidRequestException}. Per-word failures (invalid word, provider failure,
 * cache-only miss) are collected as skipped words and the pipeline continues. Fatal stage
 * errors (nothing resolvable, malformed clip, filter failure, storage failure,
 * cancellation) end the request with a failed {@link SynthesisResult} naming the stage.
 */
public class DefaultVoxOrchestrator implements VoxOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultVoxOrchestrator.class);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private final VoxTokenizer tokenizer;
    private final WordBankCache cache;
    private final ConcurrentWordGenerator generator;
    private final PcmConcatenator concatenator;
    private final FilterEngine filterEngine;
    private final RequestProperties props;
    private final ApplicationEventPublisher publisher;
    private final VoxMetrics metrics;

    /**
     * @param metrics metrics service (nullable in tests)
     */
    public DefaultVoxOrchestrator(VoxTokenizer tokenizer,
                                  WordBankCache cache,
                                  ConcurrentWordGenerator generator,
                                  PcmConcatenator concatenator,
                                  FilterEngine filterEngine,
                                  RequestProperties props,
                                  ApplicationEventPublisher publisher,
                                  VoxMetrics metrics) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.concatenator = Objects.requireNonNull(concatenator, "concatenator must not be null");
        this.filterEngine = Objects.requireNonNull(filterEngine, "filterEngine must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = metrics;
    }

    @Override
    public SynthesisResult synthesize(SynthesisRequest request, SynthesisProgressListener listener) {
        Objects.requireNonNull(request, "request must not be null");
        long start = System.nanoTime();
        SynthesisProgressListener progress = listener == null ? SynthesisProgressListener.NOOP : listener;
        PipelineTracker tracker = new PipelineTracker(progress);

        tracker.advance(PipelineStage.TOKENIZING);
        TokenizationResult tokenized;
        int gapMs;
        try {
            validateIdentifiers(request.scopeId(), request.voiceId());
            gapMs = resolveWordGap(request.wordGapMs());
            tokenized = tokenize(request);
        } catch (InvalidRequestException e) {
            tracker.fail();
            throw e;
        }

        List<SkippedWord> skipped = new ArrayList<>();
        for (ValidationIssue issue : tokenized.issues()) {
            skipped.add(new SkippedWord(issue.word(), "invalid: " + issue.reason()));
        }
        List<String> matched = List.of();
        try {
            request.cancellation().throwIfCancelled("tokenizing");
            if (tokenized.wordCount() == 0) {
                throw new NoContentException(skippedWordsOf(skipped));
            }

            tracker.advance(PipelineStage.CHECKING_CACHE);
            Map<String, GenerationResult> results = resolveWords(request, tokenized.tokens(), tracker, progress);

            Composition composition = Composition.resolve(tokenized.tokens(), results);
            for (Token token : tokenized.tokens()) {
                GenerationResult r = token.isWord() ? results.get(token.word()) : null;
                if (r != null && !r.isResolved()) {
                    skipped.add(new SkippedWord(token.word(), r.reason()));
                }
            }
            matched = composition.words();
            recordWordMetrics(results, tokenized.issues().size());
            if (composition.wordCount() == 0) {
                throw new NoContentException(skippedWordsOf(skipped));
            }

            tracker.advance(PipelineStage.CONCATENATING);
            ConcatenatedAudio audio = concatenator.concatenate(composition, gapMs, props.getPauseMode(),
                    request.cancellation());

            tracker.advance(PipelineStage.FILTERING);
            request.cancellation().throwIfCancelled("filtering");
            byte[] buffer = filterEngine.apply(audio.pcm(), request.filter());

            tracker.advance(PipelineStage.DONE);
            int[] counts = countResolved(composition, results);
            SynthesisResult result = SynthesisResult.success(buffer, matched, skipped,
                    AudioFormat.durationSeconds(buffer.length), counts[0], counts[1]);
            onCompleted(request, result, start);
            return result;
        } catch (NoContentException e) {
            return failed(request, tracker, FailureReason.NO_CONTENT, e, matched, skipped, start);
        } catch (ConcatenationException e) {
            return failed(request, tracker, FailureReason.CONCATENATION, e, matched, skipped, start);
        } catch (FilterException e) {
            return failed(request, tracker, FailureReason.FILTER, e, matched, skipped, start);
        } catch (WordBankStorageException e) {
            return failed(request, tracker, FailureReason.STORAGE, e, matched, skipped, start);
        } catch (SynthesisCancelledException e) {
            return failed(request, tracker, FailureReason.CANCELLED, e, matched, skipped, start);
        } catch (RuntimeException e) {
            LOG.error("Unexpected pipeline error", e);
            return failed(request, tracker, FailureReason.INTERNAL, e, matched, skipped, start);
        }
    }

    @Override
    public SynthesisPreview preview(String scopeId, String voiceId, String text, Integer wordGapMs) {
        validateIdentifiers(scopeId, voiceId);
        int gapMs = resolveWordGap(wordGapMs);
        TokenizationResult tokenized = tokenize(SynthesisRequest.forText(scopeId, voiceId, text == null ? "" : text));

        List<SynthesisPreview.TokenPreview> previews = new ArrayList<>();
        List<Token> playable = new ArrayList<>();
        List<Integer> sizes = new ArrayList<>();
        int cached = 0;
        int missing = 0;
        for (Token token : tokenized.tokens()) {
            if (token.isPause()) {
                previews.add(new SynthesisPreview.TokenPreview(token, false, token.pauseDurationMs() / 1000.0));
                playable.add(token);
                sizes.add(0);
                continue;
            }
            Optional<ClipMetadata> meta = cache.metadata(CacheKey.of(scopeId, token.word(), voiceId));
            if (meta.isPresent()) {
                cached++;
                previews.add(new SynthesisPreview.TokenPreview(token, true, meta.get().durationSeconds()));
                playable.add(token);
                sizes.add((int) meta.get().sizeBytes());
            } else {
                missing++;
                previews.add(new SynthesisPreview.TokenPreview(token, false, 0.0));
            }
        }
        double estimate = cached == 0 ? 0.0 : AudioFormat.durationSeconds(
                concatenator.plannedLength(playable, sizes::get, gapMs, props.getPauseMode()));

        List<SkippedWord> invalid = tokenized.issues().stream()
                .map(i -> new SkippedWord(i.word(), "invalid: " + i.reason()))
                .toList();
        return new SynthesisPreview(previews, invalid, cached, missing, estimate);
    }

    private Map<String, GenerationResult> resolveWords(SynthesisRequest request, List<Token> tokens,
                                                       PipelineTracker tracker,
                                                       SynthesisProgressListener progress) {
        GenerationProgressListener bridge = new GenerationProgressListener() {
            @Override
            public void onProgress(GenerationProgress p) {
                progress.onGeneration(p);
            }

            @Override
            public void onCacheChecked(int cachedWords, int missingWords) {
                if (missingWords > 0 && !props.isSkipMissingWords()) {
                    tracker.advance(PipelineStage.GENERATING);
                }
            }
        };
        if (props.isSkipMissingWords()) {
            return generator.lookupOnly(tokens, request.voiceId(), request.scopeId(), bridge);
        }
        return generator.generateMissing(tokens, request.voiceId(), request.scopeId(), bridge,
                request.cancellation());
    }

    private TokenizationResult tokenize(SynthesisRequest request) {
        TokenizationResult result;
        if (request.isPreTokenized()) {
            result = tokenizer.normalize(request.composition());
        } else {
            String text = request.text();
            if (text.isBlank()) {
                throw new InvalidRequestException("text", "Message must not be empty");
            }
            if (text.length() > props.getMaxMessageLength()) {
                throw new InvalidRequestException("text", "Message exceeds " + props.getMaxMessageLength()
                        + " characters (got " + text.length() + ")");
            }
            result = tokenizer.tokenize(text);
        }
        int words = result.wordCount() + result.issues().size();
        if (words > props.getMaxWordCount()) {
            throw new InvalidRequestException("text", "Message exceeds " + props.getMaxWordCount()
                    + " words (got " + words + ")");
        }
        return result;
    }

    private int resolveWordGap(Integer requested) {
        if (requested == null) {
            return props.getDefaultWordGapMs();
        }
        if (requested < props.getMinWordGapMs() || requested > props.getMaxWordGapMs()) {
            throw new InvalidRequestException("wordGapMs", "Word gap must be between "
                    + props.getMinWordGapMs() + " and " + props.getMaxWordGapMs() + " ms (got " + requested + ")");
        }
        return requested;
    }

    private static void validateIdentifiers(String scopeId, String voiceId) {
        requireIdentifier(scopeId, "scopeId");
        requireIdentifier(voiceId, "voiceId");
    }

    private static void requireIdentifier(String value, String field) {
        if (value == null || !IDENTIFIER.matcher(value).matches() || value.equals(".") || value.equals("..")) {
            throw new InvalidRequestException(field, field + " must match [A-Za-z0-9._-]{1,64}");
        }
    }

    private static int[] countResolved(Composition composition, Map<String, GenerationResult> results) {
        int cached = 0;
        int generated = 0;
        for (String word : new LinkedHashSet<>(composition.words())) {
            GenerationStatus status = results.get(word).status();
            if (status == GenerationStatus.CACHED) {
                cached++;
            } else if (status == GenerationStatus.GENERATED) {
                generated++;
            }
        }
        return new int[]{cached, generated};
    }

    private void recordWordMetrics(Map<String, GenerationResult> results, int invalid) {
        if (metrics == null) {
            return;
        }
        Map<GenerationStatus, Integer> counts = new EnumMap<>(GenerationStatus.class);
        for (GenerationResult r : results.values()) {
            counts.merge(r.status(), 1, Integer::sum);
        }
        counts.merge(GenerationStatus.SKIPPED, invalid, Integer::sum);
        counts.forEach(metrics::incrementWords);
    }

    private void onCompleted(SynthesisRequest request, SynthesisResult result, long start) {
        long elapsedNanos = System.nanoTime() - start;
        if (metrics != null) {
            metrics.recordSynthesis("success", elapsedNanos);
        }
        LOG.info("VOX_SYNTHESIS_COMPLETED scope={} voice={} input=({}) matched={} skipped={} cached={} "
                        + "generated={} durationSec={} elapsedMs={}",
                request.scopeId(), request.voiceId(), describe(request), result.matchedWords().size(),
                result.skipped().size(), result.cachedCount(), result.generatedCount(),
                String.format("%.3f", result.durationEstimateSeconds()), elapsedNanos / TimeUtils.NANOS_PER_MILLI);
        publisher.publishEvent(new SynthesisCompletedEvent(request.scopeId(), request.voiceId(),
                result.matchedWords().size(), result.skipped().size(), result.durationEstimateSeconds(),
                Instant.now()));
    }

    private SynthesisResult failed(SynthesisRequest request, PipelineTracker tracker, FailureReason reason,
                                   RuntimeException cause, List<String> matched, List<SkippedWord> skipped,
                                   long start) {
        PipelineStage stage = tracker.fail();
        if (metrics != null) {
            metrics.recordSynthesis("failure", System.nanoTime() - start);
            metrics.incrementFailedStage(stage, reason);
        }
        LOG.warn("VOX_SYNTHESIS_FAILED scope={} voice={} stage={} reason={} input=({}) elapsedMs={}: {}",
                request.scopeId(), request.voiceId(), stage, reason, describe(request),
                TimeUtils.elapsedMillis(start), cause.getMessage());
        publisher.publishEvent(new SynthesisFailedEvent(request.scopeId(), request.voiceId(), stage, reason,
                cause.getMessage(), Instant.now()));
        return SynthesisResult.failure(stage, reason, cause.getMessage(), matched, skipped);
    }

    private static String describe(SynthesisRequest request) {
        return request.isPreTokenized()
                ? "tokens=" + request.composition().size()
                : LogSanitizer.describe(request.text());
    }

    private static List<String> skippedWordsOf(List<SkippedWord> skipped) {
        return skipped.stream().map(SkippedWord::word).toList();
    }
}
