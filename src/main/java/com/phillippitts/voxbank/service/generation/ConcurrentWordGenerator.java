package com.phillippitts.voxbank.service.generation;

import com.phillippitts.voxbank.config.properties.GenerationProperties;
import com.phillippitts.voxbank.domain.CacheKey;
import com.phillippitts.voxbank.domain.CancellationSignal;
import com.phillippitts.voxbank.domain.GenerationResult;
import com.phillippitts.voxbank.domain.GenerationStatus;
import com.phillippitts.voxbank.domain.Token;
import com.phillippitts.voxbank.domain.WordClip;
import com.phillippitts.voxbank.exception.SynthesisCancelledException;
import com.phillippitts.voxbank.exception.SynthesisProviderException;
import com.phillippitts.voxbank.exception.WordBankStorageException;
import com.phillippitts.voxbank.service.cache.WordBankCache;
import com.phillippitts.voxbank.service.generation.event.ProviderFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves every word of a request to a clip, synthesizing cache misses in parallel.
 *
 * <p>Words are deduplicated, looked up in the word bank, and the misses are submitted to
 * the generation executor. Provider calls are bounded by the shared
 * {@link ConcurrencyGuard}. Each word is independent: a failure is recorded as
 * {@link GenerationStatus#FAILED} and never aborts siblings. A clip is written to the
 * word bank before it is reported as generated.
 *
 * <p>Every worker re-checks the word bank right before calling the provider, so a word
 * generated by a concurrent request in the meantime is served from the cache.
 *
 * <p>{@code call-timeout-ms} bounds each provider call from the moment it holds a permit.
 * Time spent queued on the executor or on the guard is not counted; the guard's own
 * acquire timeout bounds that wait.
 *
 * <p>Cancellation cancels (and interrupts) all pending workers and surfaces as
 * {@link SynthesisCancelledException}; clips already written stay in the word bank.
 */
public class ConcurrentWordGenerator {

    private static final Logger LOG = LogManager.getLogger(ConcurrentWordGenerator.class);
    private static final long START_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final WordBankCache cache;
    private final SynthesisProvider provider;
    private final ClipAudioValidator validator;
    private final ConcurrencyGuard guard;
    private final AsyncTaskExecutor executor;
    private final GenerationProperties properties;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public ConcurrentWordGenerator(WordBankCache cache,
                                   SynthesisProvider provider,
                                   ClipAudioValidator validator,
                                   ConcurrencyGuard guard,
                                   AsyncTaskExecutor executor,
                                   GenerationProperties properties,
                                   ApplicationEventPublisher publisher,
                                   Clock clock) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.guard = Objects.requireNonNull(guard, "guard must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.publisher = publisher;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Looks up the cache only; misses are reported as {@link GenerationStatus#SKIPPED}.
     * Used when the deployment plays cached words only.
     */
    public Map<String, GenerationResult> lookupOnly(List<Token> tokens, String voiceId, String scopeId,
                                                    GenerationProgressListener listener) {
        Set<String> words = distinctWords(tokens);
        Progress progress = new Progress(words.size(), listener);
        Map<String, GenerationResult> results = new LinkedHashMap<>();
        int cached = 0;
        for (String word : words) {
            GenerationResult result = cache.get(CacheKey.of(scopeId, word, voiceId))
                    .map(GenerationResult::cached)
                    .orElseGet(() -> GenerationResult.skipped(word, "not in word bank"));
            results.put(word, result);
            if (result.isResolved()) {
                cached++;
            }
            progress.record(word, result.status());
        }
        progress.listener.onCacheChecked(cached, words.size() - cached);
        return Collections.unmodifiableMap(results);
    }

    /**
     * Resolves every distinct word of {@code tokens}, generating cache misses.
     *
     * @param tokens tokens of one request (pauses are ignored)
     * @param voiceId provider voice
     * @param scopeId word bank scope
     * @param listener progress channel, may be {@link GenerationProgressListener#NOOP}
     * @param cancellation cancellation signal of the request
     * @return one result per distinct word, in first-occurrence order
     * @throws SynthesisCancelledException if the request is cancelled before all words resolve
     */
    public Map<String, GenerationResult> generateMissing(List<Token> tokens, String voiceId, String scopeId,
                                                         GenerationProgressListener listener,
                                                         CancellationSignal cancellation) {
        Set<String> words = distinctWords(tokens);
        Progress progress = new Progress(words.size(), listener);
        Map<String, GenerationResult> results = new LinkedHashMap<>();
        Map<String, CacheKey> missing = new LinkedHashMap<>();

        for (String word : words) {
            CacheKey key = CacheKey.of(scopeId, word, voiceId);
            Optional<WordClip> hit = cache.get(key);
            if (hit.isPresent()) {
                results.put(word, GenerationResult.cached(hit.get()));
                progress.record(word, GenerationStatus.CACHED);
            } else {
                results.put(word, null);
                missing.put(word, key);
            }
        }
        progress.listener.onCacheChecked(words.size() - missing.size(), missing.size());
        if (missing.isEmpty()) {
            return Collections.unmodifiableMap(results);
        }
        cancellation.throwIfCancelled("generating");
        LOG.debug("Generating {} of {} word(s) for voice {}", missing.size(), words.size(), voiceId);

        Map<String, Future<GenerationResult>> futures = new LinkedHashMap<>();
        Map<String, Long> callStarts = new ConcurrentHashMap<>();
        for (Map.Entry<String, CacheKey> e : missing.entrySet()) {
            try {
                futures.put(e.getKey(), executor.submit(
                        () -> generateOne(e.getValue(), cancellation, progress, callStarts)));
            } catch (TaskRejectedException ex) {
                LOG.warn("Generation pool saturated, failing remaining word");
                results.put(e.getKey(), GenerationResult.failed(e.getKey(), "generation pool saturated"));
                progress.record(e.getKey(), GenerationStatus.FAILED);
            }
        }

        Runnable unregister = cancellation.onCancel(() -> cancelAll(futures));
        try {
            collect(futures, callStarts, results, progress, cancellation);
        } finally {
            unregister.run();
        }
        return Collections.unmodifiableMap(results);
    }

    private void collect(Map<String, Future<GenerationResult>> futures, Map<String, Long> callStarts,
                         Map<String, GenerationResult> results, Progress progress, CancellationSignal cancellation) {
        for (Map.Entry<String, Future<GenerationResult>> e : futures.entrySet()) {
            String word = e.getKey();
            Future<GenerationResult> future = e.getValue();
            try {
                results.put(word, awaitCall(word, future, callStarts));
            } catch (TimeoutException ex) {
                future.cancel(true);
                results.put(word, GenerationResult.failed(word, "timed out after "
                        + properties.getCallTimeoutMs() + "ms"));
                progress.record(word, GenerationStatus.FAILED);
            } catch (CancellationException ex) {
                cancellation.throwIfCancelled("generating");
                results.put(word, GenerationResult.failed(word, "generation cancelled"));
                progress.record(word, GenerationStatus.FAILED);
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                if (cause instanceof SynthesisCancelledException sce) {
                    cancelAll(futures);
                    throw sce;
                }
                LOG.warn("Generation worker failed unexpectedly: {}", cause.toString());
                results.put(word, GenerationResult.failed(word, "unexpected error: " + cause.getMessage()));
                progress.record(word, GenerationStatus.FAILED);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                cancelAll(futures);
                throw new SynthesisCancelledException("Interrupted while waiting for generation");
            }
        }
        cancellation.throwIfCancelled("generating");
    }

    /**
     * Waits for one word. The timeout only runs while the word's provider call holds a
     * permit; before that (and between retry attempts) the future is polled.
     */
    private GenerationResult awaitCall(String word, Future<GenerationResult> future, Map<String, Long> callStarts)
            throws InterruptedException, ExecutionException, TimeoutException {
        long callTimeout = TimeUnit.MILLISECONDS.toNanos(properties.getCallTimeoutMs());
        while (true) {
            Long started = callStarts.get(word);
            long wait = started == null
                    ? START_POLL_NANOS
                    : Math.max(0L, started + callTimeout - System.nanoTime());
            try {
                return future.get(wait, TimeUnit.NANOSECONDS);
            } catch (TimeoutException ex) {
                if (started != null && started.equals(callStarts.get(word))) {
                    throw ex;
                }
            }
        }
    }

    private GenerationResult generateOne(CacheKey key, CancellationSignal cancellation, Progress progress,
                                         Map<String, Long> callStarts) {
        cancellation.throwIfCancelled("generating");
        Optional<WordClip> raced = cache.get(key);
        if (raced.isPresent()) {
            progress.record(key.word(), GenerationStatus.CACHED);
            return GenerationResult.cached(raced.get());
        }

        String word = key.word();
        SynthesisProviderException last = null;
        for (int attempt = 1; attempt <= properties.getMaxAttempts(); attempt++) {
            cancellation.throwIfCancelled("generating");
            try {
                byte[] pcm = synthesize(word, key.voiceId(), callStarts);
                WordClip clip = WordClip.of(key, pcm, Instant.now(clock));
                cache.put(clip);
                progress.record(word, GenerationStatus.GENERATED);
                return GenerationResult.generated(clip);
            } catch (SynthesisProviderException e) {
                last = e;
                publishFailure(key.voiceId(), e, attempt);
                if (!e.isRetryable() || attempt == properties.getMaxAttempts()) {
                    break;
                }
                backoff();
            } catch (WordBankStorageException e) {
                LOG.error("Generated clip could not be stored: {}", e.getMessage());
                progress.record(word, GenerationStatus.FAILED);
                return GenerationResult.failed(word, "word bank write failed");
            }
        }
        progress.record(word, GenerationStatus.FAILED);
        return GenerationResult.failed(word, last == null ? "synthesis failed" : last.getMessage());
    }

    private byte[] synthesize(String word, String voiceId, Map<String, Long> callStarts) {
        guard.acquire(voiceId);
        callStarts.put(word, System.nanoTime());
        try {
            return validator.toPcm(provider.synthesizeWord(word, voiceId), word, voiceId);
        } finally {
            callStarts.remove(word);
            guard.release();
        }
    }

    private void backoff() {
        if (properties.getRetryBackoffMs() <= 0) {
            return;
        }
        try {
            Thread.sleep(properties.getRetryBackoffMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SynthesisCancelledException("Interrupted during retry backoff");
        }
    }

    private void publishFailure(String voiceId, SynthesisProviderException e, int attempt) {
        LOG.warn("Provider {} failed (attempt {}/{}, retryable={}): {}", provider.name(), attempt,
                properties.getMaxAttempts(), e.isRetryable(), e.getMessage());
        if (publisher != null) {
            publisher.publishEvent(new ProviderFailureEvent(
                    provider.name(),
                    voiceId,
                    Instant.now(clock),
                    e.getMessage(),
                    e,
                    Map.of("reason", e.isRetryable() ? "transient" : "permanent",
                            "attempt", String.valueOf(attempt),
                            "retryable", String.valueOf(e.isRetryable()))
            ));
        }
    }

    private static void cancelAll(Map<String, Future<GenerationResult>> futures) {
        for (Future<GenerationResult> f : futures.values()) {
            f.cancel(true);
        }
    }

    private static Set<String> distinctWords(List<Token> tokens) {
        Set<String> words = new LinkedHashSet<>();
        for (Token token : tokens) {
            if (token.isWord()) {
                words.add(token.word());
            }
        }
        return words;
    }

    /**
     * Thread-safe counters; listener calls are serialized under the same lock. Each word
     * is counted once, so a worker finishing after its timeout was recorded is ignored.
     */
    private static final class Progress {
        private final int total;
        private final GenerationProgressListener listener;
        private int cached;
        private int generated;
        private int failed;
        private final Set<String> recorded = new HashSet<>();

        Progress(int total, GenerationProgressListener listener) {
            this.total = total;
            this.listener = listener == null ? GenerationProgressListener.NOOP : listener;
        }

        synchronized void record(String word, GenerationStatus status) {
            if (!recorded.add(word)) {
                return;
            }
            switch (status) {
                case CACHED -> cached++;
                case GENERATED -> generated++;
                case FAILED, SKIPPED -> failed++;
            }
            listener.onProgress(new GenerationProgress(total, cached, generated, failed));
        }
    }
}
