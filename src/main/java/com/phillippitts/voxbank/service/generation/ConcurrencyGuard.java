package com.phillippitts.voxbank.service.generation;

import com.phillippitts.voxbank.exception.SynthesisCancelledException;
import com.phillippitts.voxbank.exception.SynthesisExceptionBuilder;
import com.phillippitts.voxbank.exception.SynthesisProviderException;
import com.phillippitts.voxbank.service.generation.event.ProviderFailureEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds the number of in-flight provider calls across all requests with a semaphore.
 *
 * <p>One guard is shared by every request in the process, so its permit count is the
 * single serialization point for provider load. Waiting is bounded; when no permit frees
 * up in time the word fails and a {@link ProviderFailureEvent} is published.
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. The underlying {@link Semaphore}
 * handles concurrent acquire/release operations safely.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * guard.acquire(voiceId); // Blocks until permit available or timeout
 * try {
 *     provider.synthesizeWord(word, voiceId);
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 */
public final class ConcurrencyGuard {

    private final Semaphore semaphore;
    private final int permits;
    private final long timeoutMs;
    private final String providerName;
    private final ApplicationEventPublisher publisher;

    /**
     * @param permits maximum concurrent provider calls
     * @param timeoutMs maximum time to wait for a permit in milliseconds
     * @param providerName provider name for error messages and events
     * @param publisher event publisher for failure notifications (nullable)
     */
    public ConcurrencyGuard(int permits, long timeoutMs, String providerName, ApplicationEventPublisher publisher) {
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be positive, got: " + permits);
        }
        this.semaphore = new Semaphore(permits, true);
        this.permits = permits;
        this.timeoutMs = timeoutMs;
        this.providerName = providerName;
        this.publisher = publisher;
    }

    /**
     * Acquires a permit, blocking up to the configured timeout.
     *
     * @param voiceId voice of the pending call, for diagnostics
     * @throws SynthesisProviderException if no permit becomes available within the timeout
     * @throws SynthesisCancelledException if the thread is interrupted while waiting
     */
    public void acquire(String voiceId) {
        try {
            boolean acquired = semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                publishConcurrencyLimitEvent(voiceId);
                throw SynthesisExceptionBuilder.create(providerName + " concurrency limit reached")
                        .voice(voiceId)
                        .durationMs(timeoutMs)
                        .build();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SynthesisCancelledException("Interrupted while waiting for a " + providerName + " permit");
        }
    }

    /**
     * Releases a previously acquired permit. Call from a finally block.
     */
    public void release() {
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    public int maxPermits() {
        return permits;
    }

    private void publishConcurrencyLimitEvent(String voiceId) {
        if (publisher != null) {
            Map<String, String> context = new HashMap<>();
            context.put("reason", "concurrency-limit");
            context.put("timeoutMs", String.valueOf(timeoutMs));

            publisher.publishEvent(new ProviderFailureEvent(
                    providerName,
                    voiceId,
                    Instant.now(),
                    "concurrency limit reached after " + timeoutMs + "ms wait",
                    null,
                    context
            ));
        }
    }
}
