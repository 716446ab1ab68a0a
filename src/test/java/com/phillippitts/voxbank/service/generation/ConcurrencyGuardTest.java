package com.phillippitts.voxbank.service.generation;

import com.phillippitts.voxbank.exception.SynthesisCancelledException;
import com.phillippitts.voxbank.exception.SynthesisProviderException;
import com.phillippitts.voxbank.service.generation.event.ProviderFailureEvent;
import com.phillippitts.voxbank.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcurrencyGuardTest {

    @Test
    void rejectsNonPositivePermits() {
        assertThatThrownBy(() -> new ConcurrencyGuard(0, 100, "fake", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acquireAndReleaseTrackPermits() {
        ConcurrencyGuard guard = new ConcurrencyGuard(2, 100, "fake", null);

        guard.acquire("amy");
        assertThat(guard.availablePermits()).isEqualTo(1);
        guard.release();

        assertThat(guard.availablePermits()).isEqualTo(2);
        assertThat(guard.maxPermits()).isEqualTo(2);
    }

    @Test
    void timesOutWithRetryableFalseAndPublishesEvent() {
        EventCapturingPublisher publisher = new EventCapturingPublisher();
        ConcurrencyGuard guard = new ConcurrencyGuard(1, 50, "fake", publisher);
        guard.acquire("amy");

        assertThatThrownBy(() -> guard.acquire("amy"))
                .isInstanceOf(SynthesisProviderException.class)
                .hasMessageContaining("concurrency limit reached");

        ProviderFailureEvent event = publisher.first(ProviderFailureEvent.class);
        assertThat(event).isNotNull();
        assertThat(event.provider()).isEqualTo("fake");
        assertThat(event.voiceId()).isEqualTo("amy");
        assertThat(event.context()).containsEntry("reason", "concurrency-limit");
    }

    @Test
    void interruptWhileWaitingIsReportedAsCancellation() throws Exception {
        ConcurrencyGuard guard = new ConcurrencyGuard(1, 10_000, "fake", null);
        guard.acquire("amy");
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        AtomicReference<Boolean> interruptFlag = new AtomicReference<>();

        Thread waiter = new Thread(() -> {
            try {
                guard.acquire("amy");
            } catch (RuntimeException e) {
                thrown.set(e);
                interruptFlag.set(Thread.currentThread().isInterrupted());
            }
        });
        waiter.start();
        Thread.sleep(100);
        waiter.interrupt();
        waiter.join(5_000);

        assertThat(thrown.get()).isInstanceOf(SynthesisCancelledException.class);
        assertThat(interruptFlag.get()).isTrue();
    }
}
