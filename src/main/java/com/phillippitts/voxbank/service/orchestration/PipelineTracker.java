package com.phillippitts.voxbank.service.orchestration;

import com.phillippitts.voxbank.domain.PipelineStage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe stage machine of one synthesis request.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * TOKENIZING → CHECKING_CACHE → GENERATING → CONCATENATING → FILTERING → DONE
 * any non-terminal stage → FAILED
 * </pre>
 * Stages only move forward; a stage may be skipped (a request without misses goes from
 * CHECKING_CACHE straight to CONCATENATING). Every accepted transition is pushed to the
 * {@link SynthesisProgressListener}.
 *
 * <p><b>Thread Safety:</b> All public methods use a {@link ReentrantLock}; generation
 * callbacks on worker threads may advance the stage concurrently with the request thread.
 */
public final class PipelineTracker {

    private final Lock lock = new ReentrantLock();
    private final SynthesisProgressListener listener;
    private final List<PipelineStage> history = new ArrayList<>();
    private PipelineStage current;
    private PipelineStage failedAt;

    public PipelineTracker(SynthesisProgressListener listener) {
        this.listener = listener == null ? SynthesisProgressListener.NOOP : listener;
    }

    /**
     * Moves to {@code next} if it lies ahead of the current stage.
     *
     * @param next target stage, not {@link PipelineStage#FAILED} (use {@link #fail()})
     * @return {@code true} if the stage changed, {@code false} if already at or past it
     * @throws IllegalStateException if the pipeline already finished
     */
    public boolean advance(PipelineStage next) {
        Objects.requireNonNull(next, "next must not be null");
        if (next == PipelineStage.FAILED) {
            throw new IllegalArgumentException("Use fail() to enter FAILED");
        }
        lock.lock();
        try {
            if (current != null && current.isTerminal()) {
                throw new IllegalStateException("Pipeline already " + current + ", cannot move to " + next);
            }
            if (current != null && next.ordinal() <= current.ordinal()) {
                return false;
            }
            if (next == PipelineStage.DONE && current != PipelineStage.FILTERING) {
                throw new IllegalStateException("DONE is only reachable from FILTERING, current: " + current);
            }
            current = next;
            history.add(next);
            listener.onStage(next);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enters {@link PipelineStage#FAILED}, remembering the stage that failed.
     *
     * @return the stage that was active when the failure happened
     */
    public PipelineStage fail() {
        lock.lock();
        try {
            if (current == PipelineStage.FAILED) {
                return failedAt;
            }
            if (current == PipelineStage.DONE) {
                throw new IllegalStateException("Pipeline already DONE");
            }
            failedAt = current == null ? PipelineStage.TOKENIZING : current;
            current = PipelineStage.FAILED;
            history.add(PipelineStage.FAILED);
            listener.onStage(PipelineStage.FAILED);
            return failedAt;
        } finally {
            lock.unlock();
        }
    }

    public PipelineStage current() {
        lock.lock();
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stages entered so far, in order.
     */
    public List<PipelineStage> history() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }
}
