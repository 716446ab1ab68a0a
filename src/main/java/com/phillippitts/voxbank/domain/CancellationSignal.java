package com.phillippitts.voxbank.domain;

import com.phillippitts.voxbank.exception.SynthesisCancelledException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a caller and a running request.
 *
 * <p>Callbacks registered with {@link #onCancel(Runnable)} run once, on the thread that
 * calls {@link #cancel()}; a callback registered after cancellation runs immediately.
 * The generator uses this to interrupt in-flight provider calls.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /** Returns a signal that is never cancelled by anyone else. */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable callback : callbacks) {
                callback.run();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a callback fired on cancellation.
     *
     * @param callback action to run once
     * @return a handle that unregisters the callback
     */
    public Runnable onCancel(Runnable callback) {
        AtomicBoolean fired = new AtomicBoolean();
        Runnable once = () -> {
            if (fired.compareAndSet(false, true)) {
                callback.run();
            }
        };
        callbacks.add(once);
        if (cancelled.get()) {
            once.run();
        }
        return () -> callbacks.remove(once);
    }

    /**
     * @throws SynthesisCancelledException if cancellation was requested
     */
    public void throwIfCancelled(String stage) {
        if (cancelled.get()) {
            throw new SynthesisCancelledException("Synthesis cancelled during " + stage);
        }
    }
}
