package org.pragmatica.triple.common;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-way cancellation signal shared by a call context and the contexts derived from it.
 */
public final class Cancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    private Cancellation() {}

    public static Cancellation cancellation() {
        return new Cancellation();
    }

    /**
     * Signal cancellation. Listeners run once, on the calling thread.
     *
     * @return true if this call flipped the signal
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (var listener : listeners) {
            listener.run();
        }
        listeners.clear();
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Register a listener. If already cancelled, the listener runs immediately.
     *
     * @return registration which removes the listener when closed
     */
    public Registration onCancel(Runnable listener) {
        listeners.add(listener);

        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    /**
     * Handle for removing a cancellation listener.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
