package org.pragmatica.triple.transport;

import org.pragmatica.triple.codec.Frame;
import org.pragmatica.triple.common.CallContext;
import org.pragmatica.triple.common.TripleError;

import java.time.Duration;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Ordered inbound queue of one stream.
 * <p>
 * The producer is the connection event loop, consumers are caller threads blocked in
 * {@link #receive(CallContext)}. The queue is bounded by signalling pressure: once {@code capacity}
 * messages are pending the pressure listener is told to stop reading, and told to resume when the
 * backlog drops to half of it.
 * <p>
 * Two ways to close: {@link #complete(TripleError)} appends the close marker after pending messages,
 * {@link #abort(TripleError)} drops pending messages and closes at once. After a consumer has seen the
 * close marker every later receive returns it without blocking.
 */
public final class ReceiveQueue {
    public static final int DEFAULT_CAPACITY = 128;

    private static final Object WAKE_UP = new Object();

    private final LinkedBlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final AtomicReference<Inbound.Closed> terminal = new AtomicReference<>();
    private final AtomicInteger pending = new AtomicInteger();
    private final int capacity;

    private volatile Inbound.Closed observedClose;
    private volatile Consumer<Boolean> pressureListener = saturated -> {};
    private volatile boolean saturated;

    public ReceiveQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public static ReceiveQueue receiveQueue() {
        return new ReceiveQueue(DEFAULT_CAPACITY);
    }

    /**
     * Listener called with {@code true} when the queue is saturated and {@code false} when it drained.
     */
    public void onPressure(Consumer<Boolean> listener) {
        this.pressureListener = listener;
    }

    /**
     * Append a message. Ignored once the queue is closed.
     *
     * @return false if the queue was already closed
     */
    public boolean offer(Frame frame) {
        if (terminal.get() != null) {
            return false;
        }

        queue.offer(new Inbound.Message(frame));

        if (pending.incrementAndGet() >= capacity && !saturated) {
            saturated = true;
            pressureListener.accept(true);
        }
        return true;
    }

    /**
     * Close after the messages already queued.
     *
     * @return false if the queue was already closed
     */
    public boolean complete(TripleError reason) {
        var closed = new Inbound.Closed(reason);

        if (!terminal.compareAndSet(null, closed)) {
            return false;
        }
        queue.offer(closed);
        return true;
    }

    /**
     * Drop queued messages and close, waking up blocked consumers.
     *
     * @return false if the queue was already closed
     */
    public boolean abort(TripleError reason) {
        var closed = new Inbound.Closed(reason);

        if (!terminal.compareAndSet(null, closed)) {
            return false;
        }
        observedClose = closed;
        queue.clear();
        pending.set(0);
        queue.offer(closed);
        return true;
    }

    public boolean isClosed() {
        return terminal.get() != null;
    }

    /**
     * Number of messages waiting to be received.
     */
    public int pending() {
        return pending.get();
    }

    /**
     * Wait for the next message, the close marker, or until the context deadline passes or it is cancelled.
     */
    public Inbound receive(CallContext context) {
        var closed = observedClose;

        if (closed != null) {
            return closed;
        }

        var started = System.nanoTime();

        try (var registration = context.cancellation().onCancel(() -> queue.offer(WAKE_UP))) {
            while (true) {
                closed = observedClose;

                if (closed != null) {
                    return closed;
                }
                if (context.isCancelled()) {
                    return new Inbound.Aborted(new TripleError.Cancelled());
                }

                var remaining = context.remainingNanos();

                if (remaining <= 0) {
                    return new Inbound.Aborted(new TripleError.DeadlineExceeded(Duration.ofNanos(System.nanoTime() - started)));
                }

                var next = queue.poll(remaining, TimeUnit.NANOSECONDS);

                if (next == null || next == WAKE_UP) {
                    continue;
                }
                if (next instanceof Inbound.Closed closedMarker) {
                    observedClose = closedMarker;
                    queue.offer(closedMarker);
                    return closedMarker;
                }

                released();
                return (Inbound.Message) next;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Inbound.Aborted(new TripleError.Interrupted());
        }
    }

    private void released() {
        if (pending.decrementAndGet() <= capacity / 2 && saturated) {
            saturated = false;
            pressureListener.accept(false);
        }
    }
}
