package org.pragmatica.triple.common;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Explicit per-call metadata passed alongside every call.
 * <p>
 * Carries the interface key used to build the call path, the request id propagated in the
 * {@code tri-req-id} header, an optional deadline and a cancellation signal. Contexts are
 * immutable; the {@code with*} methods derive new contexts which share the cancellation signal
 * of their parent.
 *
 * <pre>{@code
 * var context = CallContext.callContext("com.example.IGreeter")
 *                          .withTimeout(Duration.ofSeconds(2));
 * var result = client.invoke("SayHello", context, request);
 * }</pre>
 */
public final class CallContext {
    /**
     * Longest timeout that still produces a deadline. Longer timeouts leave the context without one.
     */
    public static final Duration MAX_TIMEOUT = Duration.ofNanos(Long.MAX_VALUE / 2);

    private final String interfaceKey;
    private final String requestId;
    private final long deadlineNanos;
    private final boolean hasDeadline;
    private final Cancellation cancellation;

    private CallContext(String interfaceKey,
                        String requestId,
                        long deadlineNanos,
                        boolean hasDeadline,
                        Cancellation cancellation) {
        this.interfaceKey = interfaceKey;
        this.requestId = requestId;
        this.deadlineNanos = deadlineNanos;
        this.hasDeadline = hasDeadline;
        this.cancellation = cancellation;
    }

    /**
     * Context without interface key and deadline.
     */
    public static CallContext background() {
        return new CallContext(null, generateRequestId(), 0L, false, Cancellation.cancellation());
    }

    /**
     * Context bound to the given interface key.
     */
    public static CallContext callContext(String interfaceKey) {
        return background().withInterfaceKey(interfaceKey);
    }

    public static String generateRequestId() {
        return UUID.randomUUID().toString();
    }

    public Optional<String> interfaceKey() {
        return Optional.ofNullable(interfaceKey);
    }

    public String requestId() {
        return requestId;
    }

    public Cancellation cancellation() {
        return cancellation;
    }

    public CallContext withInterfaceKey(String interfaceKey) {
        return new CallContext(interfaceKey, requestId, deadlineNanos, hasDeadline, cancellation);
    }

    public CallContext withRequestId(String requestId) {
        return new CallContext(interfaceKey, requestId, deadlineNanos, hasDeadline, cancellation);
    }

    /**
     * Derive a context whose deadline is {@code timeout} from now, or the current deadline if that is earlier.
     */
    public CallContext withTimeout(Duration timeout) {
        // Beyond this bound a deadline cannot be told apart from none.
        if (timeout.compareTo(MAX_TIMEOUT) >= 0) {
            return this;
        }
        var nanos = timeout.compareTo(MAX_TIMEOUT.negated()) <= 0
                    ? -MAX_TIMEOUT.toNanos()
                    : timeout.toNanos();
        var candidate = System.nanoTime() + nanos;

        if (hasDeadline && deadlineNanos - candidate <= 0) {
            return this;
        }
        return new CallContext(interfaceKey, requestId, candidate, true, cancellation);
    }

    /**
     * Derive a context with the given absolute deadline, or the current deadline if that is earlier.
     */
    public CallContext withDeadline(Instant deadline) {
        return withTimeout(Duration.between(Instant.now(), deadline));
    }

    public boolean hasDeadline() {
        return hasDeadline;
    }

    /**
     * Nanoseconds left until the deadline; {@link Long#MAX_VALUE} when there is no deadline.
     */
    public long remainingNanos() {
        if (!hasDeadline) {
            return Long.MAX_VALUE;
        }
        return deadlineNanos - System.nanoTime();
    }

    public Duration remaining() {
        return Duration.ofNanos(Math.max(remainingNanos(), 0L));
    }

    public boolean isExpired() {
        return hasDeadline && remainingNanos() <= 0;
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public boolean cancel() {
        return cancellation.cancel();
    }

    @Override
    public String toString() {
        return "CallContext{interfaceKey=" + interfaceKey + ", requestId=" + requestId
               + (hasDeadline ? ", remaining=" + remaining().toMillis() + "ms" : "") + "}";
    }
}
