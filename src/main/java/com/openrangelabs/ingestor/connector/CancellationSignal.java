package com.openrangelabs.ingestor.connector;

import com.openrangelabs.ingestor.exception.OperationCancelledException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag passed into long-running connector operations.
 *
 * <p>A signal may be linked to a parent and may carry a deadline; it reports itself
 * cancelled as soon as it, any ancestor, or its deadline fires. {@link #reason()} tells
 * an explicit cancel apart from a timeout.
 */
public class CancellationSignal {

    public enum Reason {
        NONE, CANCELLED, TIMEOUT
    }

    private final CancellationSignal parent;
    private final long deadlineNanos;
    private final boolean hasDeadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private CancellationSignal(CancellationSignal parent, Duration timeout) {
        this.parent = parent;
        this.hasDeadline = timeout != null;
        this.deadlineNanos = timeout != null ? System.nanoTime() + timeout.toNanos() : 0L;
    }

    public static CancellationSignal create() {
        return new CancellationSignal(null, null);
    }

    /**
     * A fresh signal nobody else holds, so it only fires on its own deadline if one is added.
     */
    public static CancellationSignal none() {
        return create();
    }

    public static CancellationSignal withTimeout(CancellationSignal parent, Duration timeout) {
        return new CancellationSignal(parent, timeout);
    }

    /**
     * Child signal that fires when this one fires or when {@code timeout} elapses.
     */
    public CancellationSignal withTimeout(Duration timeout) {
        return new CancellationSignal(this, timeout);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return reason() != Reason.NONE;
    }

    public Reason reason() {
        if (cancelled.get()) {
            return Reason.CANCELLED;
        }
        if (parent != null) {
            Reason parentReason = parent.reason();
            if (parentReason != Reason.NONE) {
                return parentReason;
            }
        }
        if (hasDeadline && System.nanoTime() - deadlineNanos >= 0) {
            return Reason.TIMEOUT;
        }
        return Reason.NONE;
    }

    public void throwIfCancellationRequested(long processedCount) {
        Reason current = reason();
        if (current != Reason.NONE) {
            throw new OperationCancelledException(current, processedCount);
        }
    }
}
