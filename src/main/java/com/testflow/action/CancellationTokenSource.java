package com.testflow.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Owner side of cooperative cancellation. {@link #cancel()} flips the flag once, wakes
 * any sleeping holder of the token and runs the registered callbacks.
 *
 * A source can be linked to a parent token: cancelling the parent cancels the child,
 * but cancelling the child leaves the parent untouched. Each action execution links
 * its own source to the run's token so that {@code Action.cancel()} stops just that
 * action. Closing a linked source detaches it from the parent.
 *
 * Callbacks may run more than once when registration races a cancel, so they must be
 * idempotent.
 */
public class CancellationTokenSource implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CancellationTokenSource.class);

    private final Object               monitor   = new Object();
    private final List<Runnable>       callbacks = new CopyOnWriteArrayList<>();
    private final CancellationToken    token     = new CancellationToken(this);
    private volatile boolean           cancelled;
    private Runnable                   parentRegistration = () -> { };

    public CancellationTokenSource() {
    }

    /** Creates a source that is cancelled whenever {@code parent} is. */
    public static CancellationTokenSource linkedTo(CancellationToken parent) {
        CancellationTokenSource child = new CancellationTokenSource();
        if (parent != null) {
            child.parentRegistration = parent.register(child::cancel);
        }
        return child;
    }

    public CancellationToken getToken() { return token; }

    public boolean isCancellationRequested() { return cancelled; }

    public void cancel() {
        synchronized (monitor) {
            if (cancelled) return;
            cancelled = true;
            monitor.notifyAll();
        }
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("CancellationTokenSource: cancel callback failed: {}", e.getMessage(), e);
            }
        }
    }

    Runnable register(Runnable callback) {
        if (cancelled) {
            callback.run();
            return () -> { };
        }
        callbacks.add(callback);
        if (cancelled && callbacks.remove(callback)) {
            // cancel() raced with the add and may have missed it
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    void awaitCancellation(long millis) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        synchronized (monitor) {
            while (!cancelled) {
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remaining <= 0) return;
                try {
                    monitor.wait(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ActionCancelledException("Interrupted while sleeping", e);
                }
            }
        }
    }

    @Override
    public void close() {
        parentRegistration.run();
    }
}
