package com.testflow.action;

/**
 * Read side of a {@link CancellationTokenSource}, passed down the call graph so every
 * action can observe a stop request at its own checkpoints.
 *
 * {@link #NONE} is never cancelled and is what callers pass when a run cannot be stopped.
 */
public final class CancellationToken {

    public static final CancellationToken NONE = new CancellationToken(null);

    private final CancellationTokenSource source;

    CancellationToken(CancellationTokenSource source) {
        this.source = source;
    }

    public boolean isCancellationRequested() {
        return source != null && source.isCancellationRequested();
    }

    /** @throws ActionCancelledException when a cancel has been requested */
    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new ActionCancelledException("Cancellation requested");
        }
    }

    /**
     * Sleeps for up to {@code millis}, waking early when a cancel is requested.
     *
     * @throws ActionCancelledException if a cancel is requested before or during the sleep,
     *                                  or the thread is interrupted
     */
    public void sleep(long millis) {
        throwIfCancellationRequested();
        if (millis <= 0) return;
        if (source == null) {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ActionCancelledException("Interrupted while sleeping", e);
            }
            return;
        }
        source.awaitCancellation(millis);
        throwIfCancellationRequested();
    }

    /**
     * Runs {@code callback} when a cancel is requested, or immediately if one already was.
     *
     * @return a handle that removes the callback again; never null
     */
    public Runnable register(Runnable callback) {
        if (source == null) return () -> { };
        return source.register(callback);
    }
}
