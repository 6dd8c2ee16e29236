package com.testflow.action;

/**
 * Signals a cooperative stop. Raised by {@link CancellationToken#throwIfCancellationRequested()}
 * and by cancellation-aware sleeps once a cancel has been requested.
 *
 * This is not a failure: an action that sees it moves to PAUSED, and the flow
 * executor turns it into a resumable pause.
 */
public class ActionCancelledException extends RuntimeException {

    public ActionCancelledException(String message) {
        super(message);
    }

    public ActionCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
