package com.testflow.flow;

import com.testflow.action.Action;

/**
 * How a flow run ended. PAUSED counts as success: the run stopped on request and can
 * be resumed from {@link Flow#getCurrentAction()}.
 */
public final class FlowRunResult {

    public enum Outcome {
        COMPLETED,
        PAUSED,
        FAILED
    }

    private final Outcome   outcome;
    private final Action    failedAction;  // set only for FAILED
    private final Throwable error;         // set only for FAILED runs caused by an exception
    private final String    message;

    private FlowRunResult(Outcome outcome, Action failedAction, Throwable error, String message) {
        this.outcome      = outcome;
        this.failedAction = failedAction;
        this.error        = error;
        this.message      = message;
    }

    public static FlowRunResult completed(String message) {
        return new FlowRunResult(Outcome.COMPLETED, null, null, message);
    }

    public static FlowRunResult paused(String message) {
        return new FlowRunResult(Outcome.PAUSED, null, null, message);
    }

    public static FlowRunResult failed(Action action, String message, Throwable error) {
        return new FlowRunResult(Outcome.FAILED, action, error, message);
    }

    public Outcome   getOutcome()      { return outcome; }
    public Action    getFailedAction() { return failedAction; }
    public Throwable getError()        { return error; }
    public String    getMessage()      { return message; }

    public boolean isCompleted() { return outcome == Outcome.COMPLETED; }
    public boolean isPaused()    { return outcome == Outcome.PAUSED; }
    public boolean isFailed()    { return outcome == Outcome.FAILED; }

    /** True for COMPLETED and PAUSED. */
    public boolean isSuccess()   { return outcome != Outcome.FAILED; }

    @Override
    public String toString() {
        return String.format("FlowRunResult{outcome=%s, message='%s'}", outcome, message);
    }
}
