package com.testflow.model;

/**
 * Execution state shared by every action and by the flow itself.
 *
 *   READY      not yet started in the current run, or explicitly reset
 *   RUNNING    currently executing
 *   PAUSED     stopped at a cooperative-cancellation boundary; resumable
 *   COMPLETED  finished successfully
 *   FAILED     finished with a logical failure or an unhandled fault
 *
 * Allowed transitions:
 * <pre>
 *   READY   → RUNNING
 *   RUNNING → COMPLETED | FAILED | PAUSED
 *   PAUSED  → RUNNING
 *   any     → READY      (explicit reset)
 * </pre>
 */
public enum ActionState {
    READY,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED;

    /** True for the states a single run ends in. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(ActionState next) {
        if (next == READY) return true;
        return switch (this) {
            case READY, PAUSED -> next == RUNNING;
            case RUNNING       -> next == COMPLETED || next == FAILED || next == PAUSED;
            case COMPLETED, FAILED -> false;
        };
    }
}
