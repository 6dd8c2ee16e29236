package com.testflow.action;

/**
 * The result of one {@link Action#execute} call.
 *
 * <p>Immutable; use the static factories. A false result from an action body is turned
 * into either {@link #failed} or {@link #cancelled} by {@link AbstractAction}, depending on
 * whether a cancel was requested, so callers never have to repeat that check.
 */
public class ActionResult {

    private final ActionOutcome outcome;
    private final String        message;
    private final Throwable     error;   // set only for FAILED results caused by an exception

    private ActionResult(ActionOutcome outcome, String message, Throwable error) {
        this.outcome = outcome;
        this.message = message;
        this.error   = error;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static ActionResult executed(String message) {
        return new ActionResult(ActionOutcome.EXECUTED, message, null);
    }

    public static ActionResult skipped(String reason) {
        return new ActionResult(ActionOutcome.SKIPPED, reason, null);
    }

    public static ActionResult failed(String message, Throwable cause) {
        return new ActionResult(ActionOutcome.FAILED, message, cause);
    }

    public static ActionResult cancelled(String message) {
        return new ActionResult(ActionOutcome.CANCELLED, message, null);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public ActionOutcome getOutcome() { return outcome; }
    public String        getMessage() { return message; }
    public Throwable     getError()   { return error; }

    public boolean isExecuted()  { return outcome == ActionOutcome.EXECUTED; }
    public boolean isSkipped()   { return outcome == ActionOutcome.SKIPPED; }
    public boolean isFailed()    { return outcome == ActionOutcome.FAILED; }
    public boolean isCancelled() { return outcome == ActionOutcome.CANCELLED; }

    /** True for EXECUTED and SKIPPED: the enclosing sequence may continue. */
    public boolean isSuccess()   { return isExecuted() || isSkipped(); }

    @Override
    public String toString() {
        return String.format("ActionResult{outcome=%s, message='%s'}", outcome, message);
    }
}
