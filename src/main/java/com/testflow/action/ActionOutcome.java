package com.testflow.action;

/**
 * How one execution of an action ended.
 *
 *   EXECUTED   the action ran and succeeded
 *   SKIPPED    the action was not run because it is disabled
 *   FAILED     the action ran and did not succeed (element missing, condition not boolean, ...)
 *   CANCELLED  the action stopped because a cancel was requested; the run is resumable
 */
public enum ActionOutcome {
    EXECUTED,
    SKIPPED,
    FAILED,
    CANCELLED
}
