package com.testflow.action;

import com.testflow.model.ActionState;

/**
 * A unit of work in a flow.
 *
 * {@link #execute} runs the action to completion on the calling thread and reports
 * success, failure or cancellation through the returned {@link ActionResult}. Only a
 * genuinely unexpected fault escapes as an exception; the flow executor is responsible
 * for catching it.
 *
 * {@link #cancel()} is cooperative: the action stops at its next checkpoint and ends in
 * {@link ActionState#PAUSED}. Process launches are the exception and kill their child.
 */
public interface Action {

    String getName();

    String getDescription();

    boolean isEnabled();

    ActionState getState();

    ActionResult execute(ActionContext context);

    void cancel();

    /** Returns this action, and every nested action, to {@link ActionState#READY}. */
    void reset();

    void addStateListener(ActionStateListener listener);

    void removeStateListener(ActionStateListener listener);
}
