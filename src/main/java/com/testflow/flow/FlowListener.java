package com.testflow.flow;

import com.testflow.action.Action;
import com.testflow.action.ActionResult;
import com.testflow.model.ActionState;

/**
 * Observes a flow run. Callbacks run synchronously on the executing thread at the run's
 * scheduling points: after the flow changes state, after the current action changes,
 * and after each action finishes. State seen from a callback is consistent.
 */
public interface FlowListener {

    default void onFlowStateChanged(Flow flow, ActionState previous, ActionState current) { }

    default void onCurrentActionChanged(Flow flow, Action action) { }

    default void onActionFinished(Flow flow, Action action, ActionResult result) { }
}
