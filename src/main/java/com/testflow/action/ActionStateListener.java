package com.testflow.action;

import com.testflow.model.ActionState;

/**
 * Notified synchronously, on the executing thread, whenever an action changes state.
 * This is how a presentation layer follows progress while an action is still running.
 */
@FunctionalInterface
public interface ActionStateListener {
    void onStateChanged(Action action, ActionState previous, ActionState current);
}
