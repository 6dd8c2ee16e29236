package com.testflow.action;

import com.testflow.locator.UiSession;

/**
 * Passed to every {@link Action#execute} call.
 *
 * Carries:
 *   - the cancellation token of the enclosing scope
 *   - the UI session (locator + interactor) used by element actions; null for flows
 *     without a UI
 *   - the loop guard: the most iterations a while or for loop may run, 0 for unlimited
 *
 * Contexts are immutable. {@link AbstractAction} hands each action body a copy scoped
 * to the action's own token, so cancelling one action stops only its subtree.
 */
public class ActionContext {

    private final CancellationToken token;
    private final UiSession<?>      uiSession;
    private final int               maxLoopIterations;

    public ActionContext(CancellationToken token, UiSession<?> uiSession, int maxLoopIterations) {
        this.token             = token != null ? token : CancellationToken.NONE;
        this.uiSession         = uiSession;
        this.maxLoopIterations = Math.max(0, maxLoopIterations);
    }

    /** Convenience constructor for flows that do not touch a UI. */
    public ActionContext(CancellationToken token) {
        this(token, null, 0);
    }

    public CancellationToken getToken()             { return token; }
    public UiSession<?>      getUiSession()         { return uiSession; }
    public int               getMaxLoopIterations() { return maxLoopIterations; }

    public boolean isCancellationRequested() {
        return token.isCancellationRequested();
    }

    /**
     * @throws IllegalStateException when the context was built without a UI session
     */
    public UiSession<?> requireUiSession() {
        if (uiSession == null) {
            throw new IllegalStateException("No UI session is configured for this run");
        }
        return uiSession;
    }

    public ActionContext withToken(CancellationToken scoped) {
        return new ActionContext(scoped, uiSession, maxLoopIterations);
    }
}
