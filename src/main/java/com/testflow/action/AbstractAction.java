package com.testflow.action;

import com.testflow.model.ActionState;
import com.testflow.model.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Base class for every built-in action.
 *
 * {@link #execute} is a fixed template around {@link #doExecute}:
 * <pre>
 *   COMPLETED / FAILED  → READY          (a loop body runs the same action again)
 *   READY / PAUSED      → RUNNING
 *   doExecute == true   → COMPLETED, executed
 *   doExecute == false  → PAUSED, cancelled   when a cancel was requested, or a
 *                                             child in runSequence was cancelled
 *                       → FAILED, failed      otherwise
 *   ActionCancelledException → PAUSED, rethrown
 *   other RuntimeException   → FAILED, rethrown for the executor to report
 * </pre>
 * Each execution links its own cancellation source to the caller's token, which is what
 * {@link #cancel()} triggers.
 */
public abstract class AbstractAction implements Action {

    private static final Logger log = LoggerFactory.getLogger(AbstractAction.class);

    private String                      name;
    private String                      description;
    private boolean                     enabled = true;
    private volatile ActionState        state   = ActionState.READY;
    private volatile String             failureReason;
    private volatile CancellationTokenSource running;
    private volatile boolean            childCancelled;
    private final List<ActionStateListener> listeners = new CopyOnWriteArrayList<>();

    protected AbstractAction(String name, String description) {
        this.name        = name;
        this.description = description;
    }

    // ── Execution template ────────────────────────────────────────────────────

    @Override
    public final ActionResult execute(ActionContext context) {
        if (state == ActionState.RUNNING) {
            throw new IllegalStateException("Action '" + getName() + "' is already running");
        }
        if (state.isTerminal()) {
            setState(ActionState.READY);
        }
        failureReason  = null;
        childCancelled = false;

        try (CancellationTokenSource source = CancellationTokenSource.linkedTo(context.getToken())) {
            running = source;
            setState(ActionState.RUNNING);

            boolean succeeded;
            try {
                succeeded = doExecute(context.withToken(source.getToken()));
            } catch (ActionCancelledException e) {
                setState(ActionState.PAUSED);
                throw e;
            } catch (RuntimeException e) {
                failureReason = e.getMessage();
                setState(ActionState.FAILED);
                throw e;
            } finally {
                running = null;
            }

            if (succeeded) {
                setState(ActionState.COMPLETED);
                return ActionResult.executed(getName() + " completed");
            }
            if (source.isCancellationRequested() || childCancelled) {
                setState(ActionState.PAUSED);
                return ActionResult.cancelled(getName() + " was cancelled");
            }
            setState(ActionState.FAILED);
            String reason = failureReason != null ? failureReason : getName() + " failed";
            return ActionResult.failed(reason, null);
        }
    }

    /**
     * The action body.
     *
     * @return true on success; false on failure, or when it stopped because the
     *         context's token was cancelled
     */
    protected abstract boolean doExecute(ActionContext context);

    /** Records why the body is about to return false, and returns false. */
    protected boolean fail(String reason) {
        this.failureReason = reason;
        return false;
    }

    /**
     * Runs a child sequence in order, skipping disabled actions. Stops at the first
     * child that fails or is cancelled, and before any child once a cancel is pending.
     * A cancelled child makes this action's result cancelled rather than failed.
     *
     * @return true when every enabled child succeeded
     */
    protected boolean runSequence(List<Action> actions, ActionContext context, Environment environment) {
        for (Action child : actions) {
            if (context.isCancellationRequested()) {
                return false;
            }
            if (!child.isEnabled()) {
                log.debug("AbstractAction: skipping disabled action '{}'", child.getName());
                continue;
            }
            if (child instanceof LogicAction logic && environment != null) {
                logic.bindEnvironment(environment);
            }
            ActionResult result = child.execute(context);
            if (!result.isSuccess()) {
                if (result.isCancelled()) childCancelled = true;
                if (result.isFailed()) fail(result.getMessage());
                return false;
            }
        }
        return true;
    }

    // ── Cancellation & reset ──────────────────────────────────────────────────

    @Override
    public void cancel() {
        CancellationTokenSource source = running;
        if (source != null) {
            log.debug("AbstractAction: cancel requested for '{}'", getName());
            source.cancel();
        }
    }

    @Override
    public void reset() {
        setState(ActionState.READY);
        failureReason = null;
        if (this instanceof CompositeAction composite) {
            composite.getChildren().forEach(Action::reset);
        }
    }

    // ── State ─────────────────────────────────────────────────────────────────

    @Override
    public ActionState getState() { return state; }

    /**
     * Moves to {@code next}, notifying listeners.
     *
     * @throws IllegalStateException for a transition {@link ActionState} does not allow
     */
    protected void setState(ActionState next) {
        ActionState previous = state;
        if (previous == next) return;
        if (!previous.canTransitionTo(next)) {
            throw new IllegalStateException(
                "Action '" + getName() + "' cannot move from " + previous + " to " + next);
        }
        state = next;
        for (ActionStateListener listener : listeners) {
            listener.onStateChanged(this, previous, next);
        }
    }

    @Override
    public void addStateListener(ActionStateListener listener)    { listeners.add(listener); }
    @Override
    public void removeStateListener(ActionStateListener listener) { listeners.remove(listener); }

    // ── Properties ────────────────────────────────────────────────────────────

    @Override
    public String  getName()        { return name; }
    @Override
    public String  getDescription() { return description; }
    @Override
    public boolean isEnabled()      { return enabled; }

    /** The reason recorded by the last failed execution, or null. */
    public String  getFailureReason() { return failureReason; }

    public void setName(String name)               { this.name = name; }
    public void setDescription(String description) { this.description = description; }
    public void setEnabled(boolean enabled)        { this.enabled = enabled; }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + getName() + "', state=" + state + "}";
    }
}
