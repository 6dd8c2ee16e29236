package com.testflow.flow;

import com.testflow.action.Action;
import com.testflow.action.ActionCancelledException;
import com.testflow.action.ActionContext;
import com.testflow.action.ActionResult;
import com.testflow.action.CancellationToken;
import com.testflow.action.LogicAction;
import com.testflow.locator.UiSession;
import com.testflow.model.ActionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * Runs a {@link Flow}'s top-level actions in order.
 *
 * ## Execution model
 *
 *   1. A flow that is PAUSED or FAILED with a current action resumes from that action:
 *      earlier actions are not run again, the current one and everything after it are
 *      reset. Any other flow has its whole tree reset and starts from the first action.
 *   2. The flow moves to RUNNING.
 *   3. For each action: it becomes the current action, receives the flow's Environment
 *      if it is a {@link LogicAction}, and is executed. Disabled actions are skipped.
 *   4. A cancel pending before an action starts pauses the flow without running it.
 *      A cancelled action, or a failed one while a cancel is pending, pauses it too.
 *      The current action is kept so a later run resumes there.
 *   5. Any other failed action fails the flow, again keeping it as the current action.
 *   6. An exception escaping an action is logged and fails the flow; it never reaches
 *      the caller.
 *   7. When every action has run the flow is COMPLETED and has no current action.
 *
 * Listeners are notified at each of those scheduling points. One flow may have only
 * one run in flight; a second concurrent run is rejected.
 */
public class FlowExecutor {

    private static final Logger log = LoggerFactory.getLogger(FlowExecutor.class);

    private final UiSession<?>       uiSession;
    private final int                maxLoopIterations;
    private final List<FlowListener> listeners = new CopyOnWriteArrayList<>();

    public FlowExecutor(UiSession<?> uiSession, int maxLoopIterations) {
        this.uiSession         = uiSession;
        this.maxLoopIterations = maxLoopIterations;
    }

    /** An executor for flows that do not touch a UI, with no loop guard. */
    public FlowExecutor() {
        this(null, 0);
    }

    public void addListener(FlowListener listener)    { listeners.add(listener); }
    public void removeListener(FlowListener listener) { listeners.remove(listener); }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Runs or resumes the flow on the calling thread.
     *
     * @throws IllegalStateException when the flow is already running
     */
    public FlowRunResult run(Flow flow, CancellationToken token) {
        if (!flow.tryBeginRun()) {
            throw new IllegalStateException("Flow '" + flow.getName() + "' is already running");
        }
        try {
            return doRun(flow, token != null ? token : CancellationToken.NONE);
        } finally {
            flow.endRun();
        }
    }

    /**
     * Runs the flow starting at {@code action}, which must be one of its top-level actions.
     * Earlier actions are not run.
     */
    public FlowRunResult runFrom(Flow flow, Action action, CancellationToken token) {
        if (ActionTrees.indexOf(flow.getActions(), action) < 0) {
            throw new IllegalArgumentException(
                "Action '" + action.getName() + "' is not a top-level action of flow '" + flow.getName() + "'");
        }
        if (flow.isRunning()) {
            throw new IllegalStateException("Flow '" + flow.getName() + "' is already running");
        }
        flow.setCurrentAction(action);
        flow.setState(ActionState.PAUSED);
        return run(flow, token);
    }

    /**
     * Runs the flow on {@code executor}. The returned future completes with the run's
     * result; it completes exceptionally only when the flow was already running.
     */
    public CompletableFuture<FlowRunResult> runAsync(Flow flow, CancellationToken token, Executor executor) {
        if (flow.isRunning()) {
            return CompletableFuture.failedFuture(
                new IllegalStateException("Flow '" + flow.getName() + "' is already running"));
        }
        return CompletableFuture.supplyAsync(() -> run(flow, token), executor);
    }

    // ── Run loop ──────────────────────────────────────────────────────────────

    private FlowRunResult doRun(Flow flow, CancellationToken token) {
        List<Action> actions = flow.getActions();
        boolean resuming = isResuming(flow);
        int start = resuming ? ActionTrees.indexOf(actions, flow.getCurrentAction()) : 0;

        if (resuming) {
            log.info("FlowExecutor: Resuming flow '{}' at action #{} '{}'",
                flow.getName(), start + 1, actions.get(start).getName());
            for (int i = start; i < actions.size(); i++) {
                actions.get(i).reset();
            }
        } else {
            log.info("FlowExecutor: Starting flow '{}' ({} action(s))", flow.getName(), actions.size());
            ActionTrees.resetAll(actions);
            flow.setCurrentAction(null);
        }

        if (flow.getState().isTerminal()) {
            changeState(flow, ActionState.READY);
        }
        changeState(flow, ActionState.RUNNING);

        ActionContext context = new ActionContext(token, uiSession, maxLoopIterations);

        for (int i = start; i < actions.size(); i++) {
            Action action = actions.get(i);
            changeCurrentAction(flow, action);

            if (token.isCancellationRequested()) {
                return pause(flow, action);
            }
            if (!action.isEnabled()) {
                log.info("FlowExecutor: SKIPPED disabled action '{}'", action.getName());
                actionFinished(flow, action, ActionResult.skipped("Action is disabled"));
                continue;
            }
            if (action instanceof LogicAction logic) {
                logic.bindEnvironment(flow.getEnvironment());
            }

            ActionResult result;
            try {
                result = action.execute(context);
            } catch (ActionCancelledException e) {
                actionFinished(flow, action, ActionResult.cancelled(e.getMessage()));
                return pause(flow, action);
            } catch (RuntimeException e) {
                log.error("FlowExecutor: Action '{}' threw unexpectedly: {}", action.getName(), e.getMessage(), e);
                ActionResult failed = ActionResult.failed("Action threw: " + e.getMessage(), e);
                actionFinished(flow, action, failed);
                changeState(flow, ActionState.FAILED);
                return FlowRunResult.failed(action, failed.getMessage(), e);
            }

            log.info("FlowExecutor: {} '{}' - {}", result.getOutcome(), action.getName(), result.getMessage());
            actionFinished(flow, action, result);

            if (result.isCancelled() || (result.isFailed() && token.isCancellationRequested())) {
                return pause(flow, action);
            }
            if (result.isFailed()) {
                changeState(flow, ActionState.FAILED);
                return FlowRunResult.failed(action, result.getMessage(), result.getError());
            }
        }

        changeCurrentAction(flow, null);
        changeState(flow, ActionState.COMPLETED);
        log.info("FlowExecutor: Flow '{}' completed", flow.getName());
        return FlowRunResult.completed("Flow '" + flow.getName() + "' completed");
    }

    private FlowRunResult pause(Flow flow, Action action) {
        changeState(flow, ActionState.PAUSED);
        log.info("FlowExecutor: Flow '{}' paused at '{}'", flow.getName(), action.getName());
        return FlowRunResult.paused("Paused at '" + action.getName() + "'");
    }

    private static boolean isResuming(Flow flow) {
        ActionState state = flow.getState();
        return (state == ActionState.PAUSED || state == ActionState.FAILED)
            && flow.getCurrentAction() != null
            && ActionTrees.indexOf(flow.getActions(), flow.getCurrentAction()) >= 0;
    }

    // ── Scheduling points ─────────────────────────────────────────────────────

    private void changeState(Flow flow, ActionState next) {
        ActionState previous = flow.getState();
        if (previous == next) return;
        flow.setState(next);
        for (FlowListener listener : listeners) {
            listener.onFlowStateChanged(flow, previous, next);
        }
    }

    private void changeCurrentAction(Flow flow, Action action) {
        flow.setCurrentAction(action);
        for (FlowListener listener : listeners) {
            listener.onCurrentActionChanged(flow, action);
        }
    }

    private void actionFinished(Flow flow, Action action, ActionResult result) {
        for (FlowListener listener : listeners) {
            listener.onActionFinished(flow, action, result);
        }
    }
}
