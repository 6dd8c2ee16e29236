package com.testflow.action;

import com.testflow.model.ActionState;
import com.testflow.support.ScriptedAction;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the execution template every action shares: state transitions, result mapping
 * and per-execution cancellation.
 */
public class AbstractActionTest {

    private static ActionContext context() {
        return new ActionContext(CancellationToken.NONE);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Outcome mapping
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void success_completesAndReportsExecuted() {
        ScriptedAction action = ScriptedAction.succeeding("Step");
        List<String> transitions = new ArrayList<>();
        action.addStateListener((a, previous, next) -> transitions.add(previous + "->" + next));

        ActionResult result = action.execute(context());

        assertThat(result.isExecuted()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Step completed");
        assertThat(action.getState()).isEqualTo(ActionState.COMPLETED);
        assertThat(transitions).containsExactly("READY->RUNNING", "RUNNING->COMPLETED");
    }

    @Test
    public void failure_carriesTheRecordedReason() {
        ScriptedAction action = ScriptedAction.failing("Step");

        ActionResult result = action.execute(context());

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Step failed on purpose");
        assertThat(action.getFailureReason()).isEqualTo("Step failed on purpose");
        assertThat(action.getState()).isEqualTo(ActionState.FAILED);
    }

    @Test
    public void falseAfterCancel_isPausedNotFailed() {
        ScriptedAction action = ScriptedAction.stoppingOnCancel("Step");
        action.onExecute(ctx -> action.cancel());

        ActionResult result = action.execute(context());

        assertThat(result.isCancelled()).isTrue();
        assertThat(action.getState()).isEqualTo(ActionState.PAUSED);
    }

    @Test
    public void cancelledException_pausesAndPropagates() {
        ScriptedAction action = ScriptedAction.throwing("Step", new ActionCancelledException("stop"));

        assertThatThrownBy(() -> action.execute(context())).isInstanceOf(ActionCancelledException.class);
        assertThat(action.getState()).isEqualTo(ActionState.PAUSED);
    }

    @Test
    public void unexpectedException_failsAndPropagates() {
        ScriptedAction action = ScriptedAction.throwing("Step", new IllegalStateException("boom"));

        assertThatThrownBy(() -> action.execute(context())).hasMessage("boom");
        assertThat(action.getState()).isEqualTo(ActionState.FAILED);
        assertThat(action.getFailureReason()).isEqualTo("boom");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Re-execution and cancellation scope
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void terminalAction_canRunAgain() {
        ScriptedAction action = ScriptedAction.succeeding("Step");

        action.execute(context());
        action.execute(context());

        assertThat(action.getExecutions()).isEqualTo(2);
        assertThat(action.getState()).isEqualTo(ActionState.COMPLETED);
    }

    @Test
    public void runningAction_rejectsReentry() {
        ScriptedAction action = ScriptedAction.succeeding("Step");
        action.onExecute(ctx -> action.execute(ctx));

        assertThatThrownBy(() -> action.execute(context()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already running");
    }

    @Test
    public void cancellingOneAction_leavesTheCallerTokenAlone() {
        CancellationTokenSource run = new CancellationTokenSource();
        ScriptedAction action = ScriptedAction.stoppingOnCancel("Step");
        action.onExecute(ctx -> action.cancel());

        action.execute(new ActionContext(run.getToken()));

        assertThat(run.isCancellationRequested()).isFalse();
    }

    @Test
    public void cancelledCallerToken_reachesTheActionBody() {
        CancellationTokenSource run = new CancellationTokenSource();
        run.cancel();
        ScriptedAction action = ScriptedAction.stoppingOnCancel("Step");

        assertThat(action.execute(new ActionContext(run.getToken())).isCancelled()).isTrue();
    }

    @Test
    public void reset_returnsToReadyAndClearsReason() {
        ScriptedAction action = ScriptedAction.failing("Step");
        action.execute(context());

        action.reset();

        assertThat(action.getState()).isEqualTo(ActionState.READY);
        assertThat(action.getFailureReason()).isNull();
    }

    @Test
    public void requireUiSession_withoutSession_throws() {
        assertThatThrownBy(() -> context().requireUiSession())
            .isInstanceOf(IllegalStateException.class);
        assertThat(new ActionContext(null, null, -5).getMaxLoopIterations()).isZero();
    }
}
