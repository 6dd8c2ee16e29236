package com.testflow.action.ui;

import com.testflow.action.ActionCancelledException;
import com.testflow.action.ActionContext;
import com.testflow.action.ActionResult;
import com.testflow.action.CancellationToken;
import com.testflow.action.CancellationTokenSource;
import com.testflow.flow.SyntaxError;
import com.testflow.flow.ValidationContext;
import com.testflow.locator.IdentifierKind;
import com.testflow.model.ActionState;
import com.testflow.support.FakeElementTree;
import com.testflow.support.FakeNode;
import com.testflow.support.RecordingInteractor;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import static com.testflow.support.FakeNode.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class WaitForElementActionTest {

    private FakeNode        window;
    private FakeElementTree tree;

    @BeforeMethod
    public void setUp() {
        window = node("Window").name("Setup");
        tree   = FakeElementTree.desktop(window);
    }

    private ActionContext context(CancellationToken token) {
        return new ActionContext(token, RecordingInteractor.session(tree, new RecordingInteractor()), 0);
    }

    private static WaitForElementAction waitFor(String id, long timeout, long poll) {
        WaitForElementAction action = new WaitForElementAction();
        action.target(IdentifierKind.AUTOMATION_ID, id);
        action.setTimeoutMillis(timeout);
        action.setPollingIntervalMillis(poll);
        return action;
    }

    @Test
    public void elementAppearingLater_endsTheWait() {
        tree.beforeRootQuery(n -> {
            if (n == 3) window.add(node("Button").id("finish"));
        });

        ActionResult result = waitFor("finish", 5_000, 1).execute(context(CancellationToken.NONE));

        assertThat(result.isExecuted()).isTrue();
        assertThat(tree.getRootQueries()).isEqualTo(3);
    }

    @Test
    public void timeout_failsWithDuration() {
        ActionResult result = waitFor("finish", 50, 10).execute(context(CancellationToken.NONE));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Timed out after 50ms waiting for AUTOMATION_ID 'finish'");
        assertThat(tree.getRootQueries()).isGreaterThan(1);
    }

    @Test
    public void zeroTimeout_pollsExactlyOnce() {
        assertThat(waitFor("finish", 0, 10).execute(context(CancellationToken.NONE)).isFailed()).isTrue();
        assertThat(tree.getRootQueries()).isEqualTo(1);
    }

    @Test
    public void cancelDuringWait_pausesTheAction() {
        CancellationTokenSource run = new CancellationTokenSource();
        tree.beforeRootQuery(n -> {
            if (n == 2) run.cancel();
        });
        WaitForElementAction action = waitFor("finish", 60_000, 5);

        assertThatThrownBy(() -> action.execute(context(run.getToken())))
            .isInstanceOf(ActionCancelledException.class);
        assertThat(action.getState()).isEqualTo(ActionState.PAUSED);
    }

    @Test
    public void cancelFromAnotherThread_wakesTheSleepBetweenPolls() throws InterruptedException {
        CancellationTokenSource run = new CancellationTokenSource();
        WaitForElementAction action = waitFor("finish", 120_000, 60_000);
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            run.cancel();
        });
        long start = System.currentTimeMillis();
        canceller.start();

        assertThatThrownBy(() -> action.execute(context(run.getToken())))
            .isInstanceOf(ActionCancelledException.class);
        canceller.join();

        assertThat(System.currentTimeMillis() - start).isLessThan(10_000);
        assertThat(tree.getRootQueries()).isEqualTo(1);
        assertThat(action.getState()).isEqualTo(ActionState.PAUSED);
    }

    @Test
    public void validate_rejectsNegativeTimeoutAndNonPositivePoll() {
        WaitForElementAction action = waitFor("finish", -1, 0);

        assertThat(action.validate(new ValidationContext("Flow.actions[0]", null, null, null)))
            .extracting(SyntaxError::getPropertyName)
            .containsExactly("TimeoutMillis", "PollingIntervalMillis");
    }
}
