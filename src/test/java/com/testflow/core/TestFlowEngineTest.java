package com.testflow.core;

import com.testflow.action.Action;
import com.testflow.action.ConditionSlot;
import com.testflow.action.logic.SetVariableAction;
import com.testflow.action.logic.WhileLoopAction;
import com.testflow.action.ui.ClickElementAction;
import com.testflow.action.ui.WaitForElementAction;
import com.testflow.expression.ElementExistsExpression;
import com.testflow.flow.Flow;
import com.testflow.flow.FlowRunResult;
import com.testflow.flow.FlowValidationException;
import com.testflow.locator.IdentifierKind;
import com.testflow.model.ActionState;
import com.testflow.support.FakeElementTree;
import com.testflow.support.RecordingInteractor;
import com.testflow.support.ScriptedAction;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static com.testflow.support.FakeNode.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests TestFlowEngine end to end over a synthetic element tree and a temporary flow store.
 */
public class TestFlowEngineTest {

    private Path                store;
    private RecordingInteractor interactor;
    private TestFlowEngine      engine;

    @BeforeMethod
    public void setUp() throws IOException {
        store      = Files.createTempDirectory("testflow-engine");
        interactor = new RecordingInteractor();
        FakeElementTree tree = FakeElementTree.desktop(
            node("Window").name("Calculator").add(node("Button").id("equals")));
        engine = new TestFlowEngine(config().build(), RecordingInteractor.session(tree, interactor));
    }

    @AfterMethod
    public void tearDown() throws IOException {
        try (Stream<Path> files = Files.walk(store)) {
            files.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
    }

    private TestFlowConfig.Builder config() {
        return TestFlowConfig.builder()
            .flowStorePath(store)
            .waitTimeoutMillis(1_234)
            .pollingIntervalMillis(7)
            .maxLoopIterations(5);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Validation gate
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void invalidFlow_isRejectedBeforeAnyActionRuns() {
        ScriptedAction first = ScriptedAction.succeeding("First");
        Flow flow = new Flow("Invalid").add(first).add(new WhileLoopAction());

        assertThatThrownBy(() -> engine.run(flow))
            .isInstanceOfSatisfying(FlowValidationException.class,
                e -> assertThat(e.getSummary().getCriticalErrors()).isEqualTo(1))
            .hasMessageContaining("Flow 'Invalid' is not valid");
        assertThat(first.getExecutions()).isZero();
        assertThat(flow.getState()).isEqualTo(ActionState.READY);
    }

    @Test
    public void withValidationOff_invalidFlowRunsAndFails() {
        TestFlowEngine lenient = new TestFlowEngine(config().validateBeforeRun(false).build());
        Flow flow = new Flow("Lenient").add(new WhileLoopAction());

        assertThat(lenient.run(flow).isFailed()).isTrue();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Execution
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void uiActions_driveTheAttachedSession() {
        ClickElementAction click = (ClickElementAction) engine.createAction("ClickElement");
        click.target(IdentifierKind.PATH, "Window[@Name='Calculator']/Button[@AutomationId='equals']");

        FlowRunResult result = engine.run(new Flow("Equals").add(click));

        assertThat(result.isCompleted()).isTrue();
        assertThat(interactor.getEvents()).containsExactly("click:equals");
    }

    @Test
    public void loopGuard_comesFromConfig() {
        WhileLoopAction forever = new WhileLoopAction(ConditionSlot.literal(true));
        forever.getBody().add(ScriptedAction.succeeding("tick"));

        FlowRunResult result = engine.run(new Flow("Forever").add(forever));

        assertThat(result.getMessage()).isEqualTo("Loop exceeded the maximum of 5 iterations");
    }

    @Test
    public void cancel_pausesTheActiveRun() {
        AtomicBoolean accepted = new AtomicBoolean();
        Flow flow = new Flow("Cancellable");
        ScriptedAction b = ScriptedAction.stoppingOnCancel("B");
        b.onExecute(ctx -> accepted.set(engine.cancel(flow)));
        ScriptedAction c = ScriptedAction.succeeding("C");
        flow.add(b).add(c);

        FlowRunResult paused = engine.run(flow);

        assertThat(accepted).isTrue();
        assertThat(paused.isPaused()).isTrue();
        assertThat(c.getExecutions()).isZero();
        assertThat(engine.cancel(flow)).isFalse();
    }

    @Test
    public void nestedRunOfTheSameFlow_isRefused() {
        Flow flow = new Flow("Twice");
        flow.add(ScriptedAction.succeeding("Again").onExecute(ctx -> engine.run(flow)));

        FlowRunResult result = engine.run(flow);

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getMessage()).contains("already running");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Persistence
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void saveThenLoadAndRun() {
        engine.save(new Flow("greeting", "Greeting", null).add(new SetVariableAction("greeting", "hello")));

        assertThat(engine.load("greeting")).isPresent();
        assertThat(engine.getRepository().list()).containsExactly("greeting");
        assertThat(engine.loadAndRun("greeting").isCompleted()).isTrue();
        assertThat(Files.exists(store.resolve("greeting.json"))).isTrue();
    }

    @Test
    public void loadAndRun_unknownId_throws() {
        assertThatThrownBy(() -> engine.loadAndRun("nope"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nope");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Factories
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void createAction_appliesConfiguredWaitSettings() {
        Action action = engine.createAction("WaitForElement");

        assertThat(action).isInstanceOfSatisfying(WaitForElementAction.class, wait -> {
            assertThat(wait.getTimeoutMillis()).isEqualTo(1_234);
            assertThat(wait.getPollingIntervalMillis()).isEqualTo(7);
        });
        assertThatThrownBy(() -> engine.createAction("Teleport")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void elementExists_usesTheSessionLocator() {
        ElementExistsExpression<?> exists = engine.elementExists(IdentifierKind.AUTOMATION_ID, "equals");

        assertThat(exists.getRetryTimes()).isEqualTo(ElementExistsExpression.DEFAULT_RETRY_TIMES);
        assertThat(exists.evaluate()).isTrue();
    }

    @Test
    public void elementExists_withoutSession_throws() {
        TestFlowEngine headless = new TestFlowEngine(config().build());

        assertThat(headless.getUiSession()).isNull();
        assertThatThrownBy(() -> headless.elementExists(IdentifierKind.NAME, "OK"))
            .isInstanceOf(IllegalStateException.class);
    }
}
