package com.testflow.action.logic;

import com.testflow.action.ActionContext;
import com.testflow.action.ActionResult;
import com.testflow.action.CancellationToken;
import com.testflow.action.ConditionSlot;
import com.testflow.expression.Expression;
import com.testflow.expression.ExpressionParser;
import com.testflow.flow.SyntaxError;
import com.testflow.flow.SyntaxErrorSeverity;
import com.testflow.flow.ValidationContext;
import com.testflow.model.ActionState;
import com.testflow.model.Environment;
import com.testflow.model.VariableType;
import com.testflow.support.ScriptedAction;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests WhileLoopAction iteration, termination and the loop guard.
 */
public class WhileLoopActionTest {

    private Environment env;

    @BeforeMethod
    public void setUp() {
        env = new Environment();
        env.set("i", 0);
    }

    private WhileLoopAction countingLoop(String condition, ScriptedAction marker) {
        WhileLoopAction loop = new WhileLoopAction(ConditionSlot.parse(condition));
        loop.getBody().add(new SetVariableAction("i",
            ExpressionParser.parseArithmetic("i + 1", Integer.class).orElseThrow(), VariableType.INTEGER));
        loop.getBody().add(marker);
        loop.bindEnvironment(env);
        return loop;
    }

    // ════════════════════════════════════════════════════════════════════════
    // Iteration
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void conditionIsReevaluatedEveryIteration() {
        ScriptedAction marker = ScriptedAction.succeeding("marker");
        WhileLoopAction loop = countingLoop("i < 3", marker);

        ActionResult result = loop.execute(new ActionContext(CancellationToken.NONE));

        assertThat(result.isExecuted()).isTrue();
        assertThat(loop.getIterations()).isEqualTo(3);
        assertThat(marker.getExecutions()).isEqualTo(3);
        assertThat(env.valueOf("i")).contains(3);
    }

    @Test
    public void oneExecution_runsEveryIteration_evaluatingConditionOncePerIteration() {
        AtomicInteger evaluations = new AtomicInteger();
        Expression<Boolean> belowThree = new Expression<>(Boolean.class) {
            @Override
            protected Boolean doEvaluate() {
                evaluations.incrementAndGet();
                return env.valueOf("i").map(v -> (Integer) v < 3).orElse(false);
            }

            @Override
            public String toSourceText() { return "i < 3"; }
        };
        ScriptedAction marker = ScriptedAction.succeeding("marker");
        WhileLoopAction loop = new WhileLoopAction(ConditionSlot.expression(belowThree));
        loop.getBody().add(new SetVariableAction("i",
            ExpressionParser.parseArithmetic("i + 1", Integer.class).orElseThrow(), VariableType.INTEGER));
        loop.getBody().add(marker);
        loop.bindEnvironment(env);

        ActionResult result = loop.execute(new ActionContext(CancellationToken.NONE));

        assertThat(result.isExecuted()).isTrue();
        assertThat(loop.getIterations()).isEqualTo(3);
        assertThat(marker.getExecutions()).isEqualTo(3);
        assertThat(evaluations).hasValue(4);
    }

    @Test
    public void falseOnEntry_runsNothing() {
        ScriptedAction marker = ScriptedAction.succeeding("marker");
        WhileLoopAction loop = countingLoop("i > 0", marker);

        assertThat(loop.execute(new ActionContext(CancellationToken.NONE)).isExecuted()).isTrue();
        assertThat(loop.getIterations()).isZero();
        assertThat(marker.getExecutions()).isZero();
    }

    @Test
    public void loopGuard_failsAfterConfiguredIterations() {
        ScriptedAction marker = ScriptedAction.succeeding("marker");
        WhileLoopAction loop = new WhileLoopAction(ConditionSlot.literal(true));
        loop.getBody().add(marker);

        ActionResult result = loop.execute(new ActionContext(CancellationToken.NONE, null, 5));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Loop exceeded the maximum of 5 iterations");
        assertThat(marker.getExecutions()).isEqualTo(5);
    }

    @Test
    public void bodyActionsAreResetBetweenIterations() {
        ScriptedAction marker = ScriptedAction.succeeding("marker");
        WhileLoopAction loop = countingLoop("i < 2", marker);

        loop.execute(new ActionContext(CancellationToken.NONE));

        assertThat(marker.getState()).isEqualTo(ActionState.COMPLETED);
        assertThat(marker.getExecutions()).isEqualTo(2);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Stopping early
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void cancelFromBody_pausesAfterTheCurrentIteration() {
        WhileLoopAction loop = new WhileLoopAction(ConditionSlot.literal(true));
        ScriptedAction marker = ScriptedAction.succeeding("marker");
        marker.onExecute(ctx -> loop.cancel());
        loop.getBody().add(marker);

        ActionResult result = loop.execute(new ActionContext(CancellationToken.NONE));

        assertThat(result.isCancelled()).isTrue();
        assertThat(loop.getState()).isEqualTo(ActionState.PAUSED);
        assertThat(loop.getIterations()).isEqualTo(1);
    }

    @Test
    public void bodyActionCancellingItself_pausesTheLoopInsteadOfFailingIt() {
        WhileLoopAction loop = new WhileLoopAction(ConditionSlot.literal(true));
        ScriptedAction stopper = ScriptedAction.stoppingOnCancel("stopper");
        stopper.onExecute(ctx -> stopper.cancel());
        ScriptedAction after = ScriptedAction.succeeding("after");
        loop.getBody().add(stopper);
        loop.getBody().add(after);

        ActionResult result = loop.execute(new ActionContext(CancellationToken.NONE));

        assertThat(result.isCancelled()).isTrue();
        assertThat(loop.getState()).isEqualTo(ActionState.PAUSED);
        assertThat(loop.getIterations()).isEqualTo(1);
        assertThat(after.getExecutions()).isZero();
    }

    @Test
    public void failingBodyAction_failsTheLoop() {
        WhileLoopAction loop = countingLoop("i < 10", ScriptedAction.failing("marker"));

        ActionResult result = loop.execute(new ActionContext(CancellationToken.NONE));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getMessage()).isEqualTo("marker failed on purpose");
        assertThat(loop.getIterations()).isEqualTo(1);
    }

    @Test
    public void conditionTurningIllTyped_failsClosed() {
        ScriptedAction marker = ScriptedAction.succeeding("marker");
        marker.onExecute(ctx -> env.set("i", "done"));
        WhileLoopAction loop = new WhileLoopAction(ConditionSlot.parse("i < 3"));
        loop.getBody().add(marker);
        loop.bindEnvironment(env);

        ActionResult result = loop.execute(new ActionContext(CancellationToken.NONE));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getMessage()).contains("could not be evaluated");
    }

    @Test
    public void absentCondition_failsClosed() {
        assertThat(new WhileLoopAction().execute(new ActionContext(CancellationToken.NONE)).isFailed()).isTrue();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Validation
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void validate_warnsAboutEmptyBody() {
        List<SyntaxError> errors = new WhileLoopAction(ConditionSlot.literal(true))
            .validate(new ValidationContext("Flow.actions[0]", env, null, null));

        assertThat(errors).singleElement().satisfies(e -> {
            assertThat(e.getSeverity()).isEqualTo(SyntaxErrorSeverity.WARNING);
            assertThat(e.getMessage()).isEqualTo("While loop body is empty - loop will have no effect");
        });
    }

    @Test
    public void validate_missingCondition_isCritical() {
        WhileLoopAction loop = new WhileLoopAction();
        loop.getBody().add(ScriptedAction.succeeding("marker"));

        assertThat(loop.validate(new ValidationContext("Flow.actions[0]", env, null, null)))
            .extracting(SyntaxError::getSeverity)
            .containsExactly(SyntaxErrorSeverity.CRITICAL);
    }
}
