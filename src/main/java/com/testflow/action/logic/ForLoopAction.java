package com.testflow.action.logic;

import com.testflow.action.AbstractLogicAction;
import com.testflow.action.Action;
import com.testflow.action.ActionContext;
import com.testflow.action.ActionDefinition;
import com.testflow.action.CompositeAction;
import com.testflow.action.ConditionSlot;
import com.testflow.action.StepSlot;
import com.testflow.action.SyntaxValidator;
import com.testflow.flow.SyntaxError;
import com.testflow.flow.ValidationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code for (initialization; condition; increment) { body }}
 *
 * The initialization step runs once. Then, per iteration: the condition is evaluated
 * (false ends the loop successfully), the body runs in order, and the increment step
 * runs. A failing body action, a failing step or a cancel aborts the whole loop.
 *
 * Initialization and increment are usually {@link SetVariableAction}s, e.g.
 * {@code i = 0} and {@code i = i + 1}.
 */
@ActionDefinition(type = "ForLoop", category = "Logic",
                  description = "Repeat actions with initialization, condition and increment")
public class ForLoopAction extends AbstractLogicAction implements CompositeAction, SyntaxValidator {

    private static final Logger log = LoggerFactory.getLogger(ForLoopAction.class);

    private StepSlot            initialization = StepSlot.absent();
    private ConditionSlot       condition      = ConditionSlot.absent();
    private StepSlot            increment      = StepSlot.absent();
    private final List<Action>  body           = new ArrayList<>();
    private int                 iterations;

    public ForLoopAction() {
        super("For Loop", "Repeat actions with initialization, condition and increment");
    }

    public ForLoopAction(StepSlot initialization, ConditionSlot condition, StepSlot increment) {
        this();
        setInitialization(initialization);
        setCondition(condition);
        setIncrement(increment);
    }

    @Override
    protected boolean doExecute(ActionContext context) {
        iterations = 0;
        if (!runStep(initialization, "initialization", context)) {
            return false;
        }
        while (true) {
            if (context.isCancellationRequested()) {
                return false;
            }
            Boolean value = evaluateCondition(condition, context);
            if (value == null) {
                return false;
            }
            if (!value) {
                log.debug("ForLoopAction: '{}' finished after {} iteration(s)", getName(), iterations);
                return true;
            }
            int limit = context.getMaxLoopIterations();
            if (limit > 0 && iterations >= limit) {
                log.warn("ForLoopAction: '{}' stopped by the loop guard after {} iteration(s)",
                    getName(), iterations);
                return fail("Loop exceeded the maximum of " + limit + " iterations");
            }
            iterations++;
            body.forEach(Action::reset);
            if (!runSequence(body, context, getEnvironment())) {
                return false;
            }
            if (!runStep(increment, "increment", context)) {
                return false;
            }
        }
    }

    private boolean runStep(StepSlot step, String label, ActionContext context) {
        return switch (step.getKind()) {
            case ABSENT      -> true;
            case UNSUPPORTED -> fail("For loop " + label + " is not an action: " + step.getDescription());
            case ACTION_REF  -> runSequence(List.of(step.getAction()), context, getEnvironment());
        };
    }

    /** Iterations started by the last execution. */
    public int getIterations() { return iterations; }

    @Override
    public Map<String, List<Action>> getChildSequences() {
        Map<String, List<Action>> sequences = new LinkedHashMap<>();
        sequences.put("initialization", initialization.isAction() ? List.of(initialization.getAction()) : List.of());
        sequences.put("body", body);
        sequences.put("increment", increment.isAction() ? List.of(increment.getAction()) : List.of());
        return sequences;
    }

    @Override
    public List<SyntaxError> validate(ValidationContext context) {
        List<SyntaxError> errors = new ArrayList<>();
        switch (condition.getKind()) {
            case ABSENT -> errors.add(SyntaxError.critical(this, "Condition",
                "For loop condition cannot be null"));
            case UNSUPPORTED -> errors.add(SyntaxError.critical(this, "Condition",
                "For loop condition must be a boolean value or boolean expression")
                .withContext(condition.getText()));
            default -> { }
        }
        if (initialization.getKind() == StepSlot.Kind.UNSUPPORTED) {
            errors.add(SyntaxError.error(this, "Initialization",
                "For loop initialization must be an action or absent")
                .withContext(initialization.getDescription()));
        }
        if (increment.getKind() == StepSlot.Kind.UNSUPPORTED) {
            errors.add(SyntaxError.error(this, "Increment",
                "For loop increment must be an action or absent")
                .withContext(increment.getDescription()));
        }
        if (body.isEmpty()) {
            errors.add(SyntaxError.warning(this, "Body",
                "For loop body is empty - loop will have no effect"));
        }
        return errors;
    }

    public StepSlot      getInitialization() { return initialization; }
    public ConditionSlot getCondition()      { return condition; }
    public StepSlot      getIncrement()      { return increment; }
    public List<Action>  getBody()           { return body; }

    public void setInitialization(StepSlot initialization) {
        this.initialization = initialization != null ? initialization : StepSlot.absent();
    }

    public void setCondition(ConditionSlot condition) {
        this.condition = condition != null ? condition : ConditionSlot.absent();
    }

    public void setIncrement(StepSlot increment) {
        this.increment = increment != null ? increment : StepSlot.absent();
    }
}
