package com.testflow.action.logic;

import com.testflow.action.AbstractLogicAction;
import com.testflow.action.Action;
import com.testflow.action.ActionContext;
import com.testflow.action.ActionDefinition;
import com.testflow.action.CompositeAction;
import com.testflow.action.ConditionSlot;
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
 * Repeats the body while the condition holds.
 *
 * Each iteration evaluates the condition exactly once and then runs the body, reset to
 * READY, in order. The loop ends successfully on the first false evaluation. It fails
 * closed, without throwing, when the condition is absent, not boolean, or cannot be
 * evaluated; when a body action fails; or when the configured iteration guard is hit.
 * A pending cancel is observed before every iteration.
 */
@ActionDefinition(type = "WhileLoop", category = "Logic",
                  description = "Repeat actions while a condition holds")
public class WhileLoopAction extends AbstractLogicAction implements CompositeAction, SyntaxValidator {

    private static final Logger log = LoggerFactory.getLogger(WhileLoopAction.class);

    private ConditionSlot       condition = ConditionSlot.absent();
    private final List<Action>  body      = new ArrayList<>();
    private int                 iterations;

    public WhileLoopAction() {
        super("While Loop", "Repeat actions while a condition holds");
    }

    public WhileLoopAction(ConditionSlot condition) {
        this();
        setCondition(condition);
    }

    @Override
    protected boolean doExecute(ActionContext context) {
        iterations = 0;
        while (true) {
            if (context.isCancellationRequested()) {
                return false;
            }
            Boolean value = evaluateCondition(condition, context);
            if (value == null) {
                return false;
            }
            if (!value) {
                log.debug("WhileLoopAction: '{}' finished after {} iteration(s)", getName(), iterations);
                return true;
            }
            int limit = context.getMaxLoopIterations();
            if (limit > 0 && iterations >= limit) {
                log.warn("WhileLoopAction: '{}' stopped by the loop guard after {} iteration(s)",
                    getName(), iterations);
                return fail("Loop exceeded the maximum of " + limit + " iterations");
            }
            iterations++;
            body.forEach(Action::reset);
            if (!runSequence(body, context, getEnvironment())) {
                return false;
            }
        }
    }

    /** Iterations started by the last execution. */
    public int getIterations() { return iterations; }

    @Override
    public Map<String, List<Action>> getChildSequences() {
        Map<String, List<Action>> sequences = new LinkedHashMap<>();
        sequences.put("body", body);
        return sequences;
    }

    @Override
    public List<SyntaxError> validate(ValidationContext context) {
        List<SyntaxError> errors = new ArrayList<>();
        switch (condition.getKind()) {
            case ABSENT -> errors.add(SyntaxError.critical(this, "Condition",
                "While loop condition cannot be null"));
            case UNSUPPORTED -> errors.add(SyntaxError.critical(this, "Condition",
                "While loop condition must be a boolean value or boolean expression")
                .withContext(condition.getText()));
            default -> { }
        }
        if (body.isEmpty()) {
            errors.add(SyntaxError.warning(this, "Body",
                "While loop body is empty - loop will have no effect"));
        }
        return errors;
    }

    public ConditionSlot getCondition() { return condition; }
    public List<Action>  getBody()      { return body; }

    public void setCondition(ConditionSlot condition) {
        this.condition = condition != null ? condition : ConditionSlot.absent();
    }
}
