package com.testflow.action;

import com.testflow.expression.ExpressionException;
import com.testflow.model.Environment;

/**
 * Holds the bound Environment for actions that read or write variables.
 */
public abstract class AbstractLogicAction extends AbstractAction implements LogicAction {

    private Environment environment;

    protected AbstractLogicAction(String name, String description) {
        super(name, description);
    }

    @Override
    public void bindEnvironment(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Environment getEnvironment() { return environment; }

    /**
     * Evaluates a loop or branch condition, recording a failure reason when it cannot
     * be evaluated.
     *
     * @return the condition's value, or null when the action must fail closed
     */
    protected Boolean evaluateCondition(ConditionSlot condition, ActionContext context) {
        try {
            Boolean value = condition.evaluate(environment, context.getToken()).orElse(null);
            if (value == null) {
                fail("Condition is not a boolean value or boolean expression: " + condition);
            }
            return value;
        } catch (ExpressionException e) {
            fail("Condition '" + condition.getText() + "' could not be evaluated: " + e.getMessage());
            return null;
        }
    }
}
