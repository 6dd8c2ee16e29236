package com.testflow.action.logic;

import com.testflow.action.AbstractLogicAction;
import com.testflow.action.ActionContext;
import com.testflow.action.ActionDefinition;
import com.testflow.action.SyntaxValidator;
import com.testflow.expression.Expression;
import com.testflow.expression.ExpressionException;
import com.testflow.flow.SyntaxError;
import com.testflow.flow.ValidationContext;
import com.testflow.model.Environment;
import com.testflow.model.VariableType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns a value to a flow variable: overwrites the variable when the name is already
 * declared, otherwise declares it at the end of the Environment.
 *
 * The value is either a constant or an {@link Expression}, which is evaluated at
 * execution time against the bound Environment, so {@code i = i + 1} reads the current
 * {@code i} on every run. The display name follows the declared type:
 * {@code "Set a Integer variable"}.
 */
@ActionDefinition(type = "SetVariable", category = "Logic",
                  description = "Assign a value to a variable")
public class SetVariableAction extends AbstractLogicAction implements SyntaxValidator {

    private static final Logger log = LoggerFactory.getLogger(SetVariableAction.class);

    private String       variableName;
    private Object       value;
    private VariableType type = VariableType.OBJECT;

    public SetVariableAction() {
        super(null, "Assign a value to a variable");
    }

    public SetVariableAction(String variableName, Object value, VariableType type) {
        this();
        this.variableName = variableName;
        setValue(value, type);
    }

    public SetVariableAction(String variableName, Object value) {
        this(variableName, value, null);
    }

    @Override
    protected boolean doExecute(ActionContext context) {
        if (variableName == null || variableName.isBlank()) {
            throw new IllegalArgumentException("Variable name cannot be null or blank");
        }
        Environment environment = getEnvironment();
        if (environment == null) {
            return fail("No environment is bound to '" + getName() + "'");
        }

        Object resolved;
        if (value instanceof Expression<?> expression) {
            expression.bindEnvironment(environment);
            try {
                resolved = expression.evaluate();
            } catch (ExpressionException e) {
                return fail("Value of '" + variableName + "' could not be evaluated: " + e.getMessage());
            }
        } else {
            resolved = value;
        }

        if (!type.accepts(resolved)) {
            return fail("Value " + resolved + " is not a " + type.getDisplayName()
                + " for variable '" + variableName + "'");
        }
        environment.set(variableName, resolved, type);
        log.debug("SetVariableAction: {} = {}", variableName, resolved);
        return true;
    }

    /** Derived from the declared type unless a name was set explicitly. */
    @Override
    public String getName() {
        String explicit = super.getName();
        return explicit != null ? explicit : "Set a " + type.getDisplayName() + " variable";
    }

    @Override
    public List<SyntaxError> validate(ValidationContext context) {
        List<SyntaxError> errors = new ArrayList<>();
        if (variableName == null || variableName.isBlank()) {
            errors.add(SyntaxError.critical(this, "VariableName", "Variable name cannot be null or empty"));
        }
        if (value instanceof Expression<?> expression
                && type != VariableType.OBJECT
                && expression.getResultType() != Object.class
                && expression.getResultType() != type.getJavaType()) {
            errors.add(SyntaxError.error(this, "Value",
                "Expression yields " + expression.getResultType().getSimpleName()
                    + " but the variable is declared " + type.getDisplayName()));
        }
        return errors;
    }

    /** True when a name was set explicitly instead of being derived from the type. */
    public boolean hasExplicitName() { return super.getName() != null; }

    public String       getVariableName() { return variableName; }
    public Object       getValue()        { return value; }
    public VariableType getType()         { return type; }

    public void setVariableName(String variableName) { this.variableName = variableName; }

    /**
     * Sets the value and its declared type. A null type is inferred from the value, or
     * from the expression's result type.
     */
    public void setValue(Object value, VariableType type) {
        this.value = value;
        if (type != null) {
            this.type = type;
        } else if (value instanceof Expression<?> expression) {
            this.type = VariableType.of(expression.getResultType());
        } else {
            this.type = VariableType.of(value);
        }
    }
}
