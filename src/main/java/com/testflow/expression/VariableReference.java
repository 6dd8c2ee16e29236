package com.testflow.expression;

import com.testflow.model.Environment;

/**
 * An operand naming a variable. It is resolved against the bound Environment every
 * time it is evaluated, so {@code i < 3} sees the current value of {@code i} on each
 * loop iteration.
 *
 * When no Environment is bound or the name is not declared, the reference evaluates
 * to its own name; comparing that placeholder text against a number then fails with
 * a type mismatch rather than silently succeeding.
 */
public class VariableReference extends Expression<Object> {

    private final String name;
    private Environment  environment;

    public VariableReference(String name) {
        super(Object.class);
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable reference name cannot be blank");
        }
        this.name = name;
    }

    public String getName() { return name; }

    @Override
    public void bindEnvironment(Environment environment) {
        this.environment = environment;
    }

    /** True when a bound Environment declares this name. */
    public boolean isResolvable() {
        return environment != null && environment.contains(name);
    }

    @Override
    protected Object doEvaluate() {
        if (environment == null) return name;
        return environment.find(name)
            .map(v -> v.getValue() != null ? v.getValue() : (Object) name)
            .orElse(name);
    }

    @Override
    public String toSourceText() {
        return name;
    }
}
