package com.testflow.model;

import java.util.Objects;

/**
 * A named, typed value held by an {@link Environment}.
 *
 * Variables are mutated in place on re-assignment; they have no lifecycle of
 * their own outside the Environment that owns them.
 */
public class Variable {

    private final String name;
    private Object       value;
    private VariableType type;

    public Variable(String name, Object value, VariableType type) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name cannot be null or blank");
        }
        this.name  = name;
        this.value = value;
        this.type  = type != null ? type : VariableType.of(value);
    }

    public Variable(String name, Object value) {
        this(name, value, VariableType.of(value));
    }

    public String       getName()  { return name; }
    public Object       getValue() { return value; }
    public VariableType getType()  { return type; }

    public void setValue(Object value)     { this.value = value; }
    public void setType(VariableType type) { this.type = Objects.requireNonNull(type, "type"); }

    @Override
    public String toString() {
        return String.format("Variable{name='%s', type=%s, value=%s}", name, type, value);
    }
}
