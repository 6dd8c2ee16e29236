package com.testflow.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The variable namespace of one flow.
 *
 * Iteration order is declaration order and names are unique: assigning an existing
 * name overwrites that variable's value in place (last write wins) without moving it.
 *
 * One Environment belongs to exactly one Flow. Actions borrow the reference for the
 * duration of a run, so mutations are visible flow-wide. There is no internal locking;
 * a flow runs on a single logical thread and two flows never share an instance.
 */
public class Environment {

    private final Map<String, Variable> variables = new LinkedHashMap<>();

    /** Returns the variable with the given name, if declared. */
    public Optional<Variable> find(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    /** Returns the value of the named variable, or empty when it is not declared. */
    public Optional<Object> valueOf(String name) {
        Variable v = variables.get(name);
        return v != null ? Optional.ofNullable(v.getValue()) : Optional.empty();
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    /**
     * Overwrites the value (and declared type) of an existing variable, or declares a
     * new one at the end of the declaration order.
     *
     * @return the variable now holding the value
     */
    public Variable set(String name, Object value, VariableType type) {
        Variable existing = variables.get(name);
        if (existing != null) {
            existing.setValue(value);
            existing.setType(type != null ? type : VariableType.of(value));
            return existing;
        }
        Variable created = new Variable(name, value, type);
        variables.put(name, created);
        return created;
    }

    public Variable set(String name, Object value) {
        return set(name, value, VariableType.of(value));
    }

    /** Adds a pre-built variable; an existing variable of the same name is replaced in place. */
    public void declare(Variable variable) {
        variables.put(variable.getName(), variable);
    }

    public boolean remove(String name) {
        return variables.remove(name) != null;
    }

    public void clear() {
        variables.clear();
    }

    public int size() {
        return variables.size();
    }

    /** Snapshot of the variables in declaration order. */
    public List<Variable> getVariables() {
        return Collections.unmodifiableList(new ArrayList<>(variables.values()));
    }

    @Override
    public String toString() {
        return "Environment" + variables.values();
    }
}
