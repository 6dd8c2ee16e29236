package com.testflow.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One node of a persisted action tree.
 *
 * {@code type} is the registered action type name (see
 * {@link com.testflow.action.ActionTypeRegistry}). Scalar settings live in
 * {@code properties} as text; nested sequences live in {@code children} keyed by the
 * sequence name ("then", "else", "body"). A for loop's initialization and increment
 * steps are single nested snapshots.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActionSnapshot {

    private String  type;
    private String  name;
    private String  description;
    private boolean enabled;

    private Map<String, String>               properties = new LinkedHashMap<>();
    private ConditionSnapshot                 condition;
    private Map<String, List<ActionSnapshot>> children   = new LinkedHashMap<>();
    private ActionSnapshot                    initialization;
    private ActionSnapshot                    increment;

    public ActionSnapshot() {
        this.enabled = true;
    }

    public ActionSnapshot(String type) {
        this();
        this.type = type;
    }

    // ── Properties ────────────────────────────────────────────────────────────

    /** Adds a property; null values are not stored. Returns this for chaining. */
    public ActionSnapshot put(String key, Object value) {
        if (value != null) {
            properties.put(key, String.valueOf(value));
        }
        return this;
    }

    public String property(String key) {
        return properties.get(key);
    }

    public String property(String key, String defaultValue) {
        return properties.getOrDefault(key, defaultValue);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String                            getType()           { return type; }
    public String                            getName()           { return name; }
    public String                            getDescription()    { return description; }
    public boolean                           isEnabled()         { return enabled; }
    public Map<String, String>               getProperties()     { return properties; }
    public ConditionSnapshot                 getCondition()      { return condition; }
    public Map<String, List<ActionSnapshot>> getChildren()       { return children; }
    public ActionSnapshot                    getInitialization() { return initialization; }
    public ActionSnapshot                    getIncrement()      { return increment; }

    // ── Setters ───────────────────────────────────────────────────────────────

    public void setType(String type)                      { this.type = type; }
    public void setName(String name)                      { this.name = name; }
    public void setDescription(String description)        { this.description = description; }
    public void setEnabled(boolean enabled)               { this.enabled = enabled; }
    public void setCondition(ConditionSnapshot condition) { this.condition = condition; }
    public void setInitialization(ActionSnapshot initialization) { this.initialization = initialization; }
    public void setIncrement(ActionSnapshot increment)    { this.increment = increment; }

    public void setProperties(Map<String, String> properties) {
        this.properties = properties != null ? properties : new LinkedHashMap<>();
    }

    public void setChildren(Map<String, List<ActionSnapshot>> children) {
        this.children = children != null ? children : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "ActionSnapshot{type='" + type + "', name='" + name + "'}";
    }
}
