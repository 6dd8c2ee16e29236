package com.testflow.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Serialization-neutral image of a {@link com.testflow.flow.Flow}: its identity, its
 * Environment as typed text values and its action tree.
 *
 * Run state is not part of the snapshot. A flow restored from one starts in READY with
 * no current action.
 *
 * ## Storage
 * {@link JsonFlowRepository} writes one snapshot per file. Hand-editable; unknown
 * properties are ignored on load.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowSnapshot {

    // ── Identity ──────────────────────────────────────────────────────────────
    private String  id;
    private String  name;
    private String  description;
    private boolean enabled;

    // ── Content ───────────────────────────────────────────────────────────────
    private List<VariableSnapshot> variables = new ArrayList<>();
    private List<ActionSnapshot>   actions   = new ArrayList<>();

    // ── Metadata ──────────────────────────────────────────────────────────────
    private Instant savedAt;

    public FlowSnapshot() {
        this.enabled = true;
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String                 getId()          { return id; }
    public String                 getName()        { return name; }
    public String                 getDescription() { return description; }
    public boolean                isEnabled()      { return enabled; }
    public List<VariableSnapshot> getVariables()   { return variables; }
    public List<ActionSnapshot>   getActions()     { return actions; }
    public Instant                getSavedAt()     { return savedAt; }

    // ── Setters ───────────────────────────────────────────────────────────────

    public void setId(String id)                              { this.id = id; }
    public void setName(String name)                          { this.name = name; }
    public void setDescription(String description)            { this.description = description; }
    public void setEnabled(boolean enabled)                   { this.enabled = enabled; }
    public void setVariables(List<VariableSnapshot> variables) { this.variables = variables != null ? variables : new ArrayList<>(); }
    public void setActions(List<ActionSnapshot> actions)      { this.actions = actions != null ? actions : new ArrayList<>(); }
    public void setSavedAt(Instant savedAt)                   { this.savedAt = savedAt; }

    @Override
    public String toString() {
        return "FlowSnapshot{id='" + id + "', name='" + name + "', actions=" + actions.size() + "}";
    }
}
