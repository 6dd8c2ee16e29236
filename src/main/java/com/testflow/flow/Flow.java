package com.testflow.flow;

import com.testflow.action.Action;
import com.testflow.model.ActionState;
import com.testflow.model.Environment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A top-level ordered sequence of actions with its own Environment and run state.
 *
 * The Environment is created with the flow and owned by it exclusively; actions only
 * borrow it during a run. The state and the current-action pointer are changed by
 * {@link FlowExecutor} only. After a failure the pointer stays on the failed action;
 * after a pause it stays on the action to resume from.
 */
public class Flow {

    private final String       id;
    private String             name;
    private String             description = "";
    private boolean            enabled     = true;
    private final List<Action> actions     = new ArrayList<>();
    private final Environment  environment;

    private volatile ActionState state = ActionState.READY;
    private volatile Action      currentAction;
    private final AtomicBoolean  running = new AtomicBoolean();

    public Flow(String id, String name, Environment environment) {
        this.id          = Objects.requireNonNull(id, "id");
        this.name        = name;
        this.environment = environment != null ? environment : new Environment();
    }

    public Flow(String name) {
        this(UUID.randomUUID().toString(), name, new Environment());
    }

    /** Appends an action; returns this for chaining. */
    public Flow add(Action action) {
        actions.add(action);
        return this;
    }

    public String       getId()            { return id; }
    public String       getName()          { return name; }
    public String       getDescription()   { return description; }
    public boolean      isEnabled()        { return enabled; }
    public List<Action> getActions()       { return actions; }
    public Environment  getEnvironment()   { return environment; }
    public ActionState  getState()         { return state; }
    public Action       getCurrentAction() { return currentAction; }

    /** True while a run of this flow is in flight. */
    public boolean isRunning() { return running.get(); }

    public void setName(String name)               { this.name = name; }
    public void setDescription(String description) { this.description = description != null ? description : ""; }
    public void setEnabled(boolean enabled)        { this.enabled = enabled; }

    // ── Executor-owned state ──────────────────────────────────────────────────

    void setState(ActionState state)          { this.state = state; }
    void setCurrentAction(Action action)      { this.currentAction = action; }

    boolean tryBeginRun() { return running.compareAndSet(false, true); }
    void    endRun()      { running.set(false); }

    @Override
    public String toString() {
        return "Flow{id='" + id + "', name='" + name + "', state=" + state
            + ", actions=" + actions.size() + "}";
    }
}
