package com.testflow.action.system;

import com.testflow.action.AbstractAction;
import com.testflow.action.ActionContext;
import com.testflow.action.ActionDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Placeholder for an action type that is planned but not built yet. It has no side
 * effects and succeeds, so flows drafted with it still run end to end.
 */
@ActionDefinition(type = "NotImplemented", category = "System",
                  description = "This action is not yet implemented")
public class NotImplementedAction extends AbstractAction {

    private static final Logger log = LoggerFactory.getLogger(NotImplementedAction.class);

    private String plannedActionName = "";

    public NotImplementedAction() {
        super("Not Implemented", "This action is not yet implemented");
    }

    public NotImplementedAction(String plannedActionName) {
        this();
        setPlannedActionName(plannedActionName);
    }

    @Override
    protected boolean doExecute(ActionContext context) {
        log.warn("NotImplementedAction: '{}' is a placeholder and was not performed", plannedActionName);
        return true;
    }

    public String getPlannedActionName() { return plannedActionName; }

    public void setPlannedActionName(String plannedActionName) {
        this.plannedActionName = plannedActionName != null ? plannedActionName : "";
    }
}
