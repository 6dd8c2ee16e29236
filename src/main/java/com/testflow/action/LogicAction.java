package com.testflow.action;

import com.testflow.model.Environment;

/**
 * An action that reads or writes flow variables. The executor binds the flow's
 * Environment before executing it; composites pass the same reference on to their
 * children, so a write anywhere is visible flow-wide.
 */
public interface LogicAction extends Action {

    void bindEnvironment(Environment environment);

    Environment getEnvironment();
}
