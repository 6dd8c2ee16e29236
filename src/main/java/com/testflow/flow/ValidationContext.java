package com.testflow.flow;

import com.testflow.action.Action;
import com.testflow.model.Environment;

/**
 * Where in the tree validation currently is. Immutable; {@link #child} derives the
 * context for a nested action.
 */
public final class ValidationContext {

    private final String            path;
    private final Environment       environment;
    private final Action            parent;
    private final ValidationOptions options;

    public ValidationContext(String path, Environment environment, Action parent, ValidationOptions options) {
        this.path        = path;
        this.environment = environment;
        this.parent      = parent;
        this.options     = options != null ? options : ValidationOptions.defaults();
    }

    public ValidationContext child(String segment, Action parent) {
        return new ValidationContext(path + "." + segment, environment, parent, options);
    }

    public String            getPath()        { return path; }
    public Environment       getEnvironment() { return environment; }
    public Action            getParent()      { return parent; }
    public ValidationOptions getOptions()     { return options; }
}
