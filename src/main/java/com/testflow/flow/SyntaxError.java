package com.testflow.flow;

import com.testflow.action.Action;

/**
 * One validation finding. Immutable.
 *
 * {@code action} is null for findings about the flow itself. {@code actionPath} locates the
 * action in the tree, e.g. {@code Flow.actions[2].body[0]}.
 */
public final class SyntaxError {

    private final Action              action;
    private final String              message;
    private final String              propertyName;
    private final SyntaxErrorSeverity severity;
    private final String              actionPath;
    private final String              context;

    public SyntaxError(Action action, String message, String propertyName,
                       SyntaxErrorSeverity severity, String actionPath, String context) {
        this.action       = action;
        this.message      = message;
        this.propertyName = propertyName;
        this.severity     = severity;
        this.actionPath   = actionPath;
        this.context      = context;
    }

    public SyntaxError(Action action, String message, String propertyName, SyntaxErrorSeverity severity) {
        this(action, message, propertyName, severity, null, null);
    }

    public static SyntaxError warning(Action action, String propertyName, String message) {
        return new SyntaxError(action, message, propertyName, SyntaxErrorSeverity.WARNING);
    }

    public static SyntaxError error(Action action, String propertyName, String message) {
        return new SyntaxError(action, message, propertyName, SyntaxErrorSeverity.ERROR);
    }

    public static SyntaxError critical(Action action, String propertyName, String message) {
        return new SyntaxError(action, message, propertyName, SyntaxErrorSeverity.CRITICAL);
    }

    public SyntaxError withActionPath(String path) {
        return new SyntaxError(action, message, propertyName, severity, path, context);
    }

    /** Attaches extra detail, such as the offending value's type. */
    public SyntaxError withContext(String detail) {
        return new SyntaxError(action, message, propertyName, severity, actionPath, detail);
    }

    public Action              getAction()       { return action; }
    public String              getMessage()      { return message; }
    public String              getPropertyName() { return propertyName; }
    public SyntaxErrorSeverity getSeverity()     { return severity; }
    public String              getActionPath()   { return actionPath; }
    public String              getContext()      { return context; }

    @Override
    public String toString() {
        String path     = actionPath == null || actionPath.isEmpty() ? "" : " at " + actionPath;
        String property = propertyName == null || propertyName.isEmpty() ? "" : "." + propertyName;
        return "[" + severity + "]" + path + property + ": " + message;
    }
}
