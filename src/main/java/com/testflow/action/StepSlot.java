package com.testflow.action;

/**
 * The initialization or increment step of a for loop.
 *
 *   ACTION_REF   a nested action to execute
 *   ABSENT       no step configured
 *   UNSUPPORTED  a configured value that is not an action; kept so validation can report it
 */
public final class StepSlot {

    public enum Kind {
        ACTION_REF,
        ABSENT,
        UNSUPPORTED
    }

    private static final StepSlot ABSENT = new StepSlot(Kind.ABSENT, null, null);

    private final Kind   kind;
    private final Action action;
    private final String description;

    private StepSlot(Kind kind, Action action, String description) {
        this.kind        = kind;
        this.action      = action;
        this.description = description;
    }

    public static StepSlot action(Action action) {
        return action != null ? new StepSlot(Kind.ACTION_REF, action, null) : ABSENT;
    }

    public static StepSlot absent() {
        return ABSENT;
    }

    public static StepSlot unsupported(String description) {
        return new StepSlot(Kind.UNSUPPORTED, null, description);
    }

    /** Classifies an arbitrary value: an Action, null, or anything else (UNSUPPORTED). */
    public static StepSlot of(Object value) {
        if (value == null) return ABSENT;
        if (value instanceof Action a) return action(a);
        return unsupported(value.getClass().getSimpleName() + " is not an action");
    }

    public Kind   getKind()        { return kind; }
    public Action getAction()      { return action; }
    public String getDescription() { return description; }

    public boolean isAction() { return kind == Kind.ACTION_REF; }

    @Override
    public String toString() {
        return switch (kind) {
            case ACTION_REF  -> "StepSlot{" + action.getName() + "}";
            case ABSENT      -> "StepSlot{ABSENT}";
            case UNSUPPORTED -> "StepSlot{UNSUPPORTED, '" + description + "'}";
        };
    }
}
