package com.testflow.persistence;

import com.testflow.action.AbstractAction;
import com.testflow.action.Action;
import com.testflow.action.ActionTypeRegistry;
import com.testflow.action.ConditionSlot;
import com.testflow.action.RetryableAction;
import com.testflow.action.StepSlot;
import com.testflow.action.logic.ForLoopAction;
import com.testflow.action.logic.IfAction;
import com.testflow.action.logic.SetVariableAction;
import com.testflow.action.logic.WhileLoopAction;
import com.testflow.action.system.LaunchProcessAction;
import com.testflow.action.system.LogAction;
import com.testflow.action.system.NotImplementedAction;
import com.testflow.action.ui.AbstractElementAction;
import com.testflow.action.ui.ClickElementAction;
import com.testflow.action.ui.IfWindowContainsTextAction;
import com.testflow.action.ui.SetTextAction;
import com.testflow.action.ui.WaitForElementAction;
import com.testflow.expression.ElementExistsExpression;
import com.testflow.expression.Expression;
import com.testflow.expression.ExpressionParser;
import com.testflow.expression.VariableReference;
import com.testflow.flow.Flow;
import com.testflow.locator.ElementLocator;
import com.testflow.locator.IdentifierKind;
import com.testflow.model.Environment;
import com.testflow.model.Variable;
import com.testflow.model.VariableType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts a {@link Flow} to a {@link FlowSnapshot} and back.
 *
 * ## Conditions and values
 * Expressions are stored as source text and re-parsed on load, so only what
 * {@link ExpressionParser} can read survives a round trip. Element-exists conditions are
 * stored by their search parameters and rebuilt against the locator given to this
 * mapper; restoring one without a locator is an error.
 *
 * ## Restored flows
 * Every action comes back in READY, and the flow itself in READY with no current
 * action, whatever state the saved flow was in.
 *
 * @throws IllegalArgumentException from {@link #toSnapshot} for an action whose class is
 *         not registered
 * @throws IllegalStateException from {@link #fromSnapshot} for a snapshot that cannot be
 *         restored (unknown type, malformed value, unparseable expression)
 */
public class FlowSnapshotMapper {

    private static final Logger log = LoggerFactory.getLogger(FlowSnapshotMapper.class);

    private final ActionTypeRegistry registry;
    private final ElementLocator<?>  locator;   // null when no UI is attached

    public FlowSnapshotMapper(ActionTypeRegistry registry, ElementLocator<?> locator) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.locator  = locator;
    }

    public FlowSnapshotMapper(ActionTypeRegistry registry) {
        this(registry, null);
    }

    // ── Flow → snapshot ───────────────────────────────────────────────────────

    public FlowSnapshot toSnapshot(Flow flow) {
        FlowSnapshot snapshot = new FlowSnapshot();
        snapshot.setId(flow.getId());
        snapshot.setName(flow.getName());
        snapshot.setDescription(flow.getDescription());
        snapshot.setEnabled(flow.isEnabled());
        snapshot.setSavedAt(Instant.now());

        for (Variable variable : flow.getEnvironment().getVariables()) {
            Object value = variable.getValue();
            snapshot.getVariables().add(new VariableSnapshot(
                variable.getName(), variable.getType(), value != null ? String.valueOf(value) : null));
        }
        for (Action action : flow.getActions()) {
            snapshot.getActions().add(toSnapshot(action));
        }
        return snapshot;
    }

    ActionSnapshot toSnapshot(Action action) {
        String type = registry.typeOf(action).orElseThrow(() -> new IllegalArgumentException(
            "Action class " + action.getClass().getName() + " is not a registered action type"));

        ActionSnapshot snapshot = new ActionSnapshot(type);
        snapshot.setName(action instanceof SetVariableAction sv && !sv.hasExplicitName() ? null : action.getName());
        snapshot.setDescription(action.getDescription());
        snapshot.setEnabled(action.isEnabled());

        if (action instanceof IfAction ifAction) {
            snapshot.setCondition(toSnapshot(ifAction.getCondition()));
            snapshot.put("elseIfLink", ifAction.isElseIfLink() ? Boolean.TRUE : null);
            snapshot.getChildren().put("then", toSnapshots(ifAction.getThenActions()));
            snapshot.getChildren().put("else", toSnapshots(ifAction.getElseSequence()));
        } else if (action instanceof WhileLoopAction whileLoop) {
            snapshot.setCondition(toSnapshot(whileLoop.getCondition()));
            snapshot.getChildren().put("body", toSnapshots(whileLoop.getBody()));
        } else if (action instanceof ForLoopAction forLoop) {
            snapshot.setCondition(toSnapshot(forLoop.getCondition()));
            snapshot.setInitialization(stepSnapshot(forLoop.getInitialization(), "initialization", snapshot));
            snapshot.setIncrement(stepSnapshot(forLoop.getIncrement(), "increment", snapshot));
            snapshot.getChildren().put("body", toSnapshots(forLoop.getBody()));
        } else if (action instanceof SetVariableAction setVariable) {
            writeSetVariable(setVariable, snapshot);
        } else if (action instanceof LogAction logAction) {
            snapshot.put("level", logAction.getLevel()).put("message", logAction.getMessage());
        } else if (action instanceof NotImplementedAction placeholder) {
            snapshot.put("plannedActionName", placeholder.getPlannedActionName());
        } else if (action instanceof LaunchProcessAction launch) {
            snapshot.put("executablePath", launch.getExecutablePath())
                .put("arguments", launch.getArguments())
                .put("workingDirectory", launch.getWorkingDirectory())
                .put("waitForCompletion", launch.isWaitForCompletion())
                .put("timeoutMillis", launch.getTimeoutMillis());
        } else if (action instanceof AbstractElementAction element) {
            writeElementAction(element, snapshot);
        }
        return snapshot;
    }

    private List<ActionSnapshot> toSnapshots(List<Action> actions) {
        List<ActionSnapshot> snapshots = new ArrayList<>();
        for (Action action : actions) {
            snapshots.add(toSnapshot(action));
        }
        return snapshots;
    }

    private ActionSnapshot stepSnapshot(StepSlot step, String label, ActionSnapshot owner) {
        return switch (step.getKind()) {
            case ACTION_REF  -> toSnapshot(step.getAction());
            case ABSENT      -> null;
            case UNSUPPORTED -> {
                owner.put(label + "Unsupported", step.getDescription());
                yield null;
            }
        };
    }

    private ConditionSnapshot toSnapshot(ConditionSlot condition) {
        return switch (condition.getKind()) {
            case ABSENT          -> null;
            case BOOLEAN_LITERAL -> new ConditionSnapshot(ConditionSnapshot.Kind.LITERAL,
                                        String.valueOf(condition.getLiteral()));
            case UNSUPPORTED     -> new ConditionSnapshot(ConditionSnapshot.Kind.UNSUPPORTED, condition.getText());
            case BOOLEAN_EXPRESSION -> {
                if (condition.getExpression() instanceof ElementExistsExpression<?> exists) {
                    yield ConditionSnapshot.elementExists(exists.getIdentifierKind(), exists.getIdentifier(),
                        exists.getRetryTimes(), exists.getTimeoutMillis());
                }
                yield new ConditionSnapshot(ConditionSnapshot.Kind.EXPRESSION, condition.getText());
            }
        };
    }

    private void writeSetVariable(SetVariableAction action, ActionSnapshot snapshot) {
        snapshot.put("variableName", action.getVariableName()).put("valueType", action.getType());
        Object value = action.getValue();
        if (value instanceof VariableReference reference) {
            snapshot.put("variableRef", reference.getName());
        } else if (value instanceof Expression<?> expression) {
            snapshot.put("expression", expression.getRawText());
        } else {
            snapshot.put("value", value);
        }
    }

    private void writeElementAction(AbstractElementAction action, ActionSnapshot snapshot) {
        snapshot.put("identifierKind", action.getIdentifierKind())
            .put("elementIdentifier", action.getElementIdentifier());
        if (action instanceof RetryableAction retryable) {
            snapshot.put("retryTimes", retryable.getRetryTimes())
                .put("retryDelayMillis", retryable.getRetryDelayMillis());
        }
        if (action instanceof ClickElementAction click) {
            snapshot.put("doubleClick", click.isDoubleClick()).put("useInvoke", click.isUseInvoke());
        } else if (action instanceof SetTextAction setText) {
            snapshot.put("text", setText.getText()).put("clearExistingText", setText.isClearExistingText());
        } else if (action instanceof WaitForElementAction wait) {
            snapshot.put("timeoutMillis", wait.getTimeoutMillis())
                .put("pollingIntervalMillis", wait.getPollingIntervalMillis());
        } else if (action instanceof IfWindowContainsTextAction windowText) {
            snapshot.put("searchText", windowText.getSearchText())
                .put("caseSensitive", windowText.isCaseSensitive())
                .put("deepSearch", windowText.isDeepSearch());
        }
    }

    // ── Snapshot → flow ───────────────────────────────────────────────────────

    public Flow fromSnapshot(FlowSnapshot snapshot) {
        if (snapshot.getId() == null || snapshot.getId().isBlank()) {
            throw new IllegalStateException("Flow snapshot has no id");
        }
        Environment environment = new Environment();
        for (VariableSnapshot variable : snapshot.getVariables()) {
            VariableType type = variable.getType() != null ? variable.getType() : VariableType.OBJECT;
            environment.declare(new Variable(variable.getName(), parse(type, variable.getValue(), variable.getName()), type));
        }

        Flow flow = new Flow(snapshot.getId(), snapshot.getName(), environment);
        flow.setDescription(snapshot.getDescription());
        flow.setEnabled(snapshot.isEnabled());
        for (ActionSnapshot action : snapshot.getActions()) {
            flow.add(fromSnapshot(action));
        }
        log.debug("FlowSnapshotMapper: restored flow '{}' ({} action(s), {} variable(s))",
            flow.getName(), flow.getActions().size(), environment.size());
        return flow;
    }

    Action fromSnapshot(ActionSnapshot snapshot) {
        Action action = registry.create(snapshot.getType()).orElseThrow(() -> new IllegalStateException(
            "Unknown action type '" + snapshot.getType() + "' in flow snapshot"));

        if (action instanceof AbstractAction base) {
            if (snapshot.getName() != null) base.setName(snapshot.getName());
            if (snapshot.getDescription() != null) base.setDescription(snapshot.getDescription());
            base.setEnabled(snapshot.isEnabled());
        }

        if (action instanceof IfAction ifAction) {
            ifAction.setCondition(fromSnapshot(snapshot.getCondition()));
            ifAction.setElseIfLink(bool(snapshot, "elseIfLink", false));
            ifAction.getThenActions().addAll(children(snapshot, "then"));
            ifAction.getElseSequence().addAll(children(snapshot, "else"));
        } else if (action instanceof WhileLoopAction whileLoop) {
            whileLoop.setCondition(fromSnapshot(snapshot.getCondition()));
            whileLoop.getBody().addAll(children(snapshot, "body"));
        } else if (action instanceof ForLoopAction forLoop) {
            forLoop.setCondition(fromSnapshot(snapshot.getCondition()));
            forLoop.setInitialization(step(snapshot.getInitialization(), snapshot.property("initializationUnsupported")));
            forLoop.setIncrement(step(snapshot.getIncrement(), snapshot.property("incrementUnsupported")));
            forLoop.getBody().addAll(children(snapshot, "body"));
        } else if (action instanceof SetVariableAction setVariable) {
            readSetVariable(setVariable, snapshot);
        } else if (action instanceof LogAction logAction) {
            logAction.setLevel(level(snapshot.property("level")));
            logAction.setMessage(snapshot.property("message"));
        } else if (action instanceof NotImplementedAction placeholder) {
            placeholder.setPlannedActionName(snapshot.property("plannedActionName"));
        } else if (action instanceof LaunchProcessAction launch) {
            launch.setExecutablePath(snapshot.property("executablePath"));
            launch.setArguments(snapshot.property("arguments"));
            launch.setWorkingDirectory(snapshot.property("workingDirectory"));
            launch.setWaitForCompletion(bool(snapshot, "waitForCompletion", false));
            launch.setTimeoutMillis(number(snapshot, "timeoutMillis", LaunchProcessAction.DEFAULT_TIMEOUT_MILLIS));
        } else if (action instanceof AbstractElementAction element) {
            readElementAction(element, snapshot);
        }
        return action;
    }

    private List<Action> children(ActionSnapshot snapshot, String sequence) {
        List<Action> actions = new ArrayList<>();
        List<ActionSnapshot> children = snapshot.getChildren().get(sequence);
        if (children != null) {
            for (ActionSnapshot child : children) {
                actions.add(fromSnapshot(child));
            }
        }
        return actions;
    }

    private StepSlot step(ActionSnapshot snapshot, String unsupported) {
        if (snapshot != null) return StepSlot.action(fromSnapshot(snapshot));
        if (unsupported != null) return StepSlot.unsupported(unsupported);
        return StepSlot.absent();
    }

    private ConditionSlot fromSnapshot(ConditionSnapshot snapshot) {
        if (snapshot == null || snapshot.getKind() == null) {
            return ConditionSlot.absent();
        }
        return switch (snapshot.getKind()) {
            case LITERAL        -> ConditionSlot.literal(Boolean.parseBoolean(snapshot.getText()));
            case EXPRESSION     -> ConditionSlot.parse(snapshot.getText());
            case UNSUPPORTED    -> ConditionSlot.unsupported(snapshot.getText());
            case ELEMENT_EXISTS -> ConditionSlot.expression(elementExists(snapshot));
        };
    }

    private Expression<Boolean> elementExists(ConditionSnapshot snapshot) {
        if (locator == null) {
            throw new IllegalStateException("Cannot restore the element-exists condition on '"
                + snapshot.getIdentifier() + "': no element locator is configured");
        }
        return exists(locator, snapshot);
    }

    private static <N> ElementExistsExpression<N> exists(ElementLocator<N> locator, ConditionSnapshot snapshot) {
        return ElementExistsExpression.of(locator,
            snapshot.getIdentifierKind() != null ? snapshot.getIdentifierKind() : IdentifierKind.PATH,
            snapshot.getIdentifier(),
            snapshot.getRetryTimes() != null ? snapshot.getRetryTimes() : ElementExistsExpression.DEFAULT_RETRY_TIMES,
            snapshot.getTimeoutMillis() != null ? snapshot.getTimeoutMillis() : ElementExistsExpression.DEFAULT_TIMEOUT_MILLIS);
    }

    private void readSetVariable(SetVariableAction action, ActionSnapshot snapshot) {
        String name = snapshot.property("variableName");
        VariableType type = enumValue(VariableType.class, snapshot.property("valueType"), VariableType.OBJECT);
        action.setVariableName(name);

        String reference  = snapshot.property("variableRef");
        String expression = snapshot.property("expression");
        if (reference != null) {
            action.setValue(new VariableReference(reference), type);
        } else if (expression != null) {
            action.setValue(expression(expression, type), type);
        } else {
            action.setValue(parse(type, snapshot.property("value"), name), type);
        }
    }

    private Expression<?> expression(String text, VariableType type) {
        Optional<? extends Expression<?>> expression = switch (type) {
            case INTEGER, LONG, DOUBLE, FLOAT ->
                ExpressionParser.parseArithmetic(text, type.getJavaType().asSubclass(Number.class));
            case BOOLEAN -> ExpressionParser.parse(text);
            default -> Optional.empty();
        };
        return expression.orElseThrow(() -> new IllegalStateException(
            "Cannot restore " + type.getDisplayName() + " expression '" + text + "'"));
    }

    private void readElementAction(AbstractElementAction action, ActionSnapshot snapshot) {
        action.setIdentifierKind(enumValue(IdentifierKind.class, snapshot.property("identifierKind"), IdentifierKind.PATH));
        action.setElementIdentifier(snapshot.property("elementIdentifier"));
        if (action instanceof RetryableAction retryable) {
            retryable.setRetryTimes((int) number(snapshot, "retryTimes", retryable.getRetryTimes()));
            retryable.setRetryDelayMillis(number(snapshot, "retryDelayMillis", retryable.getRetryDelayMillis()));
        }
        if (action instanceof ClickElementAction click) {
            click.setDoubleClick(bool(snapshot, "doubleClick", false));
            click.setUseInvoke(bool(snapshot, "useInvoke", false));
        } else if (action instanceof SetTextAction setText) {
            setText.setText(snapshot.property("text"));
            setText.setClearExistingText(bool(snapshot, "clearExistingText", true));
        } else if (action instanceof WaitForElementAction wait) {
            wait.setTimeoutMillis(number(snapshot, "timeoutMillis", wait.getTimeoutMillis()));
            wait.setPollingIntervalMillis(number(snapshot, "pollingIntervalMillis", wait.getPollingIntervalMillis()));
        } else if (action instanceof IfWindowContainsTextAction windowText) {
            windowText.setSearchText(snapshot.property("searchText"));
            windowText.setCaseSensitive(bool(snapshot, "caseSensitive", false));
            windowText.setDeepSearch(bool(snapshot, "deepSearch", true));
        }
    }

    // ── Text helpers ──────────────────────────────────────────────────────────

    private static Object parse(VariableType type, String text, String owner) {
        try {
            return type.parse(text);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid value for '" + owner + "': " + e.getMessage(), e);
        }
    }

    private static boolean bool(ActionSnapshot snapshot, String key, boolean defaultValue) {
        String text = snapshot.property(key);
        return text != null ? Boolean.parseBoolean(text) : defaultValue;
    }

    private static long number(ActionSnapshot snapshot, String key, long defaultValue) {
        String text = snapshot.property(key);
        if (text == null) return defaultValue;
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Property '" + key + "' of " + snapshot + " is not a number: " + text, e);
        }
    }

    private static Level level(String text) {
        return text != null ? enumValue(Level.class, text, Level.INFO) : Level.INFO;
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String text, E defaultValue) {
        if (text == null) return defaultValue;
        try {
            return Enum.valueOf(type, text.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("'" + text + "' is not a " + type.getSimpleName(), e);
        }
    }
}
