package com.testflow.action.logic;

import com.testflow.action.AbstractLogicAction;
import com.testflow.action.Action;
import com.testflow.action.ActionContext;
import com.testflow.action.ActionDefinition;
import com.testflow.action.CompositeAction;
import com.testflow.action.ConditionSlot;
import com.testflow.action.SyntaxValidator;
import com.testflow.flow.SyntaxError;
import com.testflow.flow.ValidationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the "then" sequence when the condition holds and the "else" sequence otherwise.
 *
 * ## Else-if chains
 * An else-if is itself an {@code IfAction}. The chain is a singly linked list: the else
 * sequence of link <i>i</i> holds exactly link <i>i+1</i>, and the last link's else sequence
 * is the real else. {@link #addElseIf} maintains that shape, so execution needs no special
 * case: a false condition simply runs the else sequence, which may be the next link.
 *
 * <pre>
 *   if (x > 10) {A} else if (x > 5) {B} else {C}
 *
 *   IfAction[x > 10]  then=[A]  else=[IfAction[x > 5]  then=[B]  else=[C]]
 * </pre>
 *
 * The condition is evaluated on every execution and never replaced by its result.
 */
@ActionDefinition(type = "If", category = "Logic",
                  description = "Execute actions in one of two blocks by condition")
public class IfAction extends AbstractLogicAction implements CompositeAction, SyntaxValidator {

    private static final Logger log = LoggerFactory.getLogger(IfAction.class);

    private ConditionSlot condition     = ConditionSlot.absent();
    private final List<Action> thenActions = new ArrayList<>();
    private final List<Action> elseActions = new ArrayList<>();
    private boolean       elseIfLink;

    public IfAction() {
        super("If", "Execute actions in one of two blocks by condition");
    }

    public IfAction(ConditionSlot condition) {
        this();
        setCondition(condition);
    }

    // ── Execution ─────────────────────────────────────────────────────────────

    @Override
    protected boolean doExecute(ActionContext context) {
        Boolean value = evaluateCondition(condition, context);
        if (value == null) {
            return false;
        }
        log.debug("IfAction: '{}' is {}", condition.getText(), value);
        return runSequence(value ? thenActions : elseActions, context, getEnvironment());
    }

    // ── Else-if chain ─────────────────────────────────────────────────────────

    /**
     * Appends an else-if link. The current real else sequence moves to the new link,
     * which becomes the tail of the chain.
     */
    public IfAction addElseIf(IfAction link) {
        IfAction tail = tail();
        link.elseIfLink = true;
        link.elseActions.clear();
        link.elseActions.addAll(tail.elseActions);
        tail.elseActions.clear();
        tail.elseActions.add(link);
        return this;
    }

    /** The else-if links in chain order. */
    public List<IfAction> getElseIfs() {
        List<IfAction> links = new ArrayList<>();
        IfAction current = nextLink();
        while (current != null) {
            links.add(current);
            current = current.nextLink();
        }
        return links;
    }

    /** The real else sequence, held by the last link of the chain. Mutable. */
    public List<Action> getElseActions() {
        return tail().elseActions;
    }

    /** The else sequence of this node alone: the next link, or the real else at the tail. */
    public List<Action> getElseSequence() {
        return elseActions;
    }

    public boolean isElseIfLink() { return elseIfLink; }

    public void setElseIfLink(boolean elseIfLink) { this.elseIfLink = elseIfLink; }

    private IfAction nextLink() {
        if (elseActions.size() == 1 && elseActions.get(0) instanceof IfAction next && next.elseIfLink) {
            return next;
        }
        return null;
    }

    private IfAction tail() {
        IfAction current = this;
        IfAction next;
        while ((next = current.nextLink()) != null) {
            current = next;
        }
        return current;
    }

    // ── Structure ─────────────────────────────────────────────────────────────

    @Override
    public Map<String, List<Action>> getChildSequences() {
        Map<String, List<Action>> sequences = new LinkedHashMap<>();
        sequences.put("then", thenActions);
        sequences.put("else", elseActions);
        return sequences;
    }

    @Override
    public List<SyntaxError> validate(ValidationContext context) {
        List<SyntaxError> errors = new ArrayList<>();
        switch (condition.getKind()) {
            case ABSENT -> errors.add(SyntaxError.critical(this, "Condition",
                "If condition cannot be null"));
            case UNSUPPORTED -> errors.add(SyntaxError.critical(this, "Condition",
                "If condition must be a boolean value or boolean expression")
                .withContext(condition.getText()));
            default -> { }
        }
        if (thenActions.isEmpty() && elseActions.isEmpty()) {
            errors.add(SyntaxError.warning(this, "Then", "If action has no actions in either block"));
        }
        return errors;
    }

    public ConditionSlot getCondition()  { return condition; }
    public List<Action>  getThenActions() { return thenActions; }

    public void setCondition(ConditionSlot condition) {
        this.condition = condition != null ? condition : ConditionSlot.absent();
    }
}
