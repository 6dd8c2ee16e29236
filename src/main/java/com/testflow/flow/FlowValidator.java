package com.testflow.flow;

import com.testflow.action.Action;
import com.testflow.action.CompositeAction;
import com.testflow.action.SyntaxValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks a flow for configuration errors before it runs.
 *
 * ## Rules
 *   - Flow: blank name and an empty action list are WARNINGs.
 *   - A null action is CRITICAL.
 *   - Actions implementing {@link SyntaxValidator} validate themselves; any other action
 *     gets the default check (blank name is a WARNING).
 *   - Nested sequences are validated recursively when
 *     {@link ValidationOptions#validateNested()} is set, down to
 *     {@link ValidationOptions#maxDepth()}; deeper actions produce a single WARNING.
 *
 * Every finding carries the path of the action it concerns, e.g.
 * {@code Flow.actions[0].body[2]}.
 */
public class FlowValidator {

    private static final Logger log = LoggerFactory.getLogger(FlowValidator.class);

    public FlowValidationSummary validate(Flow flow) {
        return validate(flow, ValidationOptions.defaults());
    }

    public FlowValidationSummary validate(Flow flow, ValidationOptions options) {
        ValidationOptions effective = options != null ? options : ValidationOptions.defaults();
        List<SyntaxError> findings = new ArrayList<>();

        if (flow == null) {
            findings.add(new SyntaxError(null, "Flow cannot be null", null, SyntaxErrorSeverity.CRITICAL));
            return new FlowValidationSummary(findings);
        }

        ValidationContext context = new ValidationContext("Flow", flow.getEnvironment(), null, effective);

        if (flow.getName() == null || flow.getName().isBlank()) {
            findings.add(SyntaxError.warning(null, "Name", "Flow name cannot be null or empty")
                .withActionPath(context.getPath()));
        }
        if (flow.getActions().isEmpty()) {
            findings.add(SyntaxError.warning(null, "Actions", "Flow contains no actions")
                .withActionPath(context.getPath()));
        }

        List<Action> actions = flow.getActions();
        for (int i = 0; i < actions.size(); i++) {
            findings.addAll(validateAction(actions.get(i), context.child("actions[" + i + "]", null), 0));
        }

        if (!effective.includeWarnings()) {
            findings.removeIf(e -> e.getSeverity() == SyntaxErrorSeverity.WARNING);
        }

        FlowValidationSummary summary = new FlowValidationSummary(findings);
        log.info("FlowValidator: '{}' - {}", flow.getName(), summary.getSummary());
        return summary;
    }

    /** Validates one action and, when enabled, its descendants. */
    public List<SyntaxError> validateAction(Action action, ValidationContext context, int depth) {
        List<SyntaxError> findings = new ArrayList<>();
        String path = context.getPath();

        if (action == null) {
            findings.add(new SyntaxError(null, "Action cannot be null", null, SyntaxErrorSeverity.CRITICAL, path, null));
            return findings;
        }
        if (depth > context.getOptions().maxDepth()) {
            findings.add(SyntaxError.warning(action, null,
                "Maximum validation depth (" + context.getOptions().maxDepth() + ") exceeded")
                .withActionPath(path));
            return findings;
        }

        if (action instanceof SyntaxValidator validator) {
            for (SyntaxError error : validator.validate(context)) {
                findings.add(error.withActionPath(path));
            }
        } else if (action.getName() == null || action.getName().isBlank()) {
            findings.add(SyntaxError.warning(action, "Name", "Action name cannot be null or empty")
                .withActionPath(path));
        }

        if (context.getOptions().validateNested() && action instanceof CompositeAction composite) {
            for (Map.Entry<String, List<Action>> sequence : composite.getChildSequences().entrySet()) {
                List<Action> children = sequence.getValue();
                for (int i = 0; i < children.size(); i++) {
                    ValidationContext child = context.child(sequence.getKey() + "[" + i + "]", action);
                    findings.addAll(validateAction(children.get(i), child, depth + 1));
                }
            }
        }
        return findings;
    }
}
