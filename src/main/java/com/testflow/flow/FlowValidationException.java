package com.testflow.flow;

/**
 * Thrown before a run starts when the flow has ERROR or CRITICAL validation findings.
 */
public class FlowValidationException extends RuntimeException {

    private final FlowValidationSummary summary;

    public FlowValidationException(String flowName, FlowValidationSummary summary) {
        super("Flow '" + flowName + "' is not valid. " + summary.getSummary());
        this.summary = summary;
    }

    public FlowValidationSummary getSummary() { return summary; }
}
