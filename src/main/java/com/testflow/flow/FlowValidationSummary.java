package com.testflow.flow;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Counts and verdict over a list of validation findings.
 */
public final class FlowValidationSummary {

    private final List<SyntaxError> all;
    private final int               critical;
    private final int               errors;
    private final int               warnings;

    public FlowValidationSummary(List<SyntaxError> findings) {
        this.all      = List.copyOf(findings);
        this.critical = count(SyntaxErrorSeverity.CRITICAL);
        this.errors   = count(SyntaxErrorSeverity.ERROR);
        this.warnings = count(SyntaxErrorSeverity.WARNING);
    }

    private int count(SyntaxErrorSeverity severity) {
        return (int) all.stream().filter(e -> e.getSeverity() == severity).count();
    }

    public List<SyntaxError> getAll()            { return all; }
    public int               getTotal()          { return all.size(); }
    public int               getCriticalErrors() { return critical; }
    public int               getErrors()         { return errors; }
    public int               getWarnings()       { return warnings; }

    /** True when there is no ERROR or CRITICAL finding. */
    public boolean isValid() {
        return critical == 0 && errors == 0;
    }

    public String getSummary() {
        return "Validation: " + (isValid() ? "PASSED" : "FAILED")
            + " - Critical: " + critical + ", Errors: " + errors + ", Warnings: " + warnings;
    }

    public String getDetailedReport() {
        if (all.isEmpty()) {
            return "No syntax errors found.";
        }
        return getSummary() + System.lineSeparator()
            + all.stream().map(SyntaxError::toString)
                 .collect(Collectors.joining(System.lineSeparator()));
    }

    @Override
    public String toString() {
        return getSummary();
    }
}
