package com.testflow.flow;

/**
 * Severity of a validation finding. A flow with any ERROR or CRITICAL finding is invalid;
 * WARNINGs are advisory.
 */
public enum SyntaxErrorSeverity {
    WARNING,
    ERROR,
    CRITICAL;

    public boolean isAtLeast(SyntaxErrorSeverity other) {
        return compareTo(other) >= 0;
    }
}
