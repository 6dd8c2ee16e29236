package com.testflow.expression;

/**
 * Raised when an expression cannot be evaluated because its operands are ill-typed
 * or cannot be resolved. Well-typed expressions never raise this.
 */
public class ExpressionException extends RuntimeException {

    public enum Kind {
        /** Operand types cannot be combined (e.g. Integer against String). */
        TYPE_MISMATCH,
        /** An operand is null or resolved to nothing usable. */
        UNRESOLVED_OPERAND,
        /** The operator is not supported for the operand type. */
        UNSUPPORTED_OPERATOR
    }

    private final Kind kind;

    public ExpressionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
