package com.testflow.expression;

import com.testflow.model.Environment;

/**
 * Base class of every evaluable expression.
 *
 * Evaluation is pull-based: each call to {@link #evaluate()} re-reads the current
 * operands (bound variables, the live element tree) and overwrites the cached
 * {@link #getResult() result}. Nothing is cached across calls, which is what lets a
 * loop or if condition be re-checked on every visit.
 *
 * @param <T> the result type
 */
public abstract class Expression<T> {

    private final Class<T> resultType;
    private String         rawText;
    private T              result;

    protected Expression(Class<T> resultType) {
        this.resultType = resultType;
    }

    /**
     * Evaluates the expression against the current state, stores the value as the
     * cached result and returns it.
     *
     * @throws ExpressionException when the operands cannot be combined
     */
    public final T evaluate() {
        result = doEvaluate();
        return result;
    }

    protected abstract T doEvaluate();

    /**
     * Makes variables of the given Environment visible to this expression and its
     * operands. The default binds nothing.
     */
    public void bindEnvironment(Environment environment) {
        // leaf expressions have no variables
    }

    /** Canonical text form, used when the expression is persisted and re-parsed. */
    public abstract String toSourceText();

    public Class<T> getResultType() { return resultType; }
    public T        getResult()     { return result; }

    /** The text this expression was parsed from, or its canonical form when built in code. */
    public String getRawText() {
        return rawText != null ? rawText : toSourceText();
    }

    public void setRawText(String rawText) { this.rawText = rawText; }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + getRawText() + "}";
    }

    // ── Operand helpers shared by the binary expressions ─────────────────────

    /** Evaluates an expression operand exactly once; concrete values are returned as-is. */
    static Object resolveOperand(Object operand) {
        if (operand instanceof Expression<?> expression) {
            return expression.evaluate();
        }
        return operand;
    }

    static void bindOperand(Object operand, Environment environment) {
        if (operand instanceof Expression<?> expression) {
            expression.bindEnvironment(environment);
        }
    }

    static String operandText(Object operand) {
        if (operand instanceof Expression<?> expression) return expression.toSourceText();
        if (operand instanceof String s) return "'" + s + "'";
        return String.valueOf(operand);
    }
}
