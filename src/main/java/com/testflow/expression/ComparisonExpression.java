package com.testflow.expression;

import com.testflow.model.Environment;

import java.util.Objects;

/**
 * A single-operator ordering comparison between two operands.
 *
 * Each operand is one of:
 *   - a concrete {@link Comparable} value (Integer, Double, String, ...)
 *   - a sub-expression, such as an {@link ArithmeticExpression} or a {@link VariableReference}
 *
 * ## Evaluation
 * Both operands are resolved exactly once per {@link #evaluate()} call, left first.
 * Two typed sub-expressions whose declared result types differ are rejected before
 * either is evaluated. The resolved values must then be of the same class and
 * implement {@link Comparable}; anything else (Integer against Double, a number against
 * an unresolved variable name) fails with {@link ExpressionException.Kind#TYPE_MISMATCH}.
 */
public class ComparisonExpression extends Expression<Boolean> {

    private final ComparisonOperator operator;
    private final Object             left;
    private final Object             right;

    public ComparisonExpression(ComparisonOperator operator, Object left, Object right) {
        super(Boolean.class);
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left     = left;
        this.right    = right;
    }

    public ComparisonOperator getOperator() { return operator; }
    public Object             getLeft()     { return left; }
    public Object             getRight()    { return right; }

    @Override
    public void bindEnvironment(Environment environment) {
        bindOperand(left, environment);
        bindOperand(right, environment);
    }

    @Override
    protected Boolean doEvaluate() {
        rejectMismatchedSubExpressions();

        Object l = resolveOperand(left);
        Object r = resolveOperand(right);

        if (l == null || r == null) {
            throw new ExpressionException(ExpressionException.Kind.UNRESOLVED_OPERAND,
                "Cannot compare null operand in '" + getRawText() + "'");
        }
        if (l.getClass() != r.getClass() || !(l instanceof Comparable<?>)) {
            throw new ExpressionException(ExpressionException.Kind.TYPE_MISMATCH,
                "Cannot compare " + l.getClass().getSimpleName() + " with "
                    + r.getClass().getSimpleName() + " in '" + getRawText() + "'");
        }
        return operator.test(compare(l, r));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compare(Object l, Object r) {
        return ((Comparable) l).compareTo(r);
    }

    private void rejectMismatchedSubExpressions() {
        if (left instanceof Expression<?> le && right instanceof Expression<?> re) {
            Class<?> lt = le.getResultType();
            Class<?> rt = re.getResultType();
            if (lt != Object.class && rt != Object.class && lt != rt) {
                throw new ExpressionException(ExpressionException.Kind.TYPE_MISMATCH,
                    "Sub-expression types differ: " + lt.getSimpleName() + " and "
                        + rt.getSimpleName() + " in '" + getRawText() + "'");
            }
        }
    }

    @Override
    public String toSourceText() {
        return operandText(left) + " " + operator.getSymbol() + " " + operandText(right);
    }
}
