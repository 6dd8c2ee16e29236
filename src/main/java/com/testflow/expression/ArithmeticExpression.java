package com.testflow.expression;

import com.testflow.model.Environment;

import java.util.Objects;

/**
 * A single-operator arithmetic expression over two operands of one numeric type.
 *
 * Operands are concrete numbers, nested arithmetic expressions or variable
 * references. Nested expressions are evaluated first, bottom-up, and the operands
 * themselves are never modified, so the same tree can be evaluated again on the
 * next loop iteration. Both resolved operands must be instances of the declared
 * type; {@code Integer + Double} is a type mismatch, not a widening.
 *
 * <pre>
 *   // (2 + 3) * 4
 *   var sum     = ArithmeticExpression.of(Integer.class, ArithmeticOperator.ADD, 2, 3);
 *   var product = ArithmeticExpression.of(Integer.class, ArithmeticOperator.MULTIPLY, sum, 4);
 *   product.evaluate();  // 20
 * </pre>
 *
 * @param <T> the numeric result type
 */
public class ArithmeticExpression<T extends Number> extends Expression<T> {

    private final NumericType        numericType;
    private final ArithmeticOperator operator;
    private final Object             left;
    private final Object             right;

    public ArithmeticExpression(Class<T> type, ArithmeticOperator operator, Object left, Object right) {
        super(type);
        this.numericType = NumericType.of(type).orElseThrow(() -> new ExpressionException(
            ExpressionException.Kind.UNSUPPORTED_OPERATOR,
            "Arithmetic is not defined for " + type.getSimpleName()));
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left     = left;
        this.right    = right;
    }

    public static <T extends Number> ArithmeticExpression<T> of(
            Class<T> type, ArithmeticOperator operator, Object left, Object right) {
        return new ArithmeticExpression<>(type, operator, left, right);
    }

    public NumericType        getNumericType() { return numericType; }
    public ArithmeticOperator getOperator()    { return operator; }
    public Object             getLeft()        { return left; }
    public Object             getRight()       { return right; }

    @Override
    public void bindEnvironment(Environment environment) {
        bindOperand(left, environment);
        bindOperand(right, environment);
    }

    @Override
    protected T doEvaluate() {
        Number l = requireNumber(resolveOperand(left), "left");
        Number r = requireNumber(resolveOperand(right), "right");
        return getResultType().cast(numericType.apply(operator, l, r));
    }

    private Number requireNumber(Object value, String side) {
        if (value == null) {
            throw new ExpressionException(ExpressionException.Kind.UNRESOLVED_OPERAND,
                "The " + side + " operand of '" + getRawText() + "' is null");
        }
        if (!numericType.isInstance(value)) {
            throw new ExpressionException(ExpressionException.Kind.TYPE_MISMATCH,
                "The " + side + " operand of '" + getRawText() + "' is "
                    + value.getClass().getSimpleName() + ", expected "
                    + getResultType().getSimpleName());
        }
        return (Number) value;
    }

    @Override
    public String toSourceText() {
        return operandText(left) + " " + operator.getSymbol() + " " + operandText(right);
    }
}
