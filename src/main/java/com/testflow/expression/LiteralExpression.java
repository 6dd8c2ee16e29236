package com.testflow.expression;

/**
 * An expression that always evaluates to the constant it was built with.
 */
public class LiteralExpression<T> extends Expression<T> {

    private final T value;

    @SuppressWarnings("unchecked")
    public LiteralExpression(T value) {
        super((Class<T>) value.getClass());
        this.value = value;
    }

    public static LiteralExpression<Boolean> of(boolean value) {
        return new LiteralExpression<>(value);
    }

    public T getValue() { return value; }

    @Override
    protected T doEvaluate() {
        return value;
    }

    @Override
    public String toSourceText() {
        return String.valueOf(value);
    }
}
