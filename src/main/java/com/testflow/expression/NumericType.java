package com.testflow.expression;

import java.util.Optional;

/**
 * The numeric types arithmetic is defined over. Each applies an operator with the
 * native semantics of its Java type: integer division truncates and throws
 * {@link ArithmeticException} on a zero divisor, floating-point division yields
 * infinity or NaN.
 */
public enum NumericType {

    INTEGER(Integer.class),
    LONG(Long.class),
    DOUBLE(Double.class),
    FLOAT(Float.class);

    private final Class<? extends Number> javaType;

    NumericType(Class<? extends Number> javaType) {
        this.javaType = javaType;
    }

    public Class<? extends Number> getJavaType() { return javaType; }

    public boolean isInstance(Object value) {
        return javaType.isInstance(value);
    }

    public static Optional<NumericType> of(Class<?> type) {
        for (NumericType t : values()) {
            if (t.javaType == type) return Optional.of(t);
        }
        return Optional.empty();
    }

    /**
     * Parses a literal of this type.
     *
     * @throws NumberFormatException when the text is not a literal of this type
     */
    public Number parse(String text) {
        String t = text.trim();
        return switch (this) {
            case INTEGER -> Integer.parseInt(t);
            case LONG    -> Long.parseLong(t);
            case DOUBLE  -> Double.parseDouble(t);
            case FLOAT   -> Float.parseFloat(t);
        };
    }

    public Number apply(ArithmeticOperator op, Number left, Number right) {
        return switch (this) {
            case INTEGER -> applyInt(op, left.intValue(), right.intValue());
            case LONG    -> applyLong(op, left.longValue(), right.longValue());
            case DOUBLE  -> applyDouble(op, left.doubleValue(), right.doubleValue());
            case FLOAT   -> applyFloat(op, left.floatValue(), right.floatValue());
        };
    }

    private static Integer applyInt(ArithmeticOperator op, int a, int b) {
        return switch (op) {
            case ADD      -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE   -> a / b;
            case MODULUS  -> a % b;
        };
    }

    private static Long applyLong(ArithmeticOperator op, long a, long b) {
        return switch (op) {
            case ADD      -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE   -> a / b;
            case MODULUS  -> a % b;
        };
    }

    private static Double applyDouble(ArithmeticOperator op, double a, double b) {
        return switch (op) {
            case ADD      -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE   -> a / b;
            case MODULUS  -> a % b;
        };
    }

    private static Float applyFloat(ArithmeticOperator op, float a, float b) {
        return switch (op) {
            case ADD      -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE   -> a / b;
            case MODULUS  -> a % b;
        };
    }
}
