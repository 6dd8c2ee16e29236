package com.testflow.expression;

import java.util.Optional;

public enum ArithmeticOperator {

    ADD('+'),
    SUBTRACT('-'),
    MULTIPLY('*'),
    DIVIDE('/'),
    MODULUS('%');

    private final char symbol;

    ArithmeticOperator(char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() { return symbol; }

    public static Optional<ArithmeticOperator> fromSymbol(char symbol) {
        for (ArithmeticOperator op : values()) {
            if (op.symbol == symbol) return Optional.of(op);
        }
        return Optional.empty();
    }
}
