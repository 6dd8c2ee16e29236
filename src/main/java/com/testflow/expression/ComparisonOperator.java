package com.testflow.expression;

import java.util.List;
import java.util.Optional;

/**
 * The four ordering operators a comparison expression supports.
 */
public enum ComparisonOperator {

    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<=");

    /**
     * Order in which the parser looks for operators in condition text. Two-character
     * operators come first so that {@code a >= b} is not split on {@code >}.
     */
    public static final List<ComparisonOperator> PARSE_ORDER = List.of(
        GREATER_THAN_OR_EQUAL, LESS_THAN_OR_EQUAL, GREATER_THAN, LESS_THAN);

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() { return symbol; }

    /** Applies the operator to the sign of a {@code compareTo} result. */
    public boolean test(int comparison) {
        return switch (this) {
            case GREATER_THAN          -> comparison > 0;
            case GREATER_THAN_OR_EQUAL -> comparison >= 0;
            case LESS_THAN             -> comparison < 0;
            case LESS_THAN_OR_EQUAL    -> comparison <= 0;
        };
    }

    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(symbol)) return Optional.of(op);
        }
        return Optional.empty();
    }
}
