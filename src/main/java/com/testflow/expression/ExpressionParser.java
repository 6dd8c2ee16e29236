package com.testflow.expression;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns condition and value text into expression trees.
 *
 * ## Conditions ({@link #parse})
 *   1. Blank text yields nothing.
 *   2. {@code true} / {@code false}, in any case, yields a boolean literal.
 *   3. Otherwise the operators are tried in {@link ComparisonOperator#PARSE_ORDER}. The first
 *      one present splits the text into exactly two trimmed operands.
 *   4. Each operand is classified, in order, as an integer literal, a decimal literal,
 *      a quoted string or a variable name. Variable names are not resolved here; they
 *      become {@link VariableReference}s that read the Environment at evaluation time.
 *
 * Text with no operator, an empty operand, more than one occurrence of the operator,
 * or an operand that fits none of the classes yields {@link Optional#empty()}.
 *
 * ## Values ({@link #parseArithmetic})
 * A single {@code + - * / %} between two operands of the requested numeric type,
 * e.g. {@code i + 1}. A sign at the very start belongs to the first operand.
 *
 * Operators are mapped to expression classes with a plain switch; nothing is
 * constructed reflectively.
 */
public final class ExpressionParser {

    private static final Logger log = LoggerFactory.getLogger(ExpressionParser.class);

    private static final Pattern INTEGER    = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL    = Pattern.compile("[-+]?\\d*\\.?\\d+([eE][-+]?\\d+)?");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");
    private static final Pattern QUOTED     = Pattern.compile("'[^']*'|\"[^\"]*\"");

    private ExpressionParser() {}

    // ── Conditions ────────────────────────────────────────────────────────────

    public static Optional<Expression<Boolean>> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.trim();

        String lower = trimmed.toLowerCase(Locale.ROOT);
        if ("true".equals(lower) || "false".equals(lower)) {
            LiteralExpression<Boolean> literal = LiteralExpression.of(Boolean.parseBoolean(lower));
            literal.setRawText(trimmed);
            return Optional.of(literal);
        }

        for (ComparisonOperator op : ComparisonOperator.PARSE_ORDER) {
            if (!trimmed.contains(op.getSymbol())) continue;

            String[] parts = trimmed.split(Pattern.quote(op.getSymbol()), -1);
            if (parts.length != 2) {
                log.debug("ExpressionParser: '{}' has {} operands around '{}'",
                    trimmed, parts.length, op.getSymbol());
                return Optional.empty();
            }
            String leftText  = parts[0].trim();
            String rightText = parts[1].trim();
            if (leftText.isEmpty() || rightText.isEmpty()) {
                return Optional.empty();
            }

            Optional<Object> left  = classifyOperand(leftText);
            Optional<Object> right = classifyOperand(rightText);
            if (left.isEmpty() || right.isEmpty()) {
                log.debug("ExpressionParser: unclassifiable operand in '{}'", trimmed);
                return Optional.empty();
            }

            ComparisonExpression comparison = new ComparisonExpression(op, left.get(), right.get());
            comparison.setRawText(trimmed);
            return Optional.of(comparison);
        }

        log.debug("ExpressionParser: no comparison operator in '{}'", trimmed);
        return Optional.empty();
    }

    /**
     * Classifies one comparison operand: Integer, then Double, then a quoted String,
     * then a {@link VariableReference}.
     */
    static Optional<Object> classifyOperand(String text) {
        if (INTEGER.matcher(text).matches()) {
            try {
                return Optional.of(Integer.parseInt(text));
            } catch (NumberFormatException overflow) {
                // too large for an int; fall through to the decimal form
            }
        }
        if (DECIMAL.matcher(text).matches()) {
            return Optional.of(Double.parseDouble(text));
        }
        if (QUOTED.matcher(text).matches()) {
            return Optional.of(text.substring(1, text.length() - 1));
        }
        if (IDENTIFIER.matcher(text).matches()) {
            return Optional.of(new VariableReference(text));
        }
        return Optional.empty();
    }

    // ── Values ────────────────────────────────────────────────────────────────

    public static <T extends Number> Optional<ArithmeticExpression<T>> parseArithmetic(
            String text, Class<T> type) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Optional<NumericType> numericType = NumericType.of(type);
        if (numericType.isEmpty()) {
            return Optional.empty();
        }
        String trimmed = text.trim();

        int opIndex = -1;
        ArithmeticOperator operator = null;
        for (int i = 1; i < trimmed.length(); i++) {
            Optional<ArithmeticOperator> op = ArithmeticOperator.fromSymbol(trimmed.charAt(i));
            if (op.isPresent()) {
                opIndex  = i;
                operator = op.get();
                break;
            }
        }
        if (operator == null) {
            return Optional.empty();
        }

        String leftText  = trimmed.substring(0, opIndex).trim();
        String rightText = trimmed.substring(opIndex + 1).trim();
        if (leftText.isEmpty() || rightText.isEmpty()) {
            return Optional.empty();
        }

        Optional<Object> left  = numericOperand(leftText, numericType.get());
        Optional<Object> right = numericOperand(rightText, numericType.get());
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }

        ArithmeticExpression<T> expression = new ArithmeticExpression<>(type, operator, left.get(), right.get());
        expression.setRawText(trimmed);
        return Optional.of(expression);
    }

    private static Optional<Object> numericOperand(String text, NumericType type) {
        if (IDENTIFIER.matcher(text).matches()) {
            return Optional.of(new VariableReference(text));
        }
        try {
            return Optional.of(type.parse(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
