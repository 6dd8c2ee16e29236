package com.testflow.action;

import com.testflow.expression.ElementExistsExpression;
import com.testflow.expression.Expression;
import com.testflow.expression.ExpressionParser;
import com.testflow.model.Environment;

import java.util.Optional;

/**
 * The condition of an if, while or for action.
 *
 *   BOOLEAN_LITERAL     a fixed true or false
 *   BOOLEAN_EXPRESSION  an expression evaluating to Boolean, re-evaluated on every visit
 *   ABSENT              no condition configured
 *   UNSUPPORTED         something that cannot be a condition (e.g. unparseable text);
 *                       kept so validation can report it
 *
 * The expression object is never replaced by its result, so the same slot can be
 * evaluated once per loop iteration.
 */
public final class ConditionSlot {

    public enum Kind {
        BOOLEAN_LITERAL,
        BOOLEAN_EXPRESSION,
        ABSENT,
        UNSUPPORTED
    }

    private static final ConditionSlot ABSENT = new ConditionSlot(Kind.ABSENT, false, null, null);

    private final Kind                kind;
    private final boolean             literal;
    private final Expression<Boolean> expression;
    private final String              text;

    private ConditionSlot(Kind kind, boolean literal, Expression<Boolean> expression, String text) {
        this.kind       = kind;
        this.literal    = literal;
        this.expression = expression;
        this.text       = text;
    }

    // ── Factories ─────────────────────────────────────────────────────────────

    public static ConditionSlot literal(boolean value) {
        return new ConditionSlot(Kind.BOOLEAN_LITERAL, value, null, String.valueOf(value));
    }

    public static ConditionSlot expression(Expression<Boolean> expression) {
        if (expression == null) return ABSENT;
        return new ConditionSlot(Kind.BOOLEAN_EXPRESSION, false, expression, expression.getRawText());
    }

    public static ConditionSlot absent() {
        return ABSENT;
    }

    public static ConditionSlot unsupported(String description) {
        return new ConditionSlot(Kind.UNSUPPORTED, false, null, description);
    }

    /**
     * Parses condition text. Blank text is ABSENT; text the parser rejects is UNSUPPORTED.
     */
    public static ConditionSlot parse(String text) {
        if (text == null || text.isBlank()) return ABSENT;
        return ExpressionParser.parse(text)
            .map(ConditionSlot::expression)
            .orElseGet(() -> unsupported(text));
    }

    /**
     * Classifies an arbitrary value: a Boolean, a Boolean expression, text to parse or null.
     * Anything else, including expressions of another result type, is UNSUPPORTED.
     */
    @SuppressWarnings("unchecked")
    public static ConditionSlot of(Object value) {
        if (value == null) return ABSENT;
        if (value instanceof Boolean b) return literal(b);
        if (value instanceof Expression<?> e && e.getResultType() == Boolean.class) {
            return expression((Expression<Boolean>) e);
        }
        if (value instanceof String s) return parse(s);
        return unsupported(value.getClass().getSimpleName() + " is not a boolean condition");
    }

    // ── Evaluation ────────────────────────────────────────────────────────────

    /** True for BOOLEAN_LITERAL and BOOLEAN_EXPRESSION. */
    public boolean isEvaluable() {
        return kind == Kind.BOOLEAN_LITERAL || kind == Kind.BOOLEAN_EXPRESSION;
    }

    /**
     * Evaluates the condition against {@code environment}.
     *
     * @return the value, or empty for ABSENT and UNSUPPORTED slots
     * @throws com.testflow.expression.ExpressionException when the expression's operands are ill-typed
     */
    public Optional<Boolean> evaluate(Environment environment, CancellationToken token) {
        return switch (kind) {
            case BOOLEAN_LITERAL    -> Optional.of(literal);
            case BOOLEAN_EXPRESSION -> Optional.ofNullable(evaluateExpression(environment, token));
            case ABSENT, UNSUPPORTED -> Optional.empty();
        };
    }

    private Boolean evaluateExpression(Environment environment, CancellationToken token) {
        if (environment != null) {
            expression.bindEnvironment(environment);
        }
        if (expression instanceof ElementExistsExpression<?> exists) {
            exists.setCancellationToken(token);
        }
        return expression.evaluate();
    }

    // ── Accessors ─────────────────────────────────────────────────────────────

    public Kind                getKind()       { return kind; }
    public boolean             getLiteral()    { return literal; }
    public Expression<Boolean> getExpression() { return expression; }

    /** Source text for literals and expressions, the description for UNSUPPORTED, null for ABSENT. */
    public String getText() {
        return kind == Kind.BOOLEAN_EXPRESSION ? expression.getRawText() : text;
    }

    @Override
    public String toString() {
        return "ConditionSlot{" + kind + (text != null ? ", '" + getText() + "'" : "") + "}";
    }
}
