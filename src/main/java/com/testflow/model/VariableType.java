package com.testflow.model;

import java.util.Locale;

/**
 * Declared type of a {@link Variable}.
 *
 * The display name is what the designer shows in a set-variable action's name,
 * e.g. "Set a Integer variable".
 */
public enum VariableType {

    INTEGER(Integer.class),
    LONG(Long.class),
    DOUBLE(Double.class),
    FLOAT(Float.class),
    BOOLEAN(Boolean.class),
    STRING(String.class),
    OBJECT(Object.class);

    private final Class<?> javaType;

    VariableType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> getJavaType()   { return javaType; }
    public String   getDisplayName() { return javaType.getSimpleName(); }

    /** True when {@code value} is null or an instance of this type. */
    public boolean accepts(Object value) {
        return value == null || javaType.isInstance(value);
    }

    /** Infers the declared type from a runtime value; null and unknown classes map to OBJECT. */
    public static VariableType of(Object value) {
        if (value == null) return OBJECT;
        for (VariableType t : values()) {
            if (t != OBJECT && t.javaType == value.getClass()) return t;
        }
        return OBJECT;
    }

    /** Maps a declared Java class to its type; unknown classes map to OBJECT. */
    public static VariableType of(Class<?> type) {
        for (VariableType t : values()) {
            if (t.javaType == type) return t;
        }
        return OBJECT;
    }

    /**
     * Parses the text form of a value of this type.
     *
     * @throws IllegalArgumentException when the text is not a valid value for this type
     */
    public Object parse(String text) {
        if (text == null) return null;
        String trimmed = text.trim();
        try {
            return switch (this) {
                case INTEGER -> Integer.parseInt(trimmed);
                case LONG    -> Long.parseLong(trimmed);
                case DOUBLE  -> Double.parseDouble(trimmed);
                case FLOAT   -> Float.parseFloat(trimmed);
                case BOOLEAN -> parseBoolean(trimmed);
                case STRING, OBJECT -> text;
            };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "'" + text + "' is not a valid " + getDisplayName() + " value", e);
        }
    }

    private static Boolean parseBoolean(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if ("true".equals(lower))  return Boolean.TRUE;
        if ("false".equals(lower)) return Boolean.FALSE;
        throw new IllegalArgumentException("'" + text + "' is not a valid Boolean value");
    }
}
