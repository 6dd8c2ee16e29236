package com.testflow.locator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A parsed element path.
 *
 * ## Syntax
 * <pre>
 *   path      := ["//"] segment ("//" segment)*
 *   segment   := type predicate* | "*" predicate* | predicate+
 *   predicate := "[" test (" and " test)* "]"
 *   test      := "@" ("Name" | "AutomationId" | "ClassName") "=" quoted
 * </pre>
 * For example {@code //Window[@Name='Calculator']//Button[@AutomationId='num7']}.
 *
 * Despite the separator, each segment is matched against the <em>direct</em> children
 * of the node the previous segment matched; there is no any-descendant expansion.
 * Quoted values may use single or double quotes and may contain {@code //}, brackets
 * and spaces.
 */
public final class ElementPath {

    private static final String SEPARATOR   = "//";
    private static final String WINDOW_TYPE = "Window";

    private final String            source;
    private final List<PathSegment> segments;

    private ElementPath(String source, List<PathSegment> segments) {
        this.source   = source;
        this.segments = Collections.unmodifiableList(segments);
    }

    public static ElementPath of(PathSegment... segments) {
        if (segments.length == 0) {
            throw new IllegalArgumentException("An element path needs at least one segment");
        }
        List<PathSegment> list = List.of(segments);
        StringBuilder sb = new StringBuilder();
        list.forEach(s -> sb.append(SEPARATOR).append(s));
        return new ElementPath(sb.toString(), new ArrayList<>(list));
    }

    public String            getSource()   { return source; }
    public List<PathSegment> getSegments() { return segments; }
    public int               size()        { return segments.size(); }

    /**
     * The leading segment when it names a window by Name or AutomationId. The locator
     * resolves such a window directly among the root's children instead of descending.
     */
    public Optional<PathSegment> windowSegment() {
        PathSegment first = segments.get(0);
        boolean identified = first.automationId() != null || first.name() != null;
        return WINDOW_TYPE.equals(first.controlType()) && identified
            ? Optional.of(first)
            : Optional.empty();
    }

    /** The segments after the first one. */
    public List<PathSegment> tail() {
        return segments.subList(1, segments.size());
    }

    @Override
    public String toString() {
        return source;
    }

    // ── Parsing ───────────────────────────────────────────────────────────────

    /**
     * @throws LocatorSyntaxException when the text is blank or not a valid path
     */
    public static ElementPath parse(String text) {
        if (text == null || text.isBlank()) {
            throw new LocatorSyntaxException("Element path is empty", String.valueOf(text), 0);
        }
        return new Parser(text.trim()).parse();
    }

    private static final class Parser {

        private final String text;
        private int pos;

        Parser(String text) {
            this.text = text;
        }

        ElementPath parse() {
            List<PathSegment> segments = new ArrayList<>();
            if (text.startsWith(SEPARATOR)) pos = SEPARATOR.length();
            while (true) {
                segments.add(segment());
                if (pos == text.length()) break;
                if (!text.startsWith(SEPARATOR, pos)) {
                    throw error("Expected '//' between segments");
                }
                pos += SEPARATOR.length();
            }
            return new ElementPath(text, segments);
        }

        private PathSegment segment() {
            int start = pos;
            String type = null;
            if (peek() == '*') {
                pos++;
            } else {
                while (pos < text.length() && isTypeChar(text.charAt(pos))) pos++;
                if (pos > start) type = text.substring(start, pos);
            }

            String[] values = new String[3]; // name, automationId, className
            while (peek() == '[') {
                predicateGroup(values);
            }
            if (pos == start) {
                throw error("Empty path segment");
            }
            return new PathSegment(type, values[0], values[1], values[2]);
        }

        private void predicateGroup(String[] values) {
            pos++; // [
            while (true) {
                skipSpaces();
                expect('@');
                int nameStart = pos;
                while (pos < text.length() && Character.isLetter(text.charAt(pos))) pos++;
                String attribute = text.substring(nameStart, pos);
                int slot = switch (attribute.toLowerCase(Locale.ROOT)) {
                    case "name"         -> 0;
                    case "automationid" -> 1;
                    case "classname"    -> 2;
                    default -> throw error("Unsupported attribute '@" + attribute + "'");
                };
                if (values[slot] != null) {
                    throw error("Attribute '@" + attribute + "' given twice");
                }
                skipSpaces();
                expect('=');
                skipSpaces();
                values[slot] = quoted();
                skipSpaces();
                if (peek() == ']') {
                    pos++;
                    return;
                }
                if (text.regionMatches(true, pos, "and", 0, 3)) {
                    pos += 3;
                    continue;
                }
                throw error("Expected ']' or 'and'");
            }
        }

        private String quoted() {
            char quote = peek();
            if (quote != '\'' && quote != '"') {
                throw error("Expected a quoted value");
            }
            int close = text.indexOf(quote, pos + 1);
            if (close < 0) {
                throw error("Unterminated quoted value");
            }
            String value = text.substring(pos + 1, close);
            pos = close + 1;
            return value;
        }

        private void expect(char c) {
            if (peek() != c) {
                throw error("Expected '" + c + "'");
            }
            pos++;
        }

        private char peek() {
            return pos < text.length() ? text.charAt(pos) : '\0';
        }

        private void skipSpaces() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) pos++;
        }

        private static boolean isTypeChar(char c) {
            return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' || c == ':';
        }

        private LocatorSyntaxException error(String message) {
            return new LocatorSyntaxException(message, text, pos);
        }
    }
}
