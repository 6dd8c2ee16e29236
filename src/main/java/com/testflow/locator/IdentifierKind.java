package com.testflow.locator;

import java.util.Locale;
import java.util.Optional;

/**
 * How an action's element identifier is interpreted.
 *
 *   PATH           the simplified path syntax, see {@link ElementPath}
 *   AUTOMATION_ID  first descendant whose automation id equals the identifier
 *   NAME           first descendant whose name equals the identifier
 *   CLASS_NAME     first descendant whose class name equals the identifier
 */
public enum IdentifierKind {
    PATH,
    AUTOMATION_ID,
    NAME,
    CLASS_NAME;

    /**
     * Lenient lookup accepting the enum name in any case, plus {@code "XPath"},
     * {@code "AutomationId"} and {@code "ClassName"} as designers write them.
     */
    public static Optional<IdentifierKind> fromText(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String key = text.trim().replace("_", "").toUpperCase(Locale.ROOT);
        return switch (key) {
            case "PATH", "XPATH"  -> Optional.of(PATH);
            case "AUTOMATIONID", "ID" -> Optional.of(AUTOMATION_ID);
            case "NAME"           -> Optional.of(NAME);
            case "CLASSNAME", "CLASS" -> Optional.of(CLASS_NAME);
            default               -> Optional.empty();
        };
    }
}
