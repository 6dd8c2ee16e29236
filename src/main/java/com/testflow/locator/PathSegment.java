package com.testflow.locator;

import java.util.Objects;

/**
 * One step of an {@link ElementPath}: a control type and/or attribute predicates that a
 * direct child must satisfy.
 *
 * Null fields are unconstrained. A segment with every field null is the wildcard and
 * matches any node. Otherwise every specified field must equal the node's attribute
 * exactly, checked in the order AutomationId, Name, ClassName, ControlType so the most
 * selective comparison rejects a candidate first.
 */
public record PathSegment(String controlType, String name, String automationId, String className) {

    public static final PathSegment WILDCARD = new PathSegment(null, null, null, null);

    public boolean isWildcard() {
        return controlType == null && name == null && automationId == null && className == null;
    }

    public <N> boolean matches(ElementProvider<N> provider, N node) {
        if (isWildcard()) return true;
        if (automationId != null && !equalsAttribute(provider, node, ElementAttribute.AUTOMATION_ID, automationId)) {
            return false;
        }
        if (name != null && !equalsAttribute(provider, node, ElementAttribute.NAME, name)) {
            return false;
        }
        if (className != null && !equalsAttribute(provider, node, ElementAttribute.CLASS_NAME, className)) {
            return false;
        }
        return controlType == null
            || equalsAttribute(provider, node, ElementAttribute.CONTROL_TYPE, controlType);
    }

    private static <N> boolean equalsAttribute(ElementProvider<N> provider, N node,
                                               ElementAttribute attribute, String expected) {
        return provider.getAttribute(node, attribute)
            .map(actual -> Objects.equals(actual, expected))
            .orElse(false);
    }

    /** Canonical text, e.g. {@code Button[@AutomationId='ok'][@Name='OK']}. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(controlType != null ? controlType : "*");
        if (automationId != null) sb.append("[@AutomationId='").append(automationId).append("']");
        if (name != null)         sb.append("[@Name='").append(name).append("']");
        if (className != null)    sb.append("[@ClassName='").append(className).append("']");
        return sb.toString();
    }
}
