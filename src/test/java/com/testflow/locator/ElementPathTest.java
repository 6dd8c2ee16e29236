package com.testflow.locator;

import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ElementPath parsing and PathSegment rendering.
 */
public class ElementPathTest {

    // ════════════════════════════════════════════════════════════════════════
    // Well-formed paths
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void parse_splitsSegmentsAndReadsPredicates() {
        ElementPath path = ElementPath.parse("//Window[@Name='Calculator']//Button[@AutomationId='num7']");

        assertThat(path.size()).isEqualTo(2);
        assertThat(path.getSegments().get(0)).isEqualTo(new PathSegment("Window", "Calculator", null, null));
        assertThat(path.getSegments().get(1)).isEqualTo(new PathSegment("Button", null, "num7", null));
        assertThat(path.getSource()).isEqualTo("//Window[@Name='Calculator']//Button[@AutomationId='num7']");
    }

    @Test
    public void parse_leadingSeparatorIsOptional() {
        assertThat(ElementPath.parse("Pane//Edit").getSegments())
            .containsExactly(new PathSegment("Pane", null, null, null), new PathSegment("Edit", null, null, null));
    }

    @Test
    public void parse_combinesAndedAndRepeatedPredicates() {
        PathSegment segment = ElementPath.parse("Button[@Name='OK' and @AutomationId=\"ok\"][@ClassName='Btn']")
            .getSegments().get(0);

        assertThat(segment).isEqualTo(new PathSegment("Button", "OK", "ok", "Btn"));
    }

    @Test
    public void parse_quotedValuesMayContainSeparatorsAndBrackets() {
        ElementPath path = ElementPath.parse("Window[@Name='a//b [x]']//Text");

        assertThat(path.size()).isEqualTo(2);
        assertThat(path.getSegments().get(0).name()).isEqualTo("a//b [x]");
    }

    @Test
    public void parse_wildcardAndPredicateOnlySegments() {
        ElementPath path = ElementPath.parse("*//[@Name='Save']");

        assertThat(path.getSegments().get(0).isWildcard()).isTrue();
        assertThat(path.getSegments().get(1)).isEqualTo(new PathSegment(null, "Save", null, null));
    }

    @Test
    public void windowSegment_onlyForIdentifiedLeadingWindow() {
        assertThat(ElementPath.parse("Window[@AutomationId='main']//Button").windowSegment()).isPresent();
        assertThat(ElementPath.parse("Window//Button").windowSegment()).isEmpty();
        assertThat(ElementPath.parse("Pane[@Name='x']//Window[@Name='y']").windowSegment()).isEmpty();
        assertThat(ElementPath.parse("Window[@Name='w']//Pane//Edit").tail()).hasSize(2);
    }

    @Test
    public void segmentToString_isCanonical() {
        assertThat(new PathSegment("Button", "OK", "ok", null).toString())
            .isEqualTo("Button[@AutomationId='ok'][@Name='OK']");
        assertThat(PathSegment.WILDCARD.toString()).isEqualTo("*");
        assertThat(ElementPath.of(new PathSegment("Window", "W", null, null), PathSegment.WILDCARD).getSource())
            .isEqualTo("//Window[@Name='W']//*");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Malformed paths
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void parse_rejectsBlankText() {
        assertThatThrownBy(() -> ElementPath.parse("  "))
            .isInstanceOf(LocatorSyntaxException.class)
            .hasMessageContaining("empty");
    }

    @Test
    public void parse_rejectsMissingSeparator() {
        assertThatThrownBy(() -> ElementPath.parse("Window Button"))
            .isInstanceOf(LocatorSyntaxException.class)
            .hasMessageContaining("Expected '//' between segments")
            .satisfies(e -> {
                LocatorSyntaxException ex = (LocatorSyntaxException) e;
                assertThat(ex.getPosition()).isEqualTo(6);
                assertThat(ex.getPath()).isEqualTo("Window Button");
            });
    }

    @Test
    public void parse_rejectsEmptySegment() {
        assertThatThrownBy(() -> ElementPath.parse("//Window////Button"))
            .isInstanceOf(LocatorSyntaxException.class)
            .hasMessageContaining("Empty path segment");
    }

    @Test
    public void parse_rejectsUnknownAttribute() {
        assertThatThrownBy(() -> ElementPath.parse("Button[@Title='x']"))
            .isInstanceOf(LocatorSyntaxException.class)
            .hasMessageContaining("Unsupported attribute");
    }

    @Test
    public void parse_rejectsRepeatedAttribute() {
        assertThatThrownBy(() -> ElementPath.parse("Button[@Name='a'][@Name='b']"))
            .isInstanceOf(LocatorSyntaxException.class)
            .hasMessageContaining("given twice");
    }

    @Test
    public void parse_rejectsUnterminatedQuote() {
        assertThatThrownBy(() -> ElementPath.parse("Button[@Name='abc]"))
            .isInstanceOf(LocatorSyntaxException.class)
            .hasMessageContaining("Unterminated quoted value");
    }

    @Test
    public void identifierKind_acceptsDesignerSpellings() {
        assertThat(IdentifierKind.fromText("XPath")).contains(IdentifierKind.PATH);
        assertThat(IdentifierKind.fromText("automation_id")).contains(IdentifierKind.AUTOMATION_ID);
        assertThat(IdentifierKind.fromText("Id")).contains(IdentifierKind.AUTOMATION_ID);
        assertThat(IdentifierKind.fromText("ClassName")).contains(IdentifierKind.CLASS_NAME);
        assertThat(IdentifierKind.fromText("css")).isEmpty();
        assertThat(IdentifierKind.fromText(null)).isEmpty();
    }
}
