package com.testflow.action.ui;

import com.testflow.action.ActionCancelledException;
import com.testflow.action.ActionContext;
import com.testflow.action.ActionResult;
import com.testflow.action.CancellationToken;
import com.testflow.action.CancellationTokenSource;
import com.testflow.flow.SyntaxError;
import com.testflow.flow.SyntaxErrorSeverity;
import com.testflow.flow.ValidationContext;
import com.testflow.locator.IdentifierKind;
import com.testflow.model.ActionState;
import com.testflow.support.FakeElementTree;
import com.testflow.support.RecordingInteractor;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import static com.testflow.support.FakeNode.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests IfWindowContainsTextAction over:
 *
 * <pre>
 *   Desktop
 *   ├── Window "Installer" (setup)
 *   │   ├── Text "Welcome"
 *   │   └── Pane
 *   │       └── Edit (value "Install complete")
 *   └── Window "Notes"
 * </pre>
 */
public class IfWindowContainsTextActionTest {

    private FakeElementTree tree;

    @BeforeMethod
    public void setUp() {
        tree = FakeElementTree.desktop(
            node("Window").name("Installer").id("setup").add(
                node("Text").name("Welcome"),
                node("Pane").add(node("Edit").value("Install complete"))),
            node("Window").name("Notes"));
    }

    private ActionContext context(CancellationToken token) {
        return new ActionContext(token, RecordingInteractor.session(tree, new RecordingInteractor()), 0);
    }

    private static IfWindowContainsTextAction search(String window, String text) {
        IfWindowContainsTextAction action = new IfWindowContainsTextAction();
        action.setElementIdentifier(window);
        action.setSearchText(text);
        return action;
    }

    // ════════════════════════════════════════════════════════════════════════
    // Searching
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void deepSearch_findsTextInDescendantValues() {
        IfWindowContainsTextAction action = search("Installer", "complete");

        ActionResult result = action.execute(context(CancellationToken.NONE));

        assertThat(result.isExecuted()).isTrue();
        assertThat(action.isTextFound()).isTrue();
    }

    @Test
    public void shallowSearch_checksOnlyTheWindowItself() {
        IfWindowContainsTextAction action = search("Installer", "Welcome");
        action.setDeepSearch(false);

        assertThat(action.execute(context(CancellationToken.NONE)).isExecuted()).isTrue();
        assertThat(action.isTextFound()).isFalse();

        action.setSearchText("install");
        action.execute(context(CancellationToken.NONE));
        assertThat(action.isTextFound()).isTrue();
    }

    @Test
    public void caseSensitivity_isHonoured() {
        IfWindowContainsTextAction action = search("Installer", "WELCOME");

        action.execute(context(CancellationToken.NONE));
        assertThat(action.isTextFound()).isTrue();

        action.setCaseSensitive(true);
        action.execute(context(CancellationToken.NONE));
        assertThat(action.isTextFound()).isFalse();
    }

    @Test
    public void windowByAutomationId_searchesThatWindowOnly() {
        IfWindowContainsTextAction action = search("setup", "Welcome");
        action.setIdentifierKind(IdentifierKind.AUTOMATION_ID);

        action.execute(context(CancellationToken.NONE));
        assertThat(action.isTextFound()).isTrue();

        IfWindowContainsTextAction notes = search("Notes", "Welcome");
        notes.execute(context(CancellationToken.NONE));
        assertThat(notes.isTextFound()).isFalse();
    }

    @Test
    public void missingWindow_completesWithTextNotFound() {
        IfWindowContainsTextAction action = search("Paint", "Welcome");

        ActionResult result = action.execute(context(CancellationToken.NONE));

        assertThat(result.isExecuted()).isTrue();
        assertThat(action.isTextFound()).isFalse();
    }

    @Test
    public void staleTree_completesWithTextNotFound() {
        tree.failWith(new IllegalStateException("stale element"));
        IfWindowContainsTextAction action = search("Installer", "Welcome");

        assertThat(action.execute(context(CancellationToken.NONE)).isExecuted()).isTrue();
        assertThat(action.isTextFound()).isFalse();
    }

    @Test
    public void pendingCancel_stopsTheSearch() {
        CancellationTokenSource source = new CancellationTokenSource();
        tree.beforeRootQuery(n -> source.cancel());
        IfWindowContainsTextAction action = search("Installer", "complete");

        assertThatThrownBy(() -> action.execute(context(source.getToken())))
            .isInstanceOf(ActionCancelledException.class);
        assertThat(action.getState()).isEqualTo(ActionState.PAUSED);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Configuration
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void blankConfiguration_failsAtRunTime() {
        ActionResult result = search("Installer", " ").execute(context(CancellationToken.NONE));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Search text cannot be empty");
    }

    @Test
    public void validate_blankIdentifierAndSearchText_areCritical() {
        IfWindowContainsTextAction action = search(" ", "");
        action.setIdentifierKind(IdentifierKind.CLASS_NAME);

        assertThat(action.validate(new ValidationContext("Flow.actions[0]", null, null, null)))
            .extracting(SyntaxError::getPropertyName, SyntaxError::getSeverity)
            .containsExactly(
                tuple("ElementIdentifier", SyntaxErrorSeverity.CRITICAL),
                tuple("IdentifierKind", SyntaxErrorSeverity.ERROR),
                tuple("SearchText", SyntaxErrorSeverity.CRITICAL));
    }

    @Test
    public void defaults_searchByNameDeeplyIgnoringCase() {
        IfWindowContainsTextAction action = new IfWindowContainsTextAction();

        assertThat(action.getIdentifierKind()).isEqualTo(IdentifierKind.NAME);
        assertThat(action.isDeepSearch()).isTrue();
        assertThat(action.isCaseSensitive()).isFalse();
    }
}
