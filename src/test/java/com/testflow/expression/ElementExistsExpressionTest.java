package com.testflow.expression;

import com.testflow.action.ActionCancelledException;
import com.testflow.action.ActionContext;
import com.testflow.action.CancellationTokenSource;
import com.testflow.action.ConditionSlot;
import com.testflow.action.logic.IfAction;
import com.testflow.locator.ElementLocator;
import com.testflow.locator.IdentifierKind;
import com.testflow.model.ActionState;
import com.testflow.support.FakeElementTree;
import com.testflow.support.FakeNode;
import com.testflow.support.ScriptedAction;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import static com.testflow.support.FakeNode.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ElementExistsExpressionTest {

    private FakeElementTree          tree;
    private ElementLocator<FakeNode> locator;

    @BeforeMethod
    public void setUp() {
        tree    = FakeElementTree.desktop(node("Window").name("Main").add(node("Button").id("save")));
        locator = new ElementLocator<>(tree);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Evaluation
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void presentElement_isTrue_absentOneFalse() {
        assertThat(ElementExistsExpression.of(locator, IdentifierKind.AUTOMATION_ID, "save", 1, 1).evaluate()).isTrue();
        assertThat(ElementExistsExpression.of(locator, IdentifierKind.AUTOMATION_ID, "open", 2, 1).evaluate()).isFalse();
        assertThat(tree.getRootQueries()).isEqualTo(3);
    }

    @Test
    public void malformedPath_isFalse() {
        assertThat(ElementExistsExpression.of(locator, IdentifierKind.PATH, "Window Button", 1, 1).evaluate()).isFalse();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Cancellation
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void cancelWhileRetrying_propagates() {
        CancellationTokenSource source = new CancellationTokenSource();
        tree.beforeRootQuery(n -> source.cancel());
        ElementExistsExpression<FakeNode> exists =
            ElementExistsExpression.of(locator, IdentifierKind.AUTOMATION_ID, "open", 5, 10_000);
        exists.setCancellationToken(source.getToken());

        assertThatThrownBy(exists::evaluate).isInstanceOf(ActionCancelledException.class);
        assertThat(tree.getRootQueries()).isEqualTo(1);
    }

    @Test
    public void cancelDuringIfCondition_pausesTheIf() {
        CancellationTokenSource source = new CancellationTokenSource();
        tree.beforeRootQuery(n -> source.cancel());
        ScriptedAction otherwise = ScriptedAction.succeeding("otherwise");
        IfAction check = new IfAction(ConditionSlot.expression(
            ElementExistsExpression.of(locator, IdentifierKind.AUTOMATION_ID, "open", 5, 10_000)));
        check.getElseActions().add(otherwise);

        assertThatThrownBy(() -> check.execute(new ActionContext(source.getToken())))
            .isInstanceOf(ActionCancelledException.class);
        assertThat(check.getState()).isEqualTo(ActionState.PAUSED);
        assertThat(otherwise.getExecutions()).isZero();
    }
}
