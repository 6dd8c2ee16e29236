package com.testflow.flow;

import com.testflow.action.Action;
import com.testflow.action.ConditionSlot;
import com.testflow.action.logic.IfAction;
import com.testflow.action.logic.WhileLoopAction;
import com.testflow.support.ScriptedAction;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ActionTreesTest {

    private final ScriptedAction  first  = ScriptedAction.succeeding("first");
    private final ScriptedAction  inBody = ScriptedAction.succeeding("inBody");
    private final ScriptedAction  inElse = ScriptedAction.succeeding("inElse");
    private final WhileLoopAction loop   = new WhileLoopAction(ConditionSlot.literal(false));
    private final IfAction        check  = new IfAction(ConditionSlot.literal(true));

    private List<Action> forest() {
        loop.getBody().add(inBody);
        check.getElseActions().add(inElse);
        return List.of(first, loop, check);
    }

    @Test
    public void flatten_visitsParentsBeforeChildren() {
        assertThat(ActionTrees.flatten(forest())).containsExactly(first, loop, inBody, check, inElse);
    }

    @Test
    public void pathOf_namesTheChildSequence() {
        List<Action> roots = forest();

        assertThat(ActionTrees.pathOf(roots, inBody)).contains("actions[1].body[0]");
        assertThat(ActionTrees.pathOf(roots, inElse)).contains("actions[2].else[0]");
        assertThat(ActionTrees.pathOf(roots, ScriptedAction.succeeding("stranger"))).isEmpty();
    }

    @Test
    public void indexOf_comparesByIdentity() {
        List<Action> roots = forest();

        assertThat(ActionTrees.indexOf(roots, check)).isEqualTo(2);
        assertThat(ActionTrees.indexOf(roots, inBody)).isEqualTo(-1);
    }
}
