package com.testflow.flow;

import com.testflow.action.Action;
import com.testflow.action.CompositeAction;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Walks action trees through the {@link CompositeAction} view.
 */
public final class ActionTrees {

    private ActionTrees() {}

    /** Every action in the forest, parents before children, siblings in order. */
    public static List<Action> flatten(List<Action> roots) {
        List<Action> all = new ArrayList<>();
        forEach(roots, all::add);
        return all;
    }

    public static void forEach(List<Action> roots, Consumer<Action> visitor) {
        for (Action action : roots) {
            if (action == null) continue;
            visitor.accept(action);
            if (action instanceof CompositeAction composite) {
                for (List<Action> sequence : composite.getChildSequences().values()) {
                    forEach(sequence, visitor);
                }
            }
        }
    }

    /** Resets every action in the forest to READY. */
    public static void resetAll(List<Action> roots) {
        for (Action action : roots) {
            if (action != null) action.reset();
        }
    }

    /**
     * The position of {@code target}, e.g. {@code actions[1].body[0]}, or empty when it is
     * not in the forest. Identity comparison.
     */
    public static Optional<String> pathOf(List<Action> roots, Action target) {
        return pathOf(roots, target, "actions");
    }

    private static Optional<String> pathOf(List<Action> sequence, Action target, String prefix) {
        for (int i = 0; i < sequence.size(); i++) {
            Action action = sequence.get(i);
            String here = prefix + "[" + i + "]";
            if (action == target) return Optional.of(here);
            if (action instanceof CompositeAction composite) {
                for (Map.Entry<String, List<Action>> e : composite.getChildSequences().entrySet()) {
                    Optional<String> found = pathOf(e.getValue(), target, here + "." + e.getKey());
                    if (found.isPresent()) return found;
                }
            }
        }
        return Optional.empty();
    }

    /** Index of {@code target} in {@code actions} by identity, or -1. */
    public static int indexOf(List<Action> actions, Action target) {
        for (int i = 0; i < actions.size(); i++) {
            if (actions.get(i) == target) return i;
        }
        return -1;
    }
}
