package com.testflow.action;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * An action owning nested actions, exposed as named, ordered sequences
 * (e.g. "then" and "else" for a conditional, "body" for a loop).
 *
 * Reset, validation and persistence walk the tree through this view only.
 */
public interface CompositeAction extends Action {

    /** Named child sequences in display order. Sequences may be empty. */
    Map<String, List<Action>> getChildSequences();

    /** Every direct child across all sequences, in order. */
    default List<Action> getChildren() {
        List<Action> all = new ArrayList<>();
        getChildSequences().values().forEach(all::addAll);
        return all;
    }
}
