package com.testflow.locator;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a live UI-element tree.
 *
 * The locator only ever enumerates children and reads attributes through this
 * interface; it treats searches as side-effect free. Implementations may throw
 * runtime exceptions for nodes that have gone stale; the locator counts such an
 * attempt as "not found".
 *
 * @param <N> the provider's node type
 */
public interface ElementProvider<N> {

    /** The top of the tree, e.g. the desktop or the document element. */
    N getRoot();

    /** Direct children of {@code node}, in the provider's sibling order. */
    List<N> getChildren(N node);

    Optional<String> getAttribute(N node, ElementAttribute attribute);

    Bounds getBounds(N node);
}
