package com.testflow.locator;

/**
 * The side-effecting half of the UI boundary: clicking and typing into a node that the
 * {@link ElementLocator} has already resolved.
 *
 * @param <N> the provider's node type
 */
public interface ElementInteractor<N> {

    void click(N node);

    void doubleClick(N node);

    /**
     * Triggers the node's default action without a pointer event.
     *
     * @return false when the node has no default action; the caller may fall back to a click
     */
    boolean invoke(N node);

    /**
     * Writes text into the node.
     *
     * @param clearExisting replace the current value when true, append to it when false
     */
    void setText(N node, String text, boolean clearExisting);
}
