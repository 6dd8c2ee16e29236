package com.testflow.support;

import com.testflow.locator.Bounds;
import com.testflow.locator.ElementAttribute;
import com.testflow.locator.ElementProvider;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/**
 * {@link ElementProvider} over a {@link FakeNode} tree.
 *
 * Counts child enumerations, can be told to fail every enumeration, and can run a hook
 * before each root enumeration, which lets a test make an element appear after a given
 * number of searches.
 */
public class FakeElementTree implements ElementProvider<FakeNode> {

    private final FakeNode      root;
    private final AtomicInteger childQueries = new AtomicInteger();
    private final AtomicInteger rootQueries  = new AtomicInteger();
    private volatile RuntimeException failure;
    private volatile IntConsumer      rootHook = n -> { };

    public FakeElementTree(FakeNode root) {
        this.root = root;
    }

    /** A desktop root holding the given windows. */
    public static FakeElementTree desktop(FakeNode... windows) {
        return new FakeElementTree(FakeNode.node("Desktop").name("Desktop").add(windows));
    }

    @Override
    public FakeNode getRoot() {
        return root;
    }

    @Override
    public List<FakeNode> getChildren(FakeNode node) {
        childQueries.incrementAndGet();
        if (failure != null) throw failure;
        if (node == root) {
            rootHook.accept(rootQueries.incrementAndGet());
        }
        return node.getChildren();
    }

    @Override
    public Optional<String> getAttribute(FakeNode node, ElementAttribute attribute) {
        return Optional.ofNullable(switch (attribute) {
            case NAME          -> node.getName();
            case AUTOMATION_ID -> node.getAutomationId();
            case CLASS_NAME    -> node.getClassName();
            case CONTROL_TYPE  -> node.getControlType();
            case VALUE         -> node.getValue();
        });
    }

    @Override
    public Bounds getBounds(FakeNode node) {
        return node.getBounds();
    }

    public FakeNode getRootNode()       { return root; }
    public int      getChildQueries()   { return childQueries.get(); }
    public int      getRootQueries()    { return rootQueries.get(); }

    /** Every later enumeration throws {@code failure}; null restores normal behaviour. */
    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    /** Called with the running count before each enumeration of the root's children. */
    public void beforeRootQuery(IntConsumer hook) {
        this.rootHook = hook;
    }
}
