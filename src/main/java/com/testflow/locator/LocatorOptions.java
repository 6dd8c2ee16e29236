package com.testflow.locator;

/**
 * Tuning for {@link ElementLocator} searches.
 *
 * @param maxDepth the deepest tree level a path or descendant search descends to
 */
public record LocatorOptions(int maxDepth) {

    public static final int DEFAULT_MAX_DEPTH = 12;

    public LocatorOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, was " + maxDepth);
        }
    }

    public static LocatorOptions defaults() {
        return new LocatorOptions(DEFAULT_MAX_DEPTH);
    }
}
