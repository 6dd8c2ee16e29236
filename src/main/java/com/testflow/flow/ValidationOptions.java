package com.testflow.flow;

/**
 * @param validateNested  descend into child sequences
 * @param includeWarnings keep WARNING findings in the result
 * @param maxDepth        nesting level beyond which validation stops with a warning
 */
public record ValidationOptions(boolean validateNested, boolean includeWarnings, int maxDepth) {

    public static final int DEFAULT_MAX_DEPTH = 100;

    public static ValidationOptions defaults() {
        return new ValidationOptions(true, true, DEFAULT_MAX_DEPTH);
    }
}
