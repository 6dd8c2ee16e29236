package com.testflow.locator;

/** Screen rectangle of an element, in pixels. */
public record Bounds(int x, int y, int width, int height) {

    public static final Bounds EMPTY = new Bounds(0, 0, 0, 0);

    public boolean isEmpty() {
        return width <= 0 || height <= 0;
    }
}
