package com.testflow.locator;

import java.util.Objects;

/**
 * A locator and an interactor over the same element tree, handed to UI actions
 * through the action context.
 */
public record UiSession<N>(ElementLocator<N> locator, ElementInteractor<N> interactor) {

    public UiSession {
        Objects.requireNonNull(locator, "locator");
        Objects.requireNonNull(interactor, "interactor");
    }
}
