package com.testflow.action;

/**
 * One entry of the action catalogue: what a designer palette shows for an action type.
 */
public record ActionTemplate(String type,
                             String category,
                             String description,
                             Class<? extends Action> actionClass) {
}
