package com.testflow.action;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Registers an {@link Action} class under a type name.
 *
 * The {@link ActionTypeRegistry} scans for this annotation at startup; the type name is
 * what persisted flows store, and category and description feed the action catalogue.
 *
 * <pre>
 *   {@literal @}ActionDefinition(type = "ClickElement", category = "UI Automation",
 *                     description = "Click on a UI element")
 *   public class ClickElementAction extends AbstractAction { ... }
 * </pre>
 *
 * Rules:
 *   - The annotated class must implement {@link Action}.
 *   - It must have a no-arg constructor.
 *   - Type names are unique. Duplicates cause startup failure.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ActionDefinition {

    String type();

    String category();

    String description() default "";
}
