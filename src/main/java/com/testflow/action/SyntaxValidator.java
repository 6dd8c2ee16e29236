package com.testflow.action;

import com.testflow.flow.SyntaxError;
import com.testflow.flow.ValidationContext;

import java.util.List;

/**
 * Implemented by actions that can check their own configuration before a run.
 * Nested actions are validated by the flow validator, not by this method.
 */
public interface SyntaxValidator {

    List<SyntaxError> validate(ValidationContext context);
}
