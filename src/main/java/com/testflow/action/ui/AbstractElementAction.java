package com.testflow.action.ui;

import com.testflow.action.AbstractAction;
import com.testflow.action.SyntaxValidator;
import com.testflow.flow.SyntaxError;
import com.testflow.flow.ValidationContext;
import com.testflow.locator.ElementPath;
import com.testflow.locator.IdentifierKind;
import com.testflow.locator.LocatorSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Common configuration of actions that target one UI element: the identifier and how
 * to interpret it. Paths are the default.
 */
public abstract class AbstractElementAction extends AbstractAction implements SyntaxValidator {

    private IdentifierKind identifierKind = IdentifierKind.PATH;
    private String         elementIdentifier;

    protected AbstractElementAction(String name, String description) {
        super(name, description);
    }

    /**
     * Blank identifiers are CRITICAL; a path that does not parse is an ERROR.
     * Subclasses add their own checks to the returned list.
     */
    @Override
    public List<SyntaxError> validate(ValidationContext context) {
        List<SyntaxError> errors = new ArrayList<>();
        if (elementIdentifier == null || elementIdentifier.isBlank()) {
            errors.add(SyntaxError.critical(this, "ElementIdentifier", "Element identifier cannot be empty"));
        } else if (identifierKind == IdentifierKind.PATH) {
            try {
                ElementPath.parse(elementIdentifier);
            } catch (LocatorSyntaxException e) {
                errors.add(SyntaxError.error(this, "ElementIdentifier", e.getMessage()));
            }
        }
        return errors;
    }

    protected String describeTarget() {
        return identifierKind + " '" + elementIdentifier + "'";
    }

    public IdentifierKind getIdentifierKind()    { return identifierKind; }
    public String         getElementIdentifier() { return elementIdentifier; }

    public void setIdentifierKind(IdentifierKind identifierKind) {
        this.identifierKind = identifierKind != null ? identifierKind : IdentifierKind.PATH;
    }

    public void setElementIdentifier(String elementIdentifier) {
        this.elementIdentifier = elementIdentifier;
    }

    /** Sets kind and identifier together; returns this for chaining. */
    public AbstractElementAction target(IdentifierKind kind, String identifier) {
        setIdentifierKind(kind);
        setElementIdentifier(identifier);
        return this;
    }
}
