package com.testflow.action.ui;

import com.testflow.action.ActionContext;
import com.testflow.action.ActionDefinition;
import com.testflow.flow.SyntaxError;
import com.testflow.flow.ValidationContext;
import com.testflow.locator.ElementAttribute;
import com.testflow.locator.ElementProvider;
import com.testflow.locator.IdentifierKind;
import com.testflow.locator.UiSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Checks whether a top-level window shows some text.
 *
 * The window is the first direct child of the provider's root whose Name (or
 * AutomationId) equals the identifier. The window's own Name and Value are checked
 * first; with deep search on, its descendants follow in pre-order, bounded by the
 * locator's maximum depth.
 *
 * The action completes successfully whether or not the text is found, including when
 * no window matches; {@link #isTextFound()} holds the answer.
 */
@ActionDefinition(type = "IfWindowContainsText", category = "UI Automation",
                  description = "Check whether a window contains text")
public class IfWindowContainsTextAction extends AbstractElementAction {

    private static final Logger log = LoggerFactory.getLogger(IfWindowContainsTextAction.class);

    private String  searchText    = "";
    private boolean caseSensitive = false;
    private boolean deepSearch    = true;
    private volatile boolean textFound;

    public IfWindowContainsTextAction() {
        super("If Window Contains Text", "Check whether a window contains text");
        setIdentifierKind(IdentifierKind.NAME);
    }

    @Override
    protected boolean doExecute(ActionContext context) {
        textFound = false;
        if (getElementIdentifier() == null || getElementIdentifier().isBlank()) {
            return fail("Window identifier cannot be empty");
        }
        if (searchText.isBlank()) {
            return fail("Search text cannot be empty");
        }
        return check(context.requireUiSession(), context);
    }

    private <N> boolean check(UiSession<N> session, ActionContext context) {
        ElementProvider<N> provider = session.locator().getProvider();
        Optional<N> window = findWindow(provider);
        if (window.isEmpty()) {
            log.info("IfWindowContainsTextAction: no window {}, text counts as absent", describeTarget());
            return true;
        }
        int depth = deepSearch ? session.locator().getOptions().maxDepth() : 0;
        textFound = contains(provider, window.get(), depth, context);
        log.info("IfWindowContainsTextAction: '{}' {} in window {}",
            searchText, textFound ? "found" : "not found", describeTarget());
        return true;
    }

    private <N> Optional<N> findWindow(ElementProvider<N> provider) {
        ElementAttribute attribute = getIdentifierKind() == IdentifierKind.AUTOMATION_ID
            ? ElementAttribute.AUTOMATION_ID
            : ElementAttribute.NAME;
        List<N> windows;
        try {
            windows = provider.getChildren(provider.getRoot());
        } catch (RuntimeException e) {
            log.warn("IfWindowContainsTextAction: top-level windows unreadable: {}", e.getMessage());
            return Optional.empty();
        }
        for (N child : windows) {
            if (read(provider, child, attribute).filter(getElementIdentifier()::equals).isPresent()) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    private <N> boolean contains(ElementProvider<N> provider, N node, int depth, ActionContext context) {
        context.getToken().throwIfCancellationRequested();
        if (read(provider, node, ElementAttribute.NAME).filter(this::matches).isPresent()
            || read(provider, node, ElementAttribute.VALUE).filter(this::matches).isPresent()) {
            return true;
        }
        if (depth <= 0) {
            return false;
        }
        List<N> children;
        try {
            children = provider.getChildren(node);
        } catch (RuntimeException e) {
            log.debug("IfWindowContainsTextAction: skipping children of an unreadable node: {}", e.getMessage());
            return false;
        }
        for (N child : children) {
            if (contains(provider, child, depth - 1, context)) {
                return true;
            }
        }
        return false;
    }

    private static <N> Optional<String> read(ElementProvider<N> provider, N node, ElementAttribute attribute) {
        try {
            return provider.getAttribute(node, attribute);
        } catch (RuntimeException e) {
            log.debug("IfWindowContainsTextAction: {} unreadable: {}", attribute, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean matches(String text) {
        if (text == null || text.isEmpty()) return false;
        if (caseSensitive) return text.contains(searchText);
        return text.toLowerCase(Locale.ROOT).contains(searchText.toLowerCase(Locale.ROOT));
    }

    /** Window kind must be NAME or AUTOMATION_ID; blank search text is CRITICAL. */
    @Override
    public List<SyntaxError> validate(ValidationContext context) {
        List<SyntaxError> errors = super.validate(context);
        if (getIdentifierKind() != IdentifierKind.NAME && getIdentifierKind() != IdentifierKind.AUTOMATION_ID) {
            errors.add(SyntaxError.error(this, "IdentifierKind",
                "Window must be identified by NAME or AUTOMATION_ID, not " + getIdentifierKind()));
        }
        if (searchText.isBlank()) {
            errors.add(SyntaxError.critical(this, "SearchText", "Search text cannot be empty"));
        }
        return errors;
    }

    /** Whether the last execution found the text. */
    public boolean isTextFound()     { return textFound; }
    public String  getSearchText()   { return searchText; }
    public boolean isCaseSensitive() { return caseSensitive; }
    public boolean isDeepSearch()    { return deepSearch; }

    public void setSearchText(String searchText)        { this.searchText = searchText != null ? searchText : ""; }
    public void setCaseSensitive(boolean caseSensitive) { this.caseSensitive = caseSensitive; }
    public void setDeepSearch(boolean deepSearch)       { this.deepSearch = deepSearch; }
}
