package com.testflow.action.ui;

import com.testflow.action.ActionContext;
import com.testflow.action.ActionDefinition;
import com.testflow.action.RetryableAction;
import com.testflow.locator.ElementInteractor;
import com.testflow.locator.UiSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Locates an element, retrying as configured, and clicks it.
 *
 * With {@code useInvoke} the element's default action is triggered without a pointer
 * event, which reaches elements behind an overlay; when the element has none the
 * action falls back to a plain click. Otherwise a single or double click is performed.
 */
@ActionDefinition(type = "ClickElement", category = "UI Automation",
                  description = "Click on a UI element")
public class ClickElementAction extends AbstractElementAction implements RetryableAction {

    private static final Logger log = LoggerFactory.getLogger(ClickElementAction.class);

    public static final long DEFAULT_RETRY_DELAY_MILLIS = 500;

    private boolean doubleClick;
    private boolean useInvoke;
    private int     retryTimes;
    private long    retryDelayMillis = DEFAULT_RETRY_DELAY_MILLIS;

    public ClickElementAction() {
        super("Click Element", "Click on a UI element");
    }

    @Override
    protected boolean doExecute(ActionContext context) {
        return click(context.requireUiSession(), context);
    }

    private <N> boolean click(UiSession<N> session, ActionContext context) {
        Optional<N> element = session.locator().findWithRetry(
            getIdentifierKind(), getElementIdentifier(), getAttempts(), retryDelayMillis, context.getToken());
        if (element.isEmpty()) {
            if (context.isCancellationRequested()) return false;
            return fail("Element not found: " + describeTarget());
        }

        ElementInteractor<N> interactor = session.interactor();
        N node = element.get();
        try {
            if (useInvoke) {
                if (!interactor.invoke(node)) {
                    log.debug("ClickElementAction: invoke unsupported for {}, clicking instead", describeTarget());
                    interactor.click(node);
                }
            } else if (doubleClick) {
                interactor.doubleClick(node);
            } else {
                interactor.click(node);
            }
        } catch (RuntimeException e) {
            return fail("Could not click " + describeTarget() + ": " + e.getMessage());
        }
        log.info("ClickElementAction: clicked {}", describeTarget());
        return true;
    }

    public boolean isDoubleClick() { return doubleClick; }
    public boolean isUseInvoke()   { return useInvoke; }

    public void setDoubleClick(boolean doubleClick) { this.doubleClick = doubleClick; }
    public void setUseInvoke(boolean useInvoke)     { this.useInvoke = useInvoke; }

    @Override public int  getRetryTimes()       { return retryTimes; }
    @Override public void setRetryTimes(int retryTimes) { this.retryTimes = retryTimes; }
    @Override public long getRetryDelayMillis() { return retryDelayMillis; }
    @Override public void setRetryDelayMillis(long retryDelayMillis) { this.retryDelayMillis = retryDelayMillis; }
}
