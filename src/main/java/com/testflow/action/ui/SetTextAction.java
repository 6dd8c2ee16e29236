package com.testflow.action.ui;

import com.testflow.action.ActionContext;
import com.testflow.action.ActionDefinition;
import com.testflow.action.RetryableAction;
import com.testflow.locator.UiSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Locates an input element and writes text into it, replacing the current value or
 * appending to it. Locating and writing are retried together: {@code retryTimes = 3}
 * means up to four attempts with {@code retryDelayMillis} between them.
 */
@ActionDefinition(type = "SetText", category = "UI Automation",
                  description = "Set text in an input element")
public class SetTextAction extends AbstractElementAction implements RetryableAction {

    private static final Logger log = LoggerFactory.getLogger(SetTextAction.class);

    public static final int  DEFAULT_RETRY_TIMES        = 3;
    public static final long DEFAULT_RETRY_DELAY_MILLIS = 500;

    private String  text              = "";
    private boolean clearExistingText = true;
    private int     retryTimes        = DEFAULT_RETRY_TIMES;
    private long    retryDelayMillis  = DEFAULT_RETRY_DELAY_MILLIS;

    public SetTextAction() {
        super("Set Text", "Set text in an input element");
    }

    @Override
    protected boolean doExecute(ActionContext context) {
        return setText(context.requireUiSession(), context);
    }

    private <N> boolean setText(UiSession<N> session, ActionContext context) {
        int attempts = getAttempts();
        String lastProblem = "element not found";
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (context.isCancellationRequested()) {
                return false;
            }
            Optional<N> element = session.locator().find(getIdentifierKind(), getElementIdentifier());
            if (element.isPresent()) {
                try {
                    session.interactor().setText(element.get(), text, clearExistingText);
                    log.info("SetTextAction: wrote {} character(s) to {} on attempt {}/{}",
                        text.length(), describeTarget(), attempt, attempts);
                    return true;
                } catch (RuntimeException e) {
                    lastProblem = e.getMessage();
                    log.warn("SetTextAction: attempt {}/{} on {} failed: {}",
                        attempt, attempts, describeTarget(), lastProblem);
                }
            } else {
                lastProblem = "element not found";
            }
            if (attempt < attempts) {
                context.getToken().sleep(retryDelayMillis);
            }
        }
        return fail("Could not set text on " + describeTarget() + " after " + attempts
            + " attempt(s): " + lastProblem);
    }

    public String  getText()             { return text; }
    public boolean isClearExistingText() { return clearExistingText; }

    public void setText(String text)                          { this.text = text != null ? text : ""; }
    public void setClearExistingText(boolean clearExistingText) { this.clearExistingText = clearExistingText; }

    @Override public int  getRetryTimes()       { return retryTimes; }
    @Override public void setRetryTimes(int retryTimes) { this.retryTimes = retryTimes; }
    @Override public long getRetryDelayMillis() { return retryDelayMillis; }
    @Override public void setRetryDelayMillis(long retryDelayMillis) { this.retryDelayMillis = retryDelayMillis; }
}
