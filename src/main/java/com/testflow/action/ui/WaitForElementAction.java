package com.testflow.action.ui;

import com.testflow.action.ActionContext;
import com.testflow.action.ActionDefinition;
import com.testflow.flow.SyntaxError;
import com.testflow.flow.ValidationContext;
import com.testflow.locator.ElementLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Polls until the element exists or the timeout elapses, through
 * {@link ElementLocator#waitFor}. A cancel stops the wait between polls.
 */
@ActionDefinition(type = "WaitForElement", category = "UI Automation",
                  description = "Wait until a UI element exists")
public class WaitForElementAction extends AbstractElementAction {

    private static final Logger log = LoggerFactory.getLogger(WaitForElementAction.class);

    public static final long DEFAULT_TIMEOUT_MILLIS          = 30_000;
    public static final long DEFAULT_POLLING_INTERVAL_MILLIS = 100;

    private long timeoutMillis         = DEFAULT_TIMEOUT_MILLIS;
    private long pollingIntervalMillis = DEFAULT_POLLING_INTERVAL_MILLIS;

    public WaitForElementAction() {
        super("Wait for Element", "Wait until a UI element exists");
    }

    @Override
    protected boolean doExecute(ActionContext context) {
        ElementLocator<?> locator = context.requireUiSession().locator();
        long start = System.currentTimeMillis();

        boolean appeared = locator.waitFor(getIdentifierKind(), getElementIdentifier(),
                Duration.ofMillis(timeoutMillis), Duration.ofMillis(pollingIntervalMillis), context.getToken())
            .isPresent();
        if (!appeared) {
            return fail("Timed out after " + timeoutMillis + "ms waiting for " + describeTarget());
        }
        log.info("WaitForElementAction: {} appeared after {}ms", describeTarget(), System.currentTimeMillis() - start);
        return true;
    }

    @Override
    public List<SyntaxError> validate(ValidationContext context) {
        List<SyntaxError> errors = super.validate(context);
        if (timeoutMillis < 0) {
            errors.add(SyntaxError.error(this, "TimeoutMillis", "Timeout cannot be negative"));
        }
        if (pollingIntervalMillis <= 0) {
            errors.add(SyntaxError.error(this, "PollingIntervalMillis", "Polling interval must be positive"));
        }
        return errors;
    }

    public long getTimeoutMillis()         { return timeoutMillis; }
    public long getPollingIntervalMillis() { return pollingIntervalMillis; }

    public void setTimeoutMillis(long timeoutMillis)                 { this.timeoutMillis = timeoutMillis; }
    public void setPollingIntervalMillis(long pollingIntervalMillis) { this.pollingIntervalMillis = pollingIntervalMillis; }
}
