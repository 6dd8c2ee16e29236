package com.testflow.expression;

import com.testflow.action.ActionCancelledException;
import com.testflow.action.CancellationToken;
import com.testflow.locator.ElementLocator;
import com.testflow.locator.IdentifierKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * True when the locator finds the element, false otherwise.
 *
 * The search is attempted {@code retryTimes} times (at least once) with
 * {@code timeoutMillis} of sleep between attempts. An exception raised while
 * searching, such as a malformed path, evaluates to false. A cancel is the exception:
 * {@link ActionCancelledException} propagates so the running action pauses.
 *
 * @param <N> the locator's node type
 */
public class ElementExistsExpression<N> extends Expression<Boolean> {

    private static final Logger log = LoggerFactory.getLogger(ElementExistsExpression.class);

    public static final int  DEFAULT_RETRY_TIMES    = 1;
    public static final long DEFAULT_TIMEOUT_MILLIS = 1000;

    private final ElementLocator<N> locator;
    private final IdentifierKind    identifierKind;
    private final String            identifier;
    private int                     retryTimes    = DEFAULT_RETRY_TIMES;
    private long                    timeoutMillis = DEFAULT_TIMEOUT_MILLIS;
    private CancellationToken       token         = CancellationToken.NONE;

    public ElementExistsExpression(ElementLocator<N> locator, IdentifierKind identifierKind, String identifier) {
        super(Boolean.class);
        this.locator        = Objects.requireNonNull(locator, "locator");
        this.identifierKind = Objects.requireNonNull(identifierKind, "identifierKind");
        this.identifier     = identifier;
    }

    public static <N> ElementExistsExpression<N> of(ElementLocator<N> locator,
                                                    IdentifierKind identifierKind,
                                                    String identifier,
                                                    int retryTimes,
                                                    long timeoutMillis) {
        ElementExistsExpression<N> expression = new ElementExistsExpression<>(locator, identifierKind, identifier);
        expression.setRetryTimes(retryTimes);
        expression.setTimeoutMillis(timeoutMillis);
        return expression;
    }

    public IdentifierKind getIdentifierKind() { return identifierKind; }
    public String         getIdentifier()     { return identifier; }
    public int            getRetryTimes()     { return retryTimes; }
    public long           getTimeoutMillis()  { return timeoutMillis; }

    public void setRetryTimes(int retryTimes)       { this.retryTimes = retryTimes; }
    public void setTimeoutMillis(long timeoutMillis) { this.timeoutMillis = timeoutMillis; }

    /** Lets a running action stop the retry sleep early. */
    public void setCancellationToken(CancellationToken token) {
        this.token = token != null ? token : CancellationToken.NONE;
    }

    @Override
    protected Boolean doEvaluate() {
        try {
            return locator.findWithRetry(identifierKind, identifier, retryTimes, timeoutMillis, token)
                .isPresent();
        } catch (ActionCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debug("ElementExistsExpression: {} '{}' treated as absent: {}",
                identifierKind, identifier, e.getMessage());
            return false;
        }
    }

    @Override
    public String toSourceText() {
        return "exists(" + identifierKind + ", '" + identifier + "')";
    }
}
