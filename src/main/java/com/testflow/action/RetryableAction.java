package com.testflow.action;

/**
 * An action that repeats its element search before giving up.
 *
 * {@code retryTimes} counts retries, not attempts: N retries means N + 1 attempts.
 */
public interface RetryableAction extends Action {

    int getRetryTimes();

    void setRetryTimes(int retryTimes);

    long getRetryDelayMillis();

    void setRetryDelayMillis(long retryDelayMillis);

    default int getAttempts() {
        return Math.max(0, getRetryTimes()) + 1;
    }
}
