package com.testflow.core;

import com.testflow.expression.ElementExistsExpression;
import com.testflow.locator.LocatorOptions;
import com.testflow.action.ui.WaitForElementAction;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Function;

/**
 * Configuration for the TestFlow engine.
 *
 * Load from environment variables or construct programmatically.
 *
 * Environment variables:
 *   TESTFLOW_LOCATOR_MAX_DEPTH      - Depth bound for element searches (default: 12)
 *   TESTFLOW_EXISTS_TIMEOUT_MS      - Sleep between element-exists attempts (default: 1000)
 *   TESTFLOW_EXISTS_RETRY_TIMES     - Element-exists attempts (default: 1)
 *   TESTFLOW_WAIT_TIMEOUT_MS        - Wait-for-element timeout (default: 30000)
 *   TESTFLOW_POLL_INTERVAL_MS       - Wait-for-element polling interval (default: 100)
 *   TESTFLOW_MAX_LOOP_ITERATIONS    - Iteration guard for while and for loops; 0 = unlimited (default: 0)
 *   TESTFLOW_VALIDATE_BEFORE_RUN    - Validate every flow before running it (default: true)
 *   TESTFLOW_FLOW_STORE_PATH        - Directory holding saved flows (default: target/flows)
 *
 * Malformed numeric values fall back to the default.
 */
public class TestFlowConfig {

    public static final Path DEFAULT_FLOW_STORE_PATH = Paths.get("target/flows");

    private final int     locatorMaxDepth;
    private final long    existsTimeoutMillis;
    private final int     existsRetryTimes;
    private final long    waitTimeoutMillis;
    private final long    pollingIntervalMillis;
    private final int     maxLoopIterations;   // 0 = unlimited
    private final boolean validateBeforeRun;
    private final Path    flowStorePath;

    private TestFlowConfig(Builder b) {
        this.locatorMaxDepth       = b.locatorMaxDepth;
        this.existsTimeoutMillis   = b.existsTimeoutMillis;
        this.existsRetryTimes      = b.existsRetryTimes;
        this.waitTimeoutMillis     = b.waitTimeoutMillis;
        this.pollingIntervalMillis = b.pollingIntervalMillis;
        this.maxLoopIterations     = b.maxLoopIterations;
        this.validateBeforeRun     = b.validateBeforeRun;
        this.flowStorePath         = b.flowStorePath;
    }

    // ── Static factory: load from environment variables ───────────────────────

    public static TestFlowConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /** Reads settings through {@code env} instead of the process environment. */
    public static TestFlowConfig fromEnvironment(Function<String, String> env) {
        return builder()
            .locatorMaxDepth(intEnvOrDefault(env, "TESTFLOW_LOCATOR_MAX_DEPTH", LocatorOptions.DEFAULT_MAX_DEPTH))
            .existsTimeoutMillis(longEnvOrDefault(env, "TESTFLOW_EXISTS_TIMEOUT_MS", ElementExistsExpression.DEFAULT_TIMEOUT_MILLIS))
            .existsRetryTimes(intEnvOrDefault(env, "TESTFLOW_EXISTS_RETRY_TIMES", ElementExistsExpression.DEFAULT_RETRY_TIMES))
            .waitTimeoutMillis(longEnvOrDefault(env, "TESTFLOW_WAIT_TIMEOUT_MS", WaitForElementAction.DEFAULT_TIMEOUT_MILLIS))
            .pollingIntervalMillis(longEnvOrDefault(env, "TESTFLOW_POLL_INTERVAL_MS", WaitForElementAction.DEFAULT_POLLING_INTERVAL_MILLIS))
            .maxLoopIterations(intEnvOrDefault(env, "TESTFLOW_MAX_LOOP_ITERATIONS", 0))
            .validateBeforeRun(boolEnvOrDefault(env, "TESTFLOW_VALIDATE_BEFORE_RUN", true))
            .flowStorePath(Paths.get(envOrDefault(env, "TESTFLOW_FLOW_STORE_PATH", DEFAULT_FLOW_STORE_PATH.toString())))
            .build();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public int     getLocatorMaxDepth()       { return locatorMaxDepth; }
    public long    getExistsTimeoutMillis()   { return existsTimeoutMillis; }
    public int     getExistsRetryTimes()      { return existsRetryTimes; }
    public long    getWaitTimeoutMillis()     { return waitTimeoutMillis; }
    public long    getPollingIntervalMillis() { return pollingIntervalMillis; }
    public int     getMaxLoopIterations()     { return maxLoopIterations; }
    public boolean isValidateBeforeRun()      { return validateBeforeRun; }
    public Path    getFlowStorePath()         { return flowStorePath; }

    public LocatorOptions toLocatorOptions() {
        return new LocatorOptions(locatorMaxDepth);
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private int     locatorMaxDepth       = LocatorOptions.DEFAULT_MAX_DEPTH;
        private long    existsTimeoutMillis   = ElementExistsExpression.DEFAULT_TIMEOUT_MILLIS;
        private int     existsRetryTimes      = ElementExistsExpression.DEFAULT_RETRY_TIMES;
        private long    waitTimeoutMillis     = WaitForElementAction.DEFAULT_TIMEOUT_MILLIS;
        private long    pollingIntervalMillis = WaitForElementAction.DEFAULT_POLLING_INTERVAL_MILLIS;
        private int     maxLoopIterations     = 0;
        private boolean validateBeforeRun     = true;
        private Path    flowStorePath         = DEFAULT_FLOW_STORE_PATH;

        public Builder locatorMaxDepth(int depth)          { this.locatorMaxDepth = depth; return this; }
        public Builder existsTimeoutMillis(long millis)    { this.existsTimeoutMillis = millis; return this; }
        public Builder existsRetryTimes(int times)         { this.existsRetryTimes = times; return this; }
        public Builder waitTimeoutMillis(long millis)      { this.waitTimeoutMillis = millis; return this; }
        public Builder pollingIntervalMillis(long millis)  { this.pollingIntervalMillis = millis; return this; }
        public Builder maxLoopIterations(int n)            { this.maxLoopIterations = n; return this; }
        public Builder validateBeforeRun(boolean b)        { this.validateBeforeRun = b; return this; }
        public Builder flowStorePath(Path path)            { this.flowStorePath = path; return this; }

        public TestFlowConfig build() {
            if (locatorMaxDepth < 1) {
                throw new IllegalStateException("locatorMaxDepth must be at least 1, got " + locatorMaxDepth);
            }
            if (maxLoopIterations < 0) {
                throw new IllegalStateException("maxLoopIterations cannot be negative, got " + maxLoopIterations);
            }
            if (flowStorePath == null) {
                flowStorePath = DEFAULT_FLOW_STORE_PATH;
            }
            return new TestFlowConfig(this);
        }
    }

    // ── Env helpers ───────────────────────────────────────────────────────────

    private static String envOrDefault(Function<String, String> env, String key, String defaultValue) {
        String val = env.apply(key);
        return (val != null && !val.isBlank()) ? val.trim() : defaultValue;
    }

    private static int intEnvOrDefault(Function<String, String> env, String key, int defaultValue) {
        try {
            String val = env.apply(key);
            return (val != null && !val.isBlank()) ? Integer.parseInt(val.trim()) : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static long longEnvOrDefault(Function<String, String> env, String key, long defaultValue) {
        try {
            String val = env.apply(key);
            return (val != null && !val.isBlank()) ? Long.parseLong(val.trim()) : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static boolean boolEnvOrDefault(Function<String, String> env, String key, boolean defaultValue) {
        String val = env.apply(key);
        if (val == null || val.isBlank()) return defaultValue;
        return "true".equalsIgnoreCase(val.trim()) || "1".equals(val.trim());
    }

    @Override
    public String toString() {
        return "TestFlowConfig{maxDepth=" + locatorMaxDepth + ", exists=" + existsRetryTimes + "x" + existsTimeoutMillis
            + "ms, wait=" + waitTimeoutMillis + "ms/" + pollingIntervalMillis + "ms, maxLoop=" + maxLoopIterations
            + ", validateBeforeRun=" + validateBeforeRun + ", store=" + flowStorePath + "}";
    }
}
