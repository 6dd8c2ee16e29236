package com.testflow.core;

import com.testflow.action.Action;
import com.testflow.action.ActionTypeRegistry;
import com.testflow.action.CancellationToken;
import com.testflow.action.CancellationTokenSource;
import com.testflow.action.ui.WaitForElementAction;
import com.testflow.expression.ElementExistsExpression;
import com.testflow.flow.Flow;
import com.testflow.flow.FlowExecutor;
import com.testflow.flow.FlowListener;
import com.testflow.flow.FlowRunResult;
import com.testflow.flow.FlowValidationException;
import com.testflow.flow.FlowValidationSummary;
import com.testflow.flow.FlowValidator;
import com.testflow.locator.ElementLocator;
import com.testflow.locator.IdentifierKind;
import com.testflow.locator.UiSession;
import com.testflow.locator.selenium.WebDriverElementProvider;
import com.testflow.locator.selenium.WebElementInteractor;
import com.testflow.persistence.FlowRepository;
import com.testflow.persistence.FlowSnapshotMapper;
import com.testflow.persistence.JsonFlowRepository;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * The entry point for hosts that build, store and run flows.
 *
 * ## Run lifecycle
 *   1. Validation (when validateBeforeRun is on). A flow with Error or Critical
 *      findings is rejected with {@link FlowValidationException} before any action runs.
 *   2. A cancellation source is registered for the flow id, so {@link #cancel} can
 *      reach the run from another thread.
 *   3. {@link FlowExecutor} runs or resumes the flow. Its result is returned as-is;
 *      faults inside actions never escape as exceptions.
 *
 * ## Factories
 * {@link #createAction} and {@link #elementExists} build actions and conditions with the
 * configured timeouts, so hosts do not repeat them.
 */
public class TestFlowEngine {

    private static final Logger log = LoggerFactory.getLogger(TestFlowEngine.class);

    private final TestFlowConfig     config;
    private final ActionTypeRegistry registry;
    private final UiSession<?>       uiSession;    // null when flows do not touch a UI
    private final FlowRepository     repository;
    private final FlowValidator      validator;
    private final FlowExecutor       executor;

    private final Map<String, CancellationTokenSource> activeRuns = new ConcurrentHashMap<>();

    public TestFlowEngine(TestFlowConfig config,
                          ActionTypeRegistry registry,
                          UiSession<?> uiSession,
                          FlowRepository repository) {
        this.config     = Objects.requireNonNull(config, "config");
        this.registry   = Objects.requireNonNull(registry, "registry");
        this.uiSession  = uiSession;
        this.repository = Objects.requireNonNull(repository, "repository");
        this.validator  = new FlowValidator();
        this.executor   = new FlowExecutor(uiSession, config.getMaxLoopIterations());

        log.info("TestFlowEngine initialized: {} action type(s), ui={}, {}",
            registry.size(), uiSession != null ? "attached" : "none", config);
    }

    /** Built-in action types and a JSON repository under the configured store path. */
    public TestFlowEngine(TestFlowConfig config, UiSession<?> uiSession) {
        this(config, new ActionTypeRegistry(), uiSession);
    }

    public TestFlowEngine(TestFlowConfig config) {
        this(config, (UiSession<?>) null);
    }

    private TestFlowEngine(TestFlowConfig config, ActionTypeRegistry registry, UiSession<?> uiSession) {
        this(config, registry, uiSession, new JsonFlowRepository(config.getFlowStorePath(),
            new FlowSnapshotMapper(registry, uiSession != null ? uiSession.locator() : null)));
    }

    /** An engine whose UI actions drive the browser behind {@code driver}. */
    public static TestFlowEngine forWebDriver(TestFlowConfig config, WebDriver driver) {
        ElementLocator<WebElement> locator =
            new ElementLocator<>(new WebDriverElementProvider(driver), config.toLocatorOptions());
        return new TestFlowEngine(config, new UiSession<>(locator, new WebElementInteractor(driver)));
    }

    // ── Validation ────────────────────────────────────────────────────────────

    public FlowValidationSummary validate(Flow flow) {
        return validator.validate(flow);
    }

    // ── Execution ─────────────────────────────────────────────────────────────

    /**
     * Runs or resumes the flow on the calling thread.
     *
     * @throws FlowValidationException when validation is on and the flow is invalid
     * @throws IllegalStateException   when the flow is already running
     */
    public FlowRunResult run(Flow flow) {
        validateIfConfigured(flow);
        return execute(flow, token -> executor.run(flow, token));
    }

    /** Runs the flow from one of its top-level actions; earlier actions are not run. */
    public FlowRunResult runFrom(Flow flow, Action action) {
        validateIfConfigured(flow);
        return execute(flow, token -> executor.runFrom(flow, action, token));
    }

    /**
     * Validates on the calling thread, then runs the flow on {@code pool}.
     *
     * @throws FlowValidationException when validation is on and the flow is invalid
     */
    public CompletableFuture<FlowRunResult> runAsync(Flow flow, Executor pool) {
        validateIfConfigured(flow);
        return CompletableFuture.supplyAsync(() -> execute(flow, token -> executor.run(flow, token)), pool);
    }

    /**
     * Requests a cooperative stop of the flow's active run. The run pauses at the next
     * cancellation point and can be resumed with {@link #run}.
     *
     * @return false when the flow has no active run
     */
    public boolean cancel(Flow flow) {
        CancellationTokenSource source = activeRuns.get(flow.getId());
        if (source == null) {
            log.debug("TestFlowEngine: cancel ignored, flow '{}' is not running", flow.getName());
            return false;
        }
        log.info("TestFlowEngine: Cancelling flow '{}'", flow.getName());
        source.cancel();
        return true;
    }

    public void addListener(FlowListener listener)    { executor.addListener(listener); }
    public void removeListener(FlowListener listener) { executor.removeListener(listener); }

    private FlowRunResult execute(Flow flow, Function<CancellationToken, FlowRunResult> run) {
        CancellationTokenSource source = new CancellationTokenSource();
        if (activeRuns.putIfAbsent(flow.getId(), source) != null) {
            source.close();
            throw new IllegalStateException("Flow '" + flow.getName() + "' is already running");
        }
        try {
            return run.apply(source.getToken());
        } finally {
            activeRuns.remove(flow.getId(), source);
            source.close();
        }
    }

    private void validateIfConfigured(Flow flow) {
        if (!config.isValidateBeforeRun()) return;
        FlowValidationSummary summary = validator.validate(flow);
        if (!summary.isValid()) {
            log.warn("TestFlowEngine: Flow '{}' rejected: {}", flow.getName(), summary.getSummary());
            throw new FlowValidationException(flow.getName(), summary);
        }
    }

    // ── Persistence ───────────────────────────────────────────────────────────

    public void save(Flow flow) {
        repository.save(flow);
    }

    public Optional<Flow> load(String id) {
        return repository.load(id);
    }

    /**
     * Loads a stored flow and runs it from the start.
     *
     * @throws IllegalArgumentException when no flow is stored under {@code id}
     */
    public FlowRunResult loadAndRun(String id) {
        Flow flow = repository.load(id)
            .orElseThrow(() -> new IllegalArgumentException("No flow stored with id '" + id + "'"));
        return run(flow);
    }

    // ── Factories ─────────────────────────────────────────────────────────────

    /**
     * A new action of the registered type, with configured wait defaults applied.
     *
     * @throws IllegalArgumentException for an unknown type
     */
    public Action createAction(String type) {
        Action action = registry.create(type)
            .orElseThrow(() -> new IllegalArgumentException("Unknown action type: " + type));
        if (action instanceof WaitForElementAction wait) {
            wait.setTimeoutMillis(config.getWaitTimeoutMillis());
            wait.setPollingIntervalMillis(config.getPollingIntervalMillis());
        }
        return action;
    }

    /**
     * An element-exists condition over the attached UI, with the configured attempts and
     * sleep between them.
     *
     * @throws IllegalStateException when the engine has no UI session
     */
    public ElementExistsExpression<?> elementExists(IdentifierKind kind, String identifier) {
        if (uiSession == null) {
            throw new IllegalStateException("Element conditions need a UI session; this engine has none");
        }
        return ElementExistsExpression.of(uiSession.locator(), kind, identifier,
            config.getExistsRetryTimes(), config.getExistsTimeoutMillis());
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public TestFlowConfig     getConfig()     { return config; }
    public ActionTypeRegistry getRegistry()   { return registry; }
    public FlowRepository     getRepository() { return repository; }
    public UiSession<?>       getUiSession()  { return uiSession; }
}
