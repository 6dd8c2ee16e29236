package com.testflow.locator;

import com.testflow.action.ActionCancelledException;
import com.testflow.action.CancellationToken;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.support.ui.FluentWait;
import org.openqa.selenium.support.ui.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves an identifier to a node of an {@link ElementProvider} tree.
 *
 * ## Path search
 * Depth-first with backtracking. At each level only the direct children of the current
 * node are considered; each child matching the current segment is descended into, and
 * when its subtree cannot satisfy the remaining segments the next matching sibling is
 * tried. The first complete match in left-to-right sibling order wins. A search never
 * descends more than {@link LocatorOptions#maxDepth()} segments.
 *
 * A path that starts with an identified {@code Window} segment resolves the window
 * among the root's direct children first, matching the whole segment (control type,
 * AutomationId, Name and ClassName as given), and then searches the remaining segments
 * inside that window only.
 *
 * ## Identifier searches
 * AUTOMATION_ID, NAME and CLASS_NAME return the first descendant in pre-order whose
 * attribute equals the identifier, bounded by the same depth.
 *
 * ## Retries
 * Both retrying searches poll through a Selenium {@link FluentWait} whose sleeper
 * observes the caller's {@link CancellationToken}. {@link #findWithRetry} counts
 * attempts, {@link #waitFor} counts wall-clock time.
 *
 * ## Failure semantics
 * "Not found" is an empty Optional, never an exception. Provider exceptions during an
 * attempt are logged and count as not found. Only a malformed path raises
 * ({@link LocatorSyntaxException}), and it does so before any attempt is made.
 *
 * @param <N> the provider's node type
 */
public class ElementLocator<N> {

    private static final Logger log = LoggerFactory.getLogger(ElementLocator.class);

    private final ElementProvider<N> provider;
    private final LocatorOptions     options;

    public ElementLocator(ElementProvider<N> provider, LocatorOptions options) {
        this.provider = provider;
        this.options  = options != null ? options : LocatorOptions.defaults();
    }

    public ElementLocator(ElementProvider<N> provider) {
        this(provider, LocatorOptions.defaults());
    }

    public ElementProvider<N> getProvider() { return provider; }
    public LocatorOptions     getOptions()  { return options; }

    // ── Single attempt ────────────────────────────────────────────────────────

    /** Searches from the provider's root. */
    public Optional<N> find(IdentifierKind kind, String identifier) {
        Query query = query(kind, identifier);
        return attempt(query, null);
    }

    /** Searches from {@code root}. */
    public Optional<N> find(N root, IdentifierKind kind, String identifier) {
        Query query = query(kind, identifier);
        return attempt(query, root);
    }

    // ── Retry ─────────────────────────────────────────────────────────────────

    /**
     * Searches up to {@code attempts} times (at least once), sleeping {@code delayMillis}
     * between attempts but not after the last one.
     *
     * @throws LocatorSyntaxException  for a malformed path, before the first attempt
     * @throws ActionCancelledException when {@code token} is cancelled between attempts
     */
    public Optional<N> findWithRetry(IdentifierKind kind, String identifier,
                                     int attempts, long delayMillis, CancellationToken token) {
        Query query = query(kind, identifier);
        int total = Math.max(1, attempts);
        AttemptClock clock = new AttemptClock();
        FluentWait<Query> wait = new FluentWait<>(query, clock, sleeper(token))
            .withTimeout(Duration.ofSeconds(total - 1L))
            .pollingEvery(Duration.ofMillis(Math.max(0, delayMillis)));

        return poll(wait, q -> {
            token.throwIfCancellationRequested();
            Optional<N> result = attempt(q, null);
            int made = clock.countAttempt();
            if (result.isPresent() && made > 1) {
                log.debug("ElementLocator: found '{}' on attempt {}/{}", identifier, made, total);
            } else if (result.isEmpty() && made < total) {
                log.debug("ElementLocator: '{}' not found (attempt {}/{}), retrying in {}ms",
                    identifier, made, total, delayMillis);
            }
            return result.orElse(null);
        });
    }

    /**
     * Polls every {@code pollingInterval} until the element appears or {@code timeout}
     * has elapsed. A zero or negative timeout searches exactly once.
     *
     * @throws LocatorSyntaxException  for a malformed path, before the first attempt
     * @throws ActionCancelledException when {@code token} is cancelled while waiting
     */
    public Optional<N> waitFor(IdentifierKind kind, String identifier,
                               Duration timeout, Duration pollingInterval, CancellationToken token) {
        Query query = query(kind, identifier);
        if (timeout.isNegative() || timeout.isZero()) {
            token.throwIfCancellationRequested();
            return attempt(query, null);
        }
        FluentWait<Query> wait = new FluentWait<>(query, Clock.systemUTC(), sleeper(token))
            .withTimeout(timeout)
            .pollingEvery(pollingInterval.isNegative() ? Duration.ZERO : pollingInterval);

        return poll(wait, q -> {
            token.throwIfCancellationRequested();
            return attempt(q, null).orElse(null);
        });
    }

    private Optional<N> poll(FluentWait<Query> wait, Function<Query, N> search) {
        try {
            return Optional.of(wait.until(search));
        } catch (TimeoutException e) {
            return Optional.empty();
        }
    }

    private static Sleeper sleeper(CancellationToken token) {
        return duration -> token.sleep(duration.toMillis());
    }

    /** Advances one second per attempt, so a FluentWait timeout counts attempts. */
    private static final class AttemptClock extends Clock {

        private Instant now = Instant.EPOCH;
        private int     attempts;

        int countAttempt() {
            now = now.plusSeconds(1);
            return ++attempts;
        }

        @Override public Instant instant()              { return now; }
        @Override public ZoneId  getZone()              { return ZoneOffset.UTC; }
        @Override public Clock   withZone(ZoneId zone)  { return this; }
    }

    // ── Path search ───────────────────────────────────────────────────────────

    public Optional<N> findByPath(N root, ElementPath path) {
        N start = root;
        List<PathSegment> segments = path.getSegments();

        Optional<PathSegment> window = path.windowSegment();
        if (window.isPresent()) {
            Optional<N> resolved = findWindow(root, window.get());
            if (resolved.isEmpty()) {
                log.debug("ElementLocator: no window matching {}", window.get());
                return Optional.empty();
            }
            start    = resolved.get();
            segments = path.tail();
        }
        return findBySegments(start, segments, 0);
    }

    private Optional<N> findWindow(N root, PathSegment window) {
        for (N child : provider.getChildren(root)) {
            if (window.matches(provider, child)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    private Optional<N> findBySegments(N current, List<PathSegment> segments, int level) {
        if (level == segments.size()) {
            return Optional.of(current);
        }
        if (level >= options.maxDepth()) {
            return Optional.empty();
        }
        PathSegment segment = segments.get(level);
        for (N child : provider.getChildren(current)) {
            if (!segment.matches(provider, child)) continue;
            Optional<N> found = findBySegments(child, segments, level + 1);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    // ── Descendant search ─────────────────────────────────────────────────────

    public Optional<N> findDescendant(N root, ElementAttribute attribute, String value) {
        return findDescendant(root, attribute, value, 1);
    }

    private Optional<N> findDescendant(N node, ElementAttribute attribute, String value, int depth) {
        if (depth > options.maxDepth()) {
            return Optional.empty();
        }
        for (N child : provider.getChildren(node)) {
            if (provider.getAttribute(child, attribute).filter(value::equals).isPresent()) {
                return Optional.of(child);
            }
            Optional<N> found = findDescendant(child, attribute, value, depth + 1);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    // ── Internals ─────────────────────────────────────────────────────────────

    private record Query(IdentifierKind kind, String identifier, ElementPath path) {}

    private Query query(IdentifierKind kind, String identifier) {
        if (kind == null) {
            throw new IllegalArgumentException("Identifier kind cannot be null");
        }
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Element identifier cannot be empty");
        }
        ElementPath path = kind == IdentifierKind.PATH ? ElementPath.parse(identifier) : null;
        return new Query(kind, identifier, path);
    }

    private Optional<N> attempt(Query query, N root) {
        try {
            N start = root != null ? root : provider.getRoot();
            Optional<N> result = switch (query.kind()) {
                case PATH          -> findByPath(start, query.path());
                case AUTOMATION_ID -> findDescendant(start, ElementAttribute.AUTOMATION_ID, query.identifier());
                case NAME          -> findDescendant(start, ElementAttribute.NAME, query.identifier());
                case CLASS_NAME    -> findDescendant(start, ElementAttribute.CLASS_NAME, query.identifier());
            };
            log.debug("ElementLocator: {} '{}' -> {}", query.kind(), query.identifier(),
                result.isPresent() ? "found" : "not found");
            return result;
        } catch (ActionCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("ElementLocator: search for {} '{}' failed: {}",
                query.kind(), query.identifier(), e.getMessage());
            return Optional.empty();
        }
    }
}
