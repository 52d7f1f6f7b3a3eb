package org.carball.nplusone.tracking;

import lombok.extern.slf4j.Slf4j;
import org.carball.nplusone.analyzer.NPlusOneAggregator;
import org.carball.nplusone.config.TrackerSettings;
import org.carball.nplusone.fingerprint.FingerprintEngine;
import org.carball.nplusone.model.AggregationResult;
import org.carball.nplusone.model.Dialect;
import org.carball.nplusone.model.QueryEvent;
import org.carball.nplusone.model.StackMatcher;
import org.carball.nplusone.output.NotificationDispatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point for N+1 detection. Each thread gets its own {@link TrackingSession};
 * scopes on different threads never see each other's queries.
 *
 * <pre>{@code
 * QueryTracker tracker = new QueryTracker(settings);
 * tracker.scan(() -> {
 *     orderService.loadOrdersWithCustomers();
 * });
 * }</pre>
 */
@Slf4j
public class QueryTracker implements QueryObserver {

    static final String READ_MARKER = "SELECT";

    private final TrackerSettings settings;
    private final NPlusOneAggregator aggregator;
    private final NotificationDispatcher dispatcher;
    private final ThreadLocal<TrackingSession> sessions = ThreadLocal.withInitial(TrackingSession::new);

    public QueryTracker(TrackerSettings settings) {
        this(settings, FingerprintEngine.defaults(), NotificationDispatcher.fromSettings(settings));
    }

    public QueryTracker(TrackerSettings settings, FingerprintEngine fingerprintEngine, NotificationDispatcher dispatcher) {
        this.settings = settings;
        this.aggregator = new NPlusOneAggregator(fingerprintEngine, settings.getMinNQueries());
        this.dispatcher = dispatcher;
    }

    // -----------------------------------------------------------------------
    // Scope control
    // -----------------------------------------------------------------------

    /**
     * Starts tracking on the current thread. Inside an open scope this only opens a
     * nested level that shares the outer state. Does nothing when detection is disabled.
     */
    public void scan() {
        if (!settings.isEnabled()) {
            return;
        }

        TrackingSession session = session();
        if (session.isTracking()) {
            session.enterNested();
            return;
        }

        session.start();
        log.debug("N+1 tracking started on {}", Thread.currentThread().getName());
    }

    public void scan(Runnable block) {
        scan(() -> {
            block.run();
            return null;
        });
    }

    /**
     * Runs {@code block} in its own scope and reports when it completes normally.
     * When detection is disabled or a scope is already open the block simply runs
     * inside whatever is there. If the block throws, the observations are dropped.
     */
    public <T> T scan(Supplier<T> block) {
        TrackingSession session = session();
        if (!settings.isEnabled() || session.isTracking()) {
            return block.get();
        }

        scan();
        boolean completed = false;
        try {
            T result = block.get();
            completed = true;
            complete(session);
            return result;
        } finally {
            if (!completed) {
                log.debug("Scope aborted by exception, discarding {} call sites", session.counters().size());
                session.tearDown();
                release(session);
            }
        }
    }

    /**
     * Ends the current scope. The outermost end aggregates, reports and clears the
     * thread's state; ending a nested level or a thread that is not tracking does nothing.
     *
     * @return the detections handed to the reporting sinks, empty when none
     */
    public AggregationResult finish() {
        TrackingSession session = session();
        if (!session.isTracking()) {
            return AggregationResult.empty();
        }
        if (session.exitNested()) {
            return AggregationResult.empty();
        }
        return complete(session);
    }

    private AggregationResult complete(TrackingSession session) {
        AggregationResult result;
        try {
            result = aggregator.aggregate(session, callerAllowList(session));
        } finally {
            session.tearDown();
            release(session);
        }

        log.debug("N+1 tracking finished on {} with {} detections", Thread.currentThread().getName(), result.size());
        dispatcher.dispatch(result);
        return result;
    }

    public void pause() {
        if (settings.isIgnorePauses()) {
            return;
        }
        session().pause();
    }

    public void pause(Runnable block) {
        pause(() -> {
            block.run();
            return null;
        });
    }

    /**
     * Runs {@code block} without tracking and restores the previous state afterwards,
     * whether the block returns or throws.
     */
    public <T> T pause(Supplier<T> block) {
        if (settings.isIgnorePauses()) {
            return block.get();
        }

        TrackingSession session = session();
        SessionState previous = session.getState();
        session.pause();
        try {
            return block.get();
        } finally {
            session.restore(previous);
        }
    }

    public void resume() {
        session().resume();
    }

    // -----------------------------------------------------------------------
    // Observation
    // -----------------------------------------------------------------------

    /**
     * Records a read query unless it is schema introspection, served from cache or ignored.
     */
    @Override
    public void onQueryObserved(QueryEvent event) {
        TrackingSession session = session();
        if (!session.isScanning()) {
            return;
        }

        String sql = event.sql();
        if (event.isSchemaQuery() || sql == null || !sql.contains(READ_MARKER) || event.cached()) {
            return;
        }
        if (settings.isIgnored(sql)) {
            log.debug("Ignoring query matched by ignore list: {}", sql);
            return;
        }

        session.record(sql, event.callStack(), event.dialect() != null ? event.dialect() : settings.getDefaultDialect());
    }

    /**
     * Records a query as-is, without the filters of {@link #onQueryObserved(QueryEvent)}.
     */
    public void recordQuery(String sql, List<String> callStack) {
        recordQuery(sql, callStack, settings.getDefaultDialect());
    }

    public void recordQuery(String sql, List<String> callStack, Dialect dialect) {
        session().record(sql, callStack == null ? List.of() : callStack, dialect);
    }

    // -----------------------------------------------------------------------
    // State
    // -----------------------------------------------------------------------

    public boolean isScanning() {
        return session().isScanning();
    }

    public boolean isTracking() {
        return session().isTracking();
    }

    public SessionState state() {
        return session().getState();
    }

    /**
     * Allow-list entries for the current thread, added to the configured and built-in ones.
     */
    public void setAllowStackPaths(List<StackMatcher> allowStackPaths) {
        session().setAllowStackPaths(allowStackPaths);
    }

    public List<StackMatcher> getAllowStackPaths() {
        return session().getAllowStackPaths();
    }

    public TrackerSettings getSettings() {
        return settings;
    }

    TrackingSession session() {
        return sessions.get();
    }

    // a thread-scoped allow list outlives the scope, so only a bare session is dropped
    private void release(TrackingSession session) {
        if (session.getAllowStackPaths().isEmpty()) {
            sessions.remove();
        }
    }

    private List<StackMatcher> callerAllowList(TrackingSession session) {
        List<StackMatcher> allowList = new ArrayList<>(settings.getAllowStackPaths());
        allowList.addAll(session.getAllowStackPaths());
        return allowList;
    }
}
