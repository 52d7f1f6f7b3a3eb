package org.carball.nplusone.tracking;

import org.carball.nplusone.analyzer.CallSiteIdentifier;
import org.carball.nplusone.model.Dialect;
import org.carball.nplusone.model.StackMatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-thread tracking state. Either all observation maps are present (ACTIVE or PAUSED)
 * or none are (UNINITIALIZED). Not thread-safe; only touched by its owning thread.
 */
public class TrackingSession {

    private SessionState state = SessionState.UNINITIALIZED;
    private int depth;

    private Map<String, Integer> counters;
    private Map<String, List<String>> queries;
    private Map<String, List<String>> callStacks;
    private Map<String, Dialect> dialects;

    // Survives scope teardown, like any other thread-scoped setting
    private List<StackMatcher> allowStackPaths = List.of();

    void start() {
        counters = new LinkedHashMap<>();
        queries = new LinkedHashMap<>();
        callStacks = new LinkedHashMap<>();
        dialects = new LinkedHashMap<>();
        depth = 1;
        state = SessionState.ACTIVE;
    }

    void enterNested() {
        depth++;
    }

    /**
     * @return true while an enclosing scope is still open
     */
    boolean exitNested() {
        depth--;
        return depth > 0;
    }

    void tearDown() {
        counters = null;
        queries = null;
        callStacks = null;
        dialects = null;
        depth = 0;
        state = SessionState.UNINITIALIZED;
    }

    void pause() {
        if (state == SessionState.ACTIVE) {
            state = SessionState.PAUSED;
        }
    }

    void resume() {
        if (state == SessionState.PAUSED && isTracking()) {
            state = SessionState.ACTIVE;
        }
    }

    /**
     * Puts back the state seen before a scoped pause. A scope that ended meanwhile stays ended.
     */
    void restore(SessionState previous) {
        if (isTracking() && previous != SessionState.UNINITIALIZED) {
            state = previous;
        }
    }

    /**
     * Records one query. Ignored unless ACTIVE.
     *
     * @return the call-site key, or {@code null} when nothing was recorded
     */
    String record(String sql, List<String> stack, Dialect dialect) {
        if (!isScanning()) {
            return null;
        }

        // copied before any map changes; null frames are kept
        List<String> frames = stack == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(stack));
        String key = CallSiteIdentifier.identify(frames);
        int count = counters.merge(key, 1, Integer::sum);
        queries.computeIfAbsent(key, k -> new ArrayList<>()).add(sql);
        dialects.putIfAbsent(key, dialect);

        // captured once, when the call site first repeats
        if (count == 2) {
            callStacks.put(key, frames);
        }
        return key;
    }

    public SessionState getState() {
        return state;
    }

    public int getDepth() {
        return depth;
    }

    public boolean isTracking() {
        return state != SessionState.UNINITIALIZED
                && counters != null && queries != null && callStacks != null && dialects != null;
    }

    public boolean isScanning() {
        return state == SessionState.ACTIVE && isTracking();
    }

    public Map<String, Integer> counters() {
        return counters == null ? Map.of() : Collections.unmodifiableMap(counters);
    }

    public List<String> queries(String callSiteKey) {
        List<String> recorded = queries == null ? null : queries.get(callSiteKey);
        return recorded == null ? List.of() : Collections.unmodifiableList(recorded);
    }

    public List<String> callStack(String callSiteKey) {
        List<String> stack = callStacks == null ? null : callStacks.get(callSiteKey);
        return stack == null ? List.of() : stack;
    }

    public boolean hasCallStack(String callSiteKey) {
        return callStacks != null && callStacks.containsKey(callSiteKey);
    }

    public Dialect dialect(String callSiteKey) {
        return dialects == null ? null : dialects.get(callSiteKey);
    }

    public List<StackMatcher> getAllowStackPaths() {
        return allowStackPaths;
    }

    void setAllowStackPaths(List<StackMatcher> allowStackPaths) {
        this.allowStackPaths = allowStackPaths == null ? List.of() : List.copyOf(allowStackPaths);
    }
}
