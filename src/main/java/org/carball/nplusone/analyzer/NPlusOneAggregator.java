package org.carball.nplusone.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.nplusone.fingerprint.FingerprintEngine;
import org.carball.nplusone.model.AggregationResult;
import org.carball.nplusone.model.Dialect;
import org.carball.nplusone.model.NPlusOneDetection;
import org.carball.nplusone.model.StackMatcher;
import org.carball.nplusone.tracking.TrackingSession;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns the raw observations of a finished scope into N+1 detections.
 */
@Slf4j
public class NPlusOneAggregator {

    /**
     * Frames from framework code that repeats queries on purpose. Always applied.
     */
    public static final List<StackMatcher> DEFAULT_ALLOW_LIST = List.of(
            StackMatcher.pattern("org\\.hibernate\\.loader\\.ast\\.internal\\.\\w*BatchLoader"),
            StackMatcher.contains("org.hibernate.engine.internal.BatchFetchQueueHelper")
    );

    private final FingerprintEngine fingerprintEngine;
    private final int minNQueries;

    public NPlusOneAggregator(FingerprintEngine fingerprintEngine, int minNQueries) {
        if (minNQueries < 1) {
            throw new IllegalArgumentException("minNQueries must be at least 1, was " + minNQueries);
        }
        this.fingerprintEngine = fingerprintEngine;
        this.minNQueries = minNQueries;
    }

    /**
     * Groups each call site's queries by fingerprint and keeps groups that reach the
     * threshold, unless the call site's stack matches the allow list.
     *
     * @param callerAllowList entries added to {@link #DEFAULT_ALLOW_LIST}
     * @throws org.carball.nplusone.fingerprint.FingerprintException if any query cannot be fingerprinted
     */
    public AggregationResult aggregate(TrackingSession session, List<StackMatcher> callerAllowList) {
        if (!session.isTracking()) {
            return AggregationResult.empty();
        }

        List<StackMatcher> allowList = Stream.concat(callerAllowList.stream(), DEFAULT_ALLOW_LIST.stream())
                .collect(Collectors.toList());
        List<NPlusOneDetection> detections = new ArrayList<>();

        for (Map.Entry<String, Integer> entry : session.counters().entrySet()) {
            String callSiteKey = entry.getKey();
            if (entry.getValue() < minNQueries) {
                continue;
            }

            Map<String, List<String>> repeatedShapes = groupByFingerprint(
                    session.queries(callSiteKey), session.dialect(callSiteKey));
            if (repeatedShapes.isEmpty()) {
                continue;
            }

            List<String> callStack = session.callStack(callSiteKey);
            if (isAllowed(callStack, allowList)) {
                log.debug("Skipping allow-listed call site {} ({} repeated shapes)", callSiteKey, repeatedShapes.size());
                continue;
            }

            repeatedShapes.forEach((fingerprint, queries) ->
                    detections.add(new NPlusOneDetection(queries, callStack, callSiteKey, fingerprint)));
        }

        log.debug("Aggregated {} call sites into {} detections", session.counters().size(), detections.size());
        return new AggregationResult(detections);
    }

    /**
     * Fingerprint groups with at least {@code minNQueries} members, in first-seen order.
     */
    Map<String, List<String>> groupByFingerprint(List<String> queries, Dialect dialect) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (String query : queries) {
            String fingerprint = fingerprintEngine.fingerprint(query, dialect);
            groups.computeIfAbsent(fingerprint, k -> new ArrayList<>()).add(query);
        }
        groups.values().removeIf(group -> group.size() < minNQueries);
        return groups;
    }

    static boolean isAllowed(List<String> callStack, List<StackMatcher> allowList) {
        return callStack.stream()
                .anyMatch(frame -> allowList.stream().anyMatch(matcher -> matcher.matches(frame)));
    }

    public int getMinNQueries() {
        return minNQueries;
    }
}
