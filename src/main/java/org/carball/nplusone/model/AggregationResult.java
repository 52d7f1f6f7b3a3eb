package org.carball.nplusone.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detections produced at the end of a tracked scope, in call-site order.
 */
public record AggregationResult(List<NPlusOneDetection> detections) {

    private static final AggregationResult EMPTY = new AggregationResult(List.of());

    public AggregationResult {
        detections = List.copyOf(detections);
    }

    public static AggregationResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return detections.isEmpty();
    }

    public int size() {
        return detections.size();
    }

    /**
     * Flagged query groups keyed by their raw queries, each mapped to its call stack.
     * A later group with an identical query list replaces an earlier one.
     */
    public Map<List<String>, List<String>> toQueryStackMap() {
        Map<List<String>, List<String>> map = new LinkedHashMap<>();
        for (NPlusOneDetection detection : detections) {
            map.put(detection.queries(), detection.callStack());
        }
        return map;
    }
}
