package org.carball.nplusone.output;

import org.carball.nplusone.model.AggregationResult;

/**
 * Destination for detections. Only called with a non-empty result.
 */
@FunctionalInterface
public interface NotificationSink {

    /**
     * @param result          detections of the finished scope
     * @param formattedReport the same detections rendered by {@link NotificationFormatter}
     */
    void report(AggregationResult result, String formattedReport);
}
