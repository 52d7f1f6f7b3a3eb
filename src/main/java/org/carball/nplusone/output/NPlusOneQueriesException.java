package org.carball.nplusone.output;

import lombok.Getter;
import org.carball.nplusone.model.AggregationResult;

/**
 * Thrown at the end of a scope that produced detections when raising is enabled.
 */
@Getter
public class NPlusOneQueriesException extends RuntimeException {

    private final transient AggregationResult result;

    public NPlusOneQueriesException(String report, AggregationResult result) {
        super(report);
        this.result = result;
    }
}
