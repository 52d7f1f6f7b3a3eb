package org.carball.nplusone.output;

import lombok.extern.slf4j.Slf4j;
import org.carball.nplusone.model.AggregationResult;
import org.slf4j.Logger;

/**
 * Writes the report to the application log at WARN, optionally in red for
 * console-backed appenders.
 */
@Slf4j
public class Slf4jNotificationSink implements NotificationSink {

    private final Logger logger;
    private final boolean colored;

    public Slf4jNotificationSink() {
        this(log, false);
    }

    public Slf4jNotificationSink(Logger logger, boolean colored) {
        this.logger = logger;
        this.colored = colored;
    }

    @Override
    public void report(AggregationResult result, String formattedReport) {
        logger.warn(colored ? NotificationFormatter.red(formattedReport) : formattedReport);
    }
}
