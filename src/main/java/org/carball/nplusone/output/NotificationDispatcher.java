package org.carball.nplusone.output;

import lombok.extern.slf4j.Slf4j;
import org.carball.nplusone.config.TrackerSettings;
import org.carball.nplusone.model.AggregationResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fans a finished scope's detections out to the configured sinks and optionally
 * raises afterwards. The report is formatted once and shared by every sink.
 */
@Slf4j
public class NotificationDispatcher {

    private final NotificationFormatter formatter;
    private final List<NotificationSink> sinks;
    private final boolean raise;

    public NotificationDispatcher(NotificationFormatter formatter, List<NotificationSink> sinks, boolean raise) {
        this.formatter = formatter;
        this.sinks = List.copyOf(sinks);
        this.raise = raise;
    }

    public static NotificationDispatcher fromSettings(TrackerSettings settings) {
        return fromSettings(settings, new PackageFilteringStackCleaner());
    }

    /**
     * Builds the sink chain from settings. Custom sinks run first, then the
     * application log, stderr, the plain log file and the JSON log file.
     */
    public static NotificationDispatcher fromSettings(TrackerSettings settings, StackCleaner cleaner,
                                                      NotificationSink... customSinks) {
        List<NotificationSink> sinks = new ArrayList<>(Arrays.asList(customSinks));

        if (settings.isApplicationLogger()) {
            sinks.add(new Slf4jNotificationSink());
        }
        if (settings.isStderrLogger()) {
            sinks.add(new ConsoleNotificationSink());
        }
        if (settings.getLogFile() != null) {
            sinks.add(new FileNotificationSink(settings.getLogFile()));
        }
        if (settings.getJsonLogFile() != null) {
            sinks.add(new JsonLinesNotificationSink(settings.getJsonLogFile()));
        }

        log.debug("Configured {} notification sinks, raise on detection: {}", sinks.size(), settings.isRaiseOnDetection());
        return new NotificationDispatcher(new NotificationFormatter(cleaner), sinks, settings.isRaiseOnDetection());
    }

    /**
     * Reports a non-empty result to every sink in order, then throws
     * {@link NPlusOneQueriesException} when raising is enabled.
     */
    public void dispatch(AggregationResult result) {
        if (result == null || result.isEmpty()) {
            return;
        }

        String report = formatter.format(result);
        for (NotificationSink sink : sinks) {
            sink.report(result, report);
        }

        if (raise) {
            throw new NPlusOneQueriesException(report, result);
        }
    }

    public List<NotificationSink> getSinks() {
        return sinks;
    }

    public boolean isRaise() {
        return raise;
    }
}
