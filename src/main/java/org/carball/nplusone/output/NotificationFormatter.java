package org.carball.nplusone.output;

import org.carball.nplusone.model.AggregationResult;
import org.carball.nplusone.model.NPlusOneDetection;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Renders detections as the plain-text report shared by every text sink.
 */
public class NotificationFormatter {

    private static final String RED = "\u001b[91m";
    private static final String RESET = "\u001b[0m";

    private final StackCleaner stackCleaner;

    public NotificationFormatter(StackCleaner stackCleaner) {
        this.stackCleaner = stackCleaner;
    }

    public String format(AggregationResult result) {
        StringBuilder report = new StringBuilder();

        for (NPlusOneDetection detection : result.detections()) {
            report.append("N+1 queries detected:\n");
            detection.queries().forEach(query -> report.append("  ").append(query).append('\n'));

            report.append("Call stack:\n");
            stackCleaner.clean(detection.callStack())
                    .forEach(frame -> report.append("  ").append(frame).append('\n'));

            report.append('\n');
        }

        return report.toString();
    }

    /**
     * Wraps every line in bright-red ANSI escapes. Trailing blank lines are dropped.
     */
    public static String red(String text) {
        return Arrays.stream(text.split("\n"))
                .map(line -> RED + line + RESET)
                .collect(Collectors.joining("\n"));
    }
}
