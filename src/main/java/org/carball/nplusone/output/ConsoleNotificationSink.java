package org.carball.nplusone.output;

import org.carball.nplusone.model.AggregationResult;

import java.io.PrintStream;

/**
 * Prints the report in red to a console stream, stderr by default.
 */
public class ConsoleNotificationSink implements NotificationSink {

    private final PrintStream out;

    public ConsoleNotificationSink() {
        this(System.err);
    }

    public ConsoleNotificationSink(PrintStream out) {
        this.out = out;
    }

    @Override
    public void report(AggregationResult result, String formattedReport) {
        out.println(NotificationFormatter.red(formattedReport));
        out.flush();
    }
}
