package org.carball.nplusone.jdbc;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Captures the current thread's stack as strings, innermost frame first.
 */
public final class CallStackCapture {

    private CallStackCapture() {
        // Utility class - prevent instantiation
    }

    public static List<String> capture() {
        return Arrays.stream(Thread.currentThread().getStackTrace())
                .filter(frame -> !isCaptureFrame(frame))
                .map(StackTraceElement::toString)
                .collect(Collectors.toList());
    }

    private static boolean isCaptureFrame(StackTraceElement frame) {
        String className = frame.getClassName();
        return className.equals(Thread.class.getName())
                || className.equals(CallStackCapture.class.getName());
    }
}
