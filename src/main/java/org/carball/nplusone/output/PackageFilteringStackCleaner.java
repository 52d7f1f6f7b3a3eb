package org.carball.nplusone.output;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Drops frames of known infrastructure packages (JDK, JDBC proxies, test runners and
 * this detector). A stack made only of such frames is returned unchanged.
 */
public class PackageFilteringStackCleaner implements StackCleaner {

    /**
     * Package prefixes for infrastructure layers that should be skipped when
     * looking for the application code that issued a query.
     */
    public static final List<String> DEFAULT_IGNORED_PACKAGES = List.of(
        "java.",
        "javax.",
        "jdk.",
        "sun.",
        "com.sun.",
        "net.ttddyy.",
        "org.junit.",
        "org.apache.maven.surefire.",
        "org.carball.nplusone."
    );

    private final List<String> ignoredPackages;

    public PackageFilteringStackCleaner() {
        this(DEFAULT_IGNORED_PACKAGES);
    }

    public PackageFilteringStackCleaner(List<String> ignoredPackages) {
        this.ignoredPackages = List.copyOf(ignoredPackages);
    }

    @Override
    public List<String> clean(List<String> stack) {
        List<String> cleaned = stack.stream()
                .filter(frame -> !isIgnored(frame))
                .collect(Collectors.toList());
        return cleaned.isEmpty() ? stack : cleaned;
    }

    private boolean isIgnored(String frame) {
        if (frame == null) {
            return false;
        }
        String className = stripModule(frame);
        return ignoredPackages.stream().anyMatch(className::startsWith);
    }

    /**
     * {@code java.base/java.lang.Thread.run(Thread.java:833)} -> {@code java.lang.Thread.run(Thread.java:833)}
     */
    static String stripModule(String frame) {
        int paren = frame.indexOf('(');
        int slash = frame.lastIndexOf('/', paren < 0 ? frame.length() : paren);
        return slash < 0 ? frame : frame.substring(slash + 1);
    }
}
