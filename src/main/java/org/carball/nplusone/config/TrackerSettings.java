package org.carball.nplusone.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.carball.nplusone.model.Dialect;
import org.carball.nplusone.model.QueryMatcher;
import org.carball.nplusone.model.StackMatcher;

import java.nio.file.Path;
import java.util.List;

/**
 * Process-wide detector settings. Immutable, so safe to share between threads.
 */
@Value
@Builder(toBuilder = true)
@Slf4j
public class TrackerSettings {

    @Builder.Default
    boolean enabled = true;

    // Same-shape queries from one call site needed before a group is reported
    @Builder.Default
    int minNQueries = 2;

    // Makes pause() a no-op so tests see every query
    @Builder.Default
    boolean ignorePauses = false;

    @Builder.Default
    Dialect defaultDialect = Dialect.POSTGRESQL;

    @Builder.Default
    List<QueryMatcher> ignoreQueries = List.of();

    @Builder.Default
    List<StackMatcher> allowStackPaths = List.of();

    // Reporting
    @Builder.Default
    boolean raiseOnDetection = false;

    @Builder.Default
    boolean stderrLogger = false;

    @Builder.Default
    boolean applicationLogger = false;

    Path logFile;

    Path jsonLogFile;

    public static TrackerSettings defaults() {
        return TrackerSettings.builder().build();
    }

    /**
     * Whether {@code sql} matches one of the configured ignore predicates.
     */
    public boolean isIgnored(String sql) {
        return ignoreQueries.stream().anyMatch(matcher -> matcher.matches(sql));
    }

    /**
     * Logs warnings for values that make detection useless or noisy.
     */
    public void validate() {
        if (minNQueries < 1) {
            log.warn("Minimum repeated queries ({}) must be at least 1", minNQueries);
        } else if (minNQueries < 2) {
            log.warn("Minimum repeated queries ({}) below 2 reports every single query", minNQueries);
        }

        if (!enabled) {
            log.info("N+1 detection is disabled");
        } else if (!raiseOnDetection && !stderrLogger && !applicationLogger && logFile == null && jsonLogFile == null) {
            log.warn("No built-in reporting enabled; detections only reach custom sinks");
        }

        log.debug("Using settings - Enabled: {}, Min queries: {}, Ignore pauses: {}, Dialect: {}",
                enabled, minNQueries, ignorePauses, defaultDialect);
    }

    public String getConfigurationSummary() {
        return String.format("Enabled: %s | Min queries: %d | Dialect: %s | Ignored queries: %d | Allow-listed paths: %d | Raise: %s",
                enabled, minNQueries, defaultDialect, ignoreQueries.size(), allowStackPaths.size(), raiseOnDetection);
    }
}
