package org.carball.nplusone.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.nplusone.model.Dialect;
import org.carball.nplusone.model.QueryMatcher;
import org.carball.nplusone.model.StackMatcher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_PREFIX = "NPLUSONE_";
    static final String PROPERTY_PREFIX = "nplusone.";

    private final Map<String, String> environment;
    private final Map<String, String> systemProperties;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ConfigurationLoader() {
        this(System.getenv(), toMap(System.getProperties()));
    }

    public ConfigurationLoader(Map<String, String> environment, Map<String, String> systemProperties) {
        this.environment = environment;
        this.systemProperties = systemProperties;
    }

    /**
     * Loads configuration using the hierarchy: system properties > env vars > defaults
     */
    public TrackerSettings loadConfiguration() {
        log.debug("Loading configuration");

        TrackerSettings.TrackerSettingsBuilder builder = TrackerSettings.builder();
        applyOverrides(builder);

        return finish(builder);
    }

    /**
     * Loads configuration using the hierarchy: system properties > env vars > config file > defaults
     */
    public TrackerSettings loadConfiguration(Path configFile) {
        log.debug("Loading configuration from {}", configFile);

        TrackerSettings.TrackerSettingsBuilder builder = TrackerSettings.builder();
        applyConfigFile(builder, readConfigFile(configFile));
        applyOverrides(builder);

        return finish(builder);
    }

    public DetectorConfig readConfigFile(Path configFile) {
        if (!Files.exists(configFile)) {
            throw new IllegalArgumentException("Configuration file not found: " + configFile);
        }

        try {
            String content = Files.readString(configFile);
            if (content.isBlank()) {
                log.debug("Configuration file {} is empty, using defaults", configFile);
                return new DetectorConfig();
            }
            DetectorConfig config = yamlMapper.readValue(content, DetectorConfig.class);
            return config != null ? config : new DetectorConfig();
        } catch (IOException e) {
            log.error("Error reading configuration file {}: {}", configFile, e.getMessage());
            throw new IllegalArgumentException("Invalid configuration file " + configFile + ": " + e.getMessage(), e);
        }
    }

    private TrackerSettings finish(TrackerSettings.TrackerSettingsBuilder builder) {
        TrackerSettings settings = builder.build();
        settings.validate();

        log.info("Configuration loaded: {}", settings.getConfigurationSummary());
        return settings;
    }

    private void applyConfigFile(TrackerSettings.TrackerSettingsBuilder builder, DetectorConfig config) {
        if (config.getEnabled() != null) {
            builder.enabled(config.getEnabled());
        }
        if (config.getMinNQueries() != null) {
            builder.minNQueries(config.getMinNQueries());
        }
        if (config.getIgnorePauses() != null) {
            builder.ignorePauses(config.getIgnorePauses());
        }
        if (config.getDialect() != null) {
            builder.defaultDialect(Dialect.fromName(config.getDialect()));
        }
        if (config.getRaise() != null) {
            builder.raiseOnDetection(config.getRaise());
        }
        if (config.getStderrLogger() != null) {
            builder.stderrLogger(config.getStderrLogger());
        }
        if (config.getApplicationLogger() != null) {
            builder.applicationLogger(config.getApplicationLogger());
        }
        if (config.getLogFile() != null) {
            builder.logFile(Paths.get(config.getLogFile()));
        }
        if (config.getJsonLogFile() != null) {
            builder.jsonLogFile(Paths.get(config.getJsonLogFile()));
        }

        List<QueryMatcher> ignoreQueries = new ArrayList<>();
        config.getIgnoreQueries().forEach(sql -> ignoreQueries.add(QueryMatcher.exact(sql)));
        config.getIgnoreQueryPatterns().forEach(regex -> ignoreQueries.add(QueryMatcher.pattern(regex)));
        builder.ignoreQueries(List.copyOf(ignoreQueries));

        List<StackMatcher> allowStackPaths = new ArrayList<>();
        config.getAllowStackPaths().forEach(path -> allowStackPaths.add(StackMatcher.contains(path)));
        config.getAllowStackPatterns().forEach(regex -> allowStackPaths.add(StackMatcher.pattern(regex)));
        builder.allowStackPaths(List.copyOf(allowStackPaths));
    }

    private void applyOverrides(TrackerSettings.TrackerSettingsBuilder builder) {
        // 1. Environment variables
        environment.forEach((name, value) -> {
            if (name.startsWith(ENV_PREFIX)) {
                String key = name.substring(ENV_PREFIX.length()).toLowerCase(Locale.ROOT).replace('_', '-');
                applyOverride(builder, name, key, value);
            }
        });

        // 2. System properties (highest priority)
        systemProperties.forEach((name, value) -> {
            if (name.startsWith(PROPERTY_PREFIX)) {
                applyOverride(builder, name, name.substring(PROPERTY_PREFIX.length()), value);
            }
        });
    }

    private void applyOverride(TrackerSettings.TrackerSettingsBuilder builder, String source, String key, String value) {
        try {
            switch (key) {
                case "enabled":
                    builder.enabled(parseBoolean(value));
                    break;
                case "min-n-queries":
                    builder.minNQueries(Integer.parseInt(value.trim()));
                    break;
                case "ignore-pauses":
                    builder.ignorePauses(parseBoolean(value));
                    break;
                case "dialect":
                    builder.defaultDialect(Dialect.fromName(value));
                    break;
                case "raise":
                    builder.raiseOnDetection(parseBoolean(value));
                    break;
                case "stderr-logger":
                    builder.stderrLogger(parseBoolean(value));
                    break;
                case "application-logger":
                    builder.applicationLogger(parseBoolean(value));
                    break;
                case "log-file":
                    builder.logFile(Paths.get(value.trim()));
                    break;
                case "json-log-file":
                    builder.jsonLogFile(Paths.get(value.trim()));
                    break;
                default:
                    log.debug("Ignoring unknown configuration key {}", source);
            }
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value for {}: {}", source, value);
        }
    }

    private static boolean parseBoolean(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("true")) {
            return true;
        } else if (normalized.equals("false")) {
            return false;
        }
        throw new IllegalArgumentException("Not a boolean: " + value);
    }

    private static Map<String, String> toMap(Properties properties) {
        Map<String, String> map = new TreeMap<>();
        properties.stringPropertyNames().forEach(name -> map.put(name, properties.getProperty(name)));
        return map;
    }

    /**
     * Returns help text for the configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            N+1 Detector Configuration Options:

            Configuration file (YAML):
              enabled: true                     Turn detection on or off
              min_n_queries: 2                  Same-shape queries per call site before reporting
              ignore_pauses: false              Keep tracking inside pause() blocks
              dialect: postgresql               Default dialect (postgresql, mysql, mariadb, sqlite, h2, other)
              ignore_queries: [...]             Exact SQL texts never recorded
              ignore_query_patterns: [...]      Regular expressions for SQL never recorded
              allow_stack_paths: [...]          Frame substrings that suppress a call site
              allow_stack_patterns: [...]       Frame regular expressions that suppress a call site
              raise: false                      Throw NPlusOneQueriesException on detection
              stderr_logger: false              Print detections to stderr
              application_logger: false         Log detections at WARN
              log_file: <path>                  Append detections to a text file
              json_log_file: <path>             Append detections as JSON lines

            System Properties:
              -Dnplusone.enabled, -Dnplusone.min-n-queries, -Dnplusone.ignore-pauses,
              -Dnplusone.dialect, -Dnplusone.raise, -Dnplusone.stderr-logger,
              -Dnplusone.application-logger, -Dnplusone.log-file, -Dnplusone.json-log-file

            Environment Variables:
              NPLUSONE_ENABLED, NPLUSONE_MIN_N_QUERIES, NPLUSONE_IGNORE_PAUSES,
              NPLUSONE_DIALECT, NPLUSONE_RAISE, NPLUSONE_STDERR_LOGGER,
              NPLUSONE_APPLICATION_LOGGER, NPLUSONE_LOG_FILE, NPLUSONE_JSON_LOG_FILE

            Priority Order (highest to lowest):
              1. System properties
              2. Environment variables
              3. Configuration file
              4. Built-in defaults
            """;
    }
}
