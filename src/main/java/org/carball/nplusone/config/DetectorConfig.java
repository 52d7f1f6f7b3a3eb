package org.carball.nplusone.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * YAML shape of the detector configuration file. Absent keys stay {@code null}
 * and leave the corresponding default untouched.
 */
@Data
public class DetectorConfig {

    @JsonProperty("enabled")
    private Boolean enabled;

    @JsonProperty("min_n_queries")
    private Integer minNQueries;

    @JsonProperty("ignore_pauses")
    private Boolean ignorePauses;

    @JsonProperty("dialect")
    private String dialect;

    @JsonProperty("ignore_queries")
    private List<String> ignoreQueries = new ArrayList<>();

    @JsonProperty("ignore_query_patterns")
    private List<String> ignoreQueryPatterns = new ArrayList<>();

    @JsonProperty("allow_stack_paths")
    private List<String> allowStackPaths = new ArrayList<>();

    @JsonProperty("allow_stack_patterns")
    private List<String> allowStackPatterns = new ArrayList<>();

    // Reporting
    @JsonProperty("raise")
    private Boolean raise;

    @JsonProperty("stderr_logger")
    private Boolean stderrLogger;

    @JsonProperty("application_logger")
    private Boolean applicationLogger;

    @JsonProperty("log_file")
    private String logFile;

    @JsonProperty("json_log_file")
    private String jsonLogFile;
}
