package org.carball.nplusone.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.nplusone.model.AggregationResult;
import org.carball.nplusone.model.NPlusOneDetection;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends one JSON object per detection to a file, one object per line.
 */
@Slf4j
public class JsonLinesNotificationSink implements NotificationSink {

    private final Path file;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public JsonLinesNotificationSink(Path file) {
        this(file, Clock.systemUTC());
    }

    public JsonLinesNotificationSink(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized void report(AggregationResult result, String formattedReport) {
        Instant detectedAt = clock.instant();
        StringBuilder lines = new StringBuilder();

        try {
            for (NPlusOneDetection detection : result.detections()) {
                lines.append(objectMapper.writeValueAsString(toRecord(detection, detectedAt)))
                        .append('\n');
            }

            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, lines.toString(), StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Error writing N+1 detections to {}", file, e);
            throw new UncheckedIOException("Failed to write N+1 detections to " + file, e);
        }
    }

    private Map<String, Object> toRecord(NPlusOneDetection detection, Instant detectedAt) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("detected_at", detectedAt);
        record.put("call_site", detection.callSiteKey());
        record.put("fingerprint", detection.fingerprint());
        record.put("query_count", detection.queryCount());
        record.put("queries", detection.queries());
        record.put("call_stack", detection.callStack());
        return record;
    }
}
