package org.carball.nplusone.output;

import lombok.extern.slf4j.Slf4j;
import org.carball.nplusone.model.AggregationResult;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends the plain report to a dedicated file.
 */
@Slf4j
public class FileNotificationSink implements NotificationSink {

    private final Path file;

    public FileNotificationSink(Path file) {
        this.file = file;
    }

    @Override
    public synchronized void report(AggregationResult result, String formattedReport) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, formattedReport + System.lineSeparator(),
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Error writing N+1 report to {}", file, e);
            throw new UncheckedIOException("Failed to write N+1 report to " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }
}
