package org.carball.nplusone.output;

import org.carball.nplusone.model.AggregationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FileNotificationSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldAppendReportsCreatingParentDirectories() throws IOException {
        // Given
        Path file = tempDir.resolve("logs/nplusone.log");
        FileNotificationSink sink = new FileNotificationSink(file);

        // When
        sink.report(AggregationResult.empty(), "first report");
        sink.report(AggregationResult.empty(), "second report");

        // Then
        String content = Files.readString(file);
        assertThat(content).contains("first report").contains("second report");
        assertThat(content.indexOf("first report")).isLessThan(content.indexOf("second report"));
        assertThat(content).doesNotContain("\u001b[");
    }

    @Test
    void shouldFailWhenFileCannotBeWritten() throws IOException {
        // Given - a directory where the file should be
        Path directory = Files.createDirectory(tempDir.resolve("taken"));
        FileNotificationSink sink = new FileNotificationSink(directory);

        // When/Then
        assertThatThrownBy(() -> sink.report(AggregationResult.empty(), "report"))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("Failed to write N+1 report");
    }
}
