package com.waveforge.core.engine;

import com.waveforge.core.model.Task;
import com.waveforge.core.model.Wave;
import com.waveforge.core.persistence.AtomicFileWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Durable markdown record of completed waves, rewritten atomically on every append.
 */
public class ProgressLog {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    static final String HEADER = "# Progress\n\n";

    private final Path file;
    private final Clock clock;

    public ProgressLog(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    public ProgressLog(Path file) {
        this(file, Clock.systemDefaultZone());
    }

    public Path file() {
        return file;
    }

    public void appendWave(Wave wave) throws IOException {
        String content = Files.exists(file) ? Files.readString(file, StandardCharsets.UTF_8) : HEADER;

        var sb = new StringBuilder(content);
        sb.append("\n## Wave ").append(wave.id()).append(" Complete - ")
                .append(LocalDateTime.now(clock).format(TIMESTAMP)).append("\n\n");
        for (Task task : wave.tasks()) {
            sb.append("- [x] ").append(task.id()).append(": ").append(task.description()).append('\n');
        }
        AtomicFileWriter.write(file, sb.toString().getBytes(StandardCharsets.UTF_8));
    }
}
