package com.waveforge.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs short-lived external commands ({@code ps}, {@code kill}, {@code git}, policy validators)
 * through {@link ProcessBuilder} and captures their output.
 */
public class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    public record Result(int exitCode, String stdout, String stderr) {

        public boolean succeeded() {
            return exitCode == 0;
        }
    }

    /**
     * @throws BackendException if the command cannot be started, times out, or the wait is interrupted
     */
    public Result run(Path workDir, Duration timeout, List<String> command) {
        Process process;
        try {
            var builder = new ProcessBuilder(command).redirectErrorStream(false);
            if (workDir != null) {
                builder.directory(workDir.toFile());
            }
            process = builder.start();
        } catch (IOException e) {
            throw new BackendException("Failed to start " + String.join(" ", command), e);
        }

        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));
        try {
            String stdout = readAll(process.getInputStream());
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new BackendException("Command timed out after " + timeout + ": " + String.join(" ", command));
            }
            int exitCode = process.exitValue();
            String err = stderr.join();
            if (exitCode != 0) {
                log.debug("Command exited with code {}: {} ({})", exitCode, command, err.strip());
            }
            return new Result(exitCode, stdout, err);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new BackendException("Interrupted while running " + String.join(" ", command), e);
        }
    }

    public Result run(Duration timeout, String... command) {
        return run(null, timeout, List.of(command));
    }

    private static String readAll(InputStream stream) {
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
