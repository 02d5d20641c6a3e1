package com.waveforge.backend;

import com.waveforge.registry.ExecutionMode;
import com.waveforge.registry.Fingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ProcessBackend} for POSIX hosts. Workers are started through {@code setsid} so each one
 * leads its own process group; inspection and signalling go through {@code ps} and {@code kill}.
 */
public class OsProcessBackend implements ProcessBackend {

    private static final Logger log = LoggerFactory.getLogger(OsProcessBackend.class);

    private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(5);

    private final CommandRunner runner;

    public OsProcessBackend(CommandRunner runner) {
        this.runner = runner;
    }

    public OsProcessBackend() {
        this(new CommandRunner());
    }

    @Override
    public ExecutionMode.Native launch(List<String> command, Path workDir, Path logFile) {
        var argv = new ArrayList<String>(command.size() + 1);
        argv.add("setsid");
        argv.addAll(command);

        Process process;
        try {
            Files.createDirectories(logFile.toAbsolutePath().getParent());
            process = new ProcessBuilder(argv)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()))
                    .redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")))
                    .start();
        } catch (IOException e) {
            throw new BackendException("Failed to launch " + String.join(" ", command), e);
        }

        int pid = (int) process.pid();
        String startTime = startTimeOf(process.toHandle());
        int pgid;
        try {
            pgid = processGroupOf(pid);
        } catch (BackendException e) {
            // Exited before ps could see it; setsid makes the leader's pid the group id.
            pgid = pid;
        }
        log.info("Launched pid {} (pgid {}) logging to {}", pid, pgid, logFile);
        return new ExecutionMode.Native(pid, pgid, startTime);
    }

    @Override
    public Optional<Fingerprint> fingerprint(int pid) {
        return ProcessHandle.of(pid)
                .filter(ProcessHandle::isAlive)
                .map(handle -> new Fingerprint(pid, startTimeOf(handle)));
    }

    @Override
    public int processGroupOf(int pid) {
        var result = runner.run(COMMAND_TIMEOUT, "ps", "-o", "pgid=", "-p", String.valueOf(pid));
        if (!result.succeeded() || result.stdout().isBlank()) {
            throw new BackendException("No process with pid " + pid);
        }
        try {
            return Integer.parseInt(result.stdout().strip());
        } catch (NumberFormatException e) {
            throw new BackendException("Unexpected ps output for pid " + pid + ": " + result.stdout(), e);
        }
    }

    @Override
    public ResourceUsage sample(int pid) {
        var result = runner.run(COMMAND_TIMEOUT, "ps", "-o", "%cpu=,rss=", "-p", String.valueOf(pid));
        if (!result.succeeded() || result.stdout().isBlank()) {
            throw new BackendException("Cannot sample pid " + pid);
        }
        return parseUsage(result.stdout());
    }

    @Override
    public void killGroup(int pgid, Duration grace) {
        if (pgid <= 1) {
            throw new IllegalArgumentException("Refusing to signal process group " + pgid);
        }
        String group = "-" + pgid;
        if (!runner.run(COMMAND_TIMEOUT, "kill", "-TERM", "--", group).succeeded()) {
            log.debug("Process group {} already gone", pgid);
            return;
        }
        sleep(grace);
        if (runner.run(COMMAND_TIMEOUT, "kill", "-0", "--", group).succeeded()) {
            log.warn("Process group {} survived SIGTERM, sending SIGKILL", pgid);
            runner.run(COMMAND_TIMEOUT, "kill", "-KILL", "--", group);
        }
    }

    static ResourceUsage parseUsage(String psOutput) {
        String[] fields = psOutput.strip().split("\\s+");
        if (fields.length < 2) {
            throw new BackendException("Unexpected ps output: " + psOutput);
        }
        try {
            return new ResourceUsage(Double.parseDouble(fields[0]), Long.parseLong(fields[1]));
        } catch (NumberFormatException e) {
            throw new BackendException("Unexpected ps output: " + psOutput, e);
        }
    }

    private String startTimeOf(ProcessHandle handle) {
        Optional<Instant> started = handle.info().startInstant();
        if (started.isPresent()) {
            return started.get().toString();
        }
        var result = runner.run(COMMAND_TIMEOUT, "ps", "-o", "lstart=", "-p", String.valueOf(handle.pid()));
        return result.succeeded() ? result.stdout().strip() : "unknown";
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
