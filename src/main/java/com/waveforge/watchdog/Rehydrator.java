package com.waveforge.watchdog;

import com.waveforge.registry.ExecutionMode;
import com.waveforge.registry.ProcessRecord;
import com.waveforge.registry.RegistryDocument;
import com.waveforge.registry.RegistryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rebuilds a picture of in-flight work from the registry file alone.
 */
public class Rehydrator {

    private static final Logger log = LoggerFactory.getLogger(Rehydrator.class);

    private final RegistryStore store;
    private final Clock clock;

    public Rehydrator(RegistryStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public Rehydrator(RegistryStore store) {
        this(store, Clock.systemUTC());
    }

    /**
     * @throws com.waveforge.registry.RegistryCorruptionException if the registry cannot be read
     */
    public RehydrationReport rehydrate() {
        RegistryDocument document = store.load();
        Instant now = clock.instant();

        var running = new ArrayList<RehydrationReport.Entry>();
        var completed = new ArrayList<RehydrationReport.Entry>();
        var failed = new ArrayList<RehydrationReport.Entry>();

        List<ProcessRecord> records = document.tasks().values().stream()
                .sorted(Comparator.comparing(ProcessRecord::startedAt).thenComparing(ProcessRecord::taskId))
                .toList();
        for (ProcessRecord record : records) {
            var entry = new RehydrationReport.Entry(record.taskId(), record.status(), record.mode().label(),
                    target(record.mode()), record.command(), record.startedAt(), record.elapsed(now),
                    record.flags());
            switch (record.status()) {
                case RUNNING -> running.add(entry);
                case COMPLETED -> completed.add(entry);
                case FAILED -> failed.add(entry);
            }
        }
        log.info("Rehydrated {} record(s) from {}: {} running, {} completed, {} failed",
                records.size(), store.path(), running.size(), completed.size(), failed.size());
        return new RehydrationReport(store.path(), now, running, completed, failed);
    }

    static String target(ExecutionMode mode) {
        if (mode instanceof ExecutionMode.Native nativeMode) {
            return "pid " + nativeMode.pid() + ", pgid " + nativeMode.pgid();
        }
        return "container " + ((ExecutionMode.Container) mode).shortId();
    }
}
