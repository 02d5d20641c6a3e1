package com.waveforge.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The whole registry as persisted: one record per namespaced task id.
 */
public record RegistryDocument(
    @JsonProperty("version") int version,
    @JsonProperty("tasks") Map<String, ProcessRecord> tasks
) {

    public static final int CURRENT_VERSION = 1;

    public RegistryDocument {
        tasks = tasks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
    }

    public static RegistryDocument empty() {
        return new RegistryDocument(CURRENT_VERSION, Map.of());
    }

    public RegistryDocument with(ProcessRecord record) {
        var copy = new LinkedHashMap<>(tasks);
        copy.put(record.taskId(), record);
        return new RegistryDocument(version, copy);
    }

    public RegistryDocument without(String taskId) {
        var copy = new LinkedHashMap<>(tasks);
        copy.remove(taskId);
        return new RegistryDocument(version, copy);
    }

    public List<ProcessRecord> withStatus(RecordStatus status) {
        return tasks.values().stream().filter(r -> r.status() == status).toList();
    }
}
