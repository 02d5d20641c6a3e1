package com.waveforge.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * How a registered worker runs: a native process group or a container.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ExecutionMode.Native.class, name = "native"),
    @JsonSubTypes.Type(value = ExecutionMode.Container.class, name = "container")
})
public sealed interface ExecutionMode permits ExecutionMode.Native, ExecutionMode.Container {

    /** Short label used in logs, metrics and the CLI. */
    @JsonIgnore
    String label();

    /**
     * A native process, killed through its process group.
     *
     * @param pid       process id of the group leader
     * @param pgid      process group id; kills always target this group
     * @param startTime start time captured at spawn, compared to detect pid reuse
     */
    record Native(int pid, int pgid, String startTime) implements ExecutionMode {

        public Fingerprint fingerprint() {
            return new Fingerprint(pid, startTime);
        }

        @Override
        public String label() {
            return "native";
        }
    }

    /**
     * A container, killed as a whole.
     */
    record Container(String id, String name, ResourceLimits limits) implements ExecutionMode {

        public Container {
            limits = limits == null ? ResourceLimits.defaults() : limits;
        }

        public String shortId() {
            return id != null && id.length() > 12 ? id.substring(0, 12) : id;
        }

        @Override
        public String label() {
            return "container";
        }
    }
}
