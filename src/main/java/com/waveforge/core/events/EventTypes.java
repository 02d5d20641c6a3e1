package com.waveforge.core.events;

/**
 * Event type names published on the {@link EventBus}.
 */
public final class EventTypes {

    private EventTypes() {}

    public static final String PLAN_CREATED = "plan.created";
    public static final String WAVE_STARTED = "wave.started";
    public static final String TASK_DISPATCHED = "task.dispatched";
    public static final String WAVE_VERIFIED = "wave.verified";
    public static final String CHECKPOINT_COMMITTED = "checkpoint.committed";
    public static final String RUN_HALTED = "run.halted";
    public static final String RUN_COMPLETED = "run.completed";

    public static final String ORPHAN_DETECTED = "watchdog.orphan";
    public static final String ZOMBIE_DETECTED = "watchdog.zombie";
    public static final String TASK_OVERRUN = "watchdog.overrun";
    public static final String SAMPLE_FAILED = "watchdog.sample-failed";
}
