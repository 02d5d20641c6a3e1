package com.waveforge.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during planning, wave execution or watchdog reconciliation.
 *
 * @param eventType event type (e.g. "wave.started", "checkpoint.committed", "watchdog.orphan")
 * @param scope     the phase ID for scheduler events, {@link #WATCHDOG_SCOPE} for watchdog events
 * @param taskId    the task or registry record this event relates to (nullable for wave-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record WaveforgeEvent(
    String eventType,
    String scope,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String WATCHDOG_SCOPE = "watchdog";

    public static WaveforgeEvent of(String eventType, String scope, String taskId, Map<String, Object> payload) {
        return new WaveforgeEvent(eventType, scope, taskId, Map.copyOf(payload), Instant.now());
    }
}
