package com.waveforge.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Synchronous in-process event bus.
 * <p>
 * Events are delivered on the publishing thread, in subscription order, to every listener whose
 * filter accepts them. The wave executor publishes under the phase ID and the watchdog under
 * {@link WaveforgeEvent#WATCHDOG_SCOPE}, from its own sweep thread.
 * A listener that throws is logged and skipped; delivery to the others continues.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private record Listener(Predicate<WaveforgeEvent> filter, Consumer<WaveforgeEvent> consumer) {}

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    /**
     * @return the number of listeners that received the event
     */
    public int publish(WaveforgeEvent event) {
        int delivered = 0;
        for (Listener listener : listeners) {
            if (!listener.filter().test(event)) {
                continue;
            }
            try {
                listener.consumer().accept(event);
                delivered++;
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} [{}]: {}", event.eventType(), event.scope(), e.getMessage(), e);
            }
        }
        log.debug("Published {} [{}] to {} listener(s)", event.eventType(), event.scope(), delivered);
        return delivered;
    }

    public Subscription subscribe(String scope, Consumer<WaveforgeEvent> consumer) {
        return subscribe(event -> scope.equals(event.scope()), consumer);
    }

    public Subscription subscribeAll(Consumer<WaveforgeEvent> consumer) {
        return subscribe(event -> true, consumer);
    }

    /**
     * Registers a listener for the events matching {@code filter}.
     */
    public Subscription subscribe(Predicate<WaveforgeEvent> filter, Consumer<WaveforgeEvent> consumer) {
        Listener listener = new Listener(filter, consumer);
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    /**
     * Handle returned by the subscribe methods. Closing it unsubscribes.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }
}
