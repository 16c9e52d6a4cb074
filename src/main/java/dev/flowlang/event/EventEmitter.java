package dev.flowlang.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Append-only, totally ordered event log with subscription. Sequence numbers come from a single
 * counter and delivery happens under the same lock that assigns them, so every subscriber sees
 * events in sequence order even when parallel branches emit concurrently.
 */
public final class EventEmitter {

    private static final Logger log = LoggerFactory.getLogger(EventEmitter.class);

    private final String executionId;
    private final Clock clock;
    private final Object lock = new Object();
    private final List<ExecutionEvent> events = new ArrayList<>();
    private final List<Consumer<ExecutionEvent>> subscribers = new CopyOnWriteArrayList<>();
    private long nextSequence = 1;

    public EventEmitter(String executionId) {
        this(executionId, Clock.systemUTC());
    }

    public EventEmitter(String executionId, Clock clock) {
        this.executionId = executionId;
        this.clock = clock;
    }

    public String executionId() {
        return executionId;
    }

    public ExecutionEvent emit(EventType type, String flow, String stepId, Map<String, Object> payload) {
        synchronized (lock) {
            var event = new ExecutionEvent(nextSequence++, type, executionId, flow, stepId, clock.instant(), payload);
            events.add(event);
            for (Consumer<ExecutionEvent> subscriber : subscribers) {
                deliver(subscriber, event);
            }
            return event;
        }
    }

    /**
     * Replays every event emitted so far to {@code subscriber}, then streams new ones. Closing the
     * returned handle stops delivery.
     */
    public Subscription subscribe(Consumer<ExecutionEvent> subscriber) {
        synchronized (lock) {
            for (ExecutionEvent event : events) {
                deliver(subscriber, event);
            }
            subscribers.add(subscriber);
        }
        return () -> subscribers.remove(subscriber);
    }

    /** Snapshot of the log in sequence order. */
    public List<ExecutionEvent> events() {
        synchronized (lock) {
            return List.copyOf(events);
        }
    }

    private void deliver(Consumer<ExecutionEvent> subscriber, ExecutionEvent event) {
        try {
            subscriber.accept(event);
        } catch (RuntimeException e) {
            log.warn("Event subscriber failed on {} #{}: {}", event.type().wireName(), event.sequence(), e.getMessage(), e);
        }
    }

    /** Handle returned by {@link #subscribe}. */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
