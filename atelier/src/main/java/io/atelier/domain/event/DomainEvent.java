package io.atelier.domain.event;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Something that happened in the host application (or a synthesized idle event).
 * Consumed synchronously by the orchestrator, never stored.
 */
public record DomainEvent(
    EventKind kind,
    Map<String, Object> payload,
    Instant timestamp
) {
    public static final String IDLE_TIME_MS = "idleTimeMs";

    public DomainEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    /**
     * Create an event with an empty payload.
     */
    public static DomainEvent of(EventKind kind, Instant timestamp) {
        return new DomainEvent(kind, Map.of(), timestamp);
    }

    /**
     * Create the synthetic idle event emitted by the watchdog.
     */
    public static DomainEvent idle(long idleTimeMs, Instant timestamp) {
        return new DomainEvent(EventKind.USER_IDLE, Map.of(IDLE_TIME_MS, idleTimeMs), timestamp);
    }

    /**
     * Read a numeric payload field.
     *
     * @return the value as a long, or {@code defaultValue} if absent or not numeric
     */
    public long longPayload(String key, long defaultValue) {
        Object value = payload.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return defaultValue;
    }
}
