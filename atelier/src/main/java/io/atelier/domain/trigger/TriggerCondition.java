package io.atelier.domain.trigger;

import io.atelier.domain.event.EventKind;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Tagged condition of a trigger. Only the fields of the active variant are set:
 * {@code event} for EVENT, {@code idleThreshold} for IDLE_TIME, {@code params} for the
 * state- and content-based variants.
 */
public record TriggerCondition(
    ConditionType type,
    EventKind event,
    Duration idleThreshold,
    Map<String, Object> params
) {
    public TriggerCondition {
        Objects.requireNonNull(type, "type");
        params = params == null ? Map.of() : Map.copyOf(params);
        if (type == ConditionType.EVENT && event == null) {
            throw new IllegalArgumentException("EVENT condition requires an event kind");
        }
        if (type == ConditionType.IDLE_TIME && idleThreshold == null) {
            throw new IllegalArgumentException("IDLE_TIME condition requires a threshold");
        }
    }

    public static TriggerCondition onEvent(EventKind event) {
        return new TriggerCondition(ConditionType.EVENT, event, null, Map.of());
    }

    public static TriggerCondition idleFor(Duration threshold) {
        return new TriggerCondition(ConditionType.IDLE_TIME, null, threshold, Map.of());
    }

    public static TriggerCondition stateBased(Map<String, Object> params) {
        return new TriggerCondition(ConditionType.STATE_BASED, null, null, params);
    }

    public static TriggerCondition contentBased(Map<String, Object> params) {
        return new TriggerCondition(ConditionType.CONTENT_BASED, null, null, params);
    }
}
