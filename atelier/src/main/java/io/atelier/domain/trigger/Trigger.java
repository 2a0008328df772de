package io.atelier.domain.trigger;

import io.atelier.domain.agent.Persona;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Rate-limited rule mapping a condition over domain events to a message template.
 *
 * <p>Definition fields are immutable. {@code lastFiredAt} is written only by the
 * trigger evaluator and never moves backwards.
 */
public final class Trigger {
    private final String id;
    private final TriggerType type;
    private final Persona persona;
    private final TriggerCondition condition;
    private final Duration cooldown;
    private final TriggerPriority priority;

    private volatile Instant lastFiredAt;

    public Trigger(String id, TriggerType type, Persona persona, TriggerCondition condition,
                   Duration cooldown, TriggerPriority priority) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
        this.persona = Objects.requireNonNull(persona, "persona");
        this.condition = Objects.requireNonNull(condition, "condition");
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
        this.priority = Objects.requireNonNull(priority, "priority");
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("Cooldown cannot be negative: " + id);
        }
    }

    public String id() {
        return id;
    }

    public TriggerType type() {
        return type;
    }

    public Persona persona() {
        return persona;
    }

    public TriggerCondition condition() {
        return condition;
    }

    public Duration cooldown() {
        return cooldown;
    }

    public TriggerPriority priority() {
        return priority;
    }

    /**
     * @return last firing time, or null if the trigger never fired
     */
    public Instant lastFiredAt() {
        return lastFiredAt;
    }

    /**
     * Check whether the cooldown window has elapsed at {@code now}.
     */
    public boolean isCoolingDown(Instant now) {
        Instant last = lastFiredAt;
        if (last == null) {
            return false;
        }
        return Duration.between(last, now).compareTo(cooldown) < 0;
    }

    /**
     * Record a firing. Earlier timestamps than the current one are ignored.
     */
    public void recordFired(Instant now) {
        Instant last = lastFiredAt;
        if (last == null || !now.isBefore(last)) {
            lastFiredAt = now;
        }
    }

    @Override
    public String toString() {
        return String.format("Trigger[%s %s/%s cooldown=%ss]",
            id, persona.id(), type.wireName(), cooldown.toSeconds());
    }
}
