package io.atelier.domain.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.atelier.domain.agent.Persona;
import io.atelier.domain.trigger.TriggerType;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Per-user agent preferences, persisted through the preferences gateway.
 */
public record AgentPreferences(
    @JsonProperty("enabledPersonas")
    Set<Persona> enabledPersonas,

    @JsonProperty("mutedTriggerTypes")
    Set<TriggerType> mutedTriggerTypes,

    @JsonProperty("notificationLevel")
    NotificationLevel notificationLevel,

    @JsonProperty("autoSuggestDelayMs")
    long autoSuggestDelayMs          // inactivity before the idle watchdog fires
) {
    public static final long DEFAULT_AUTO_SUGGEST_DELAY_MS = 30_000;

    public AgentPreferences {
        enabledPersonas = frozen(enabledPersonas, Persona.class);
        mutedTriggerTypes = frozen(mutedTriggerTypes, TriggerType.class);
        if (notificationLevel == null) {
            notificationLevel = NotificationLevel.ALL;
        }
    }

    /**
     * All personas enabled, nothing muted, 30 seconds of inactivity before auto-suggesting.
     */
    public static AgentPreferences defaults() {
        return new AgentPreferences(
            EnumSet.allOf(Persona.class),
            EnumSet.noneOf(TriggerType.class),
            NotificationLevel.ALL,
            DEFAULT_AUTO_SUGGEST_DELAY_MS
        );
    }

    public boolean isEnabled(Persona persona) {
        return enabledPersonas.contains(persona);
    }

    public boolean isMuted(TriggerType type) {
        return mutedTriggerTypes.contains(type);
    }

    /**
     * Validate configuration values.
     */
    @JsonIgnore
    public boolean isValid() {
        return autoSuggestDelayMs > 0;
    }

    /**
     * Apply a partial update; fields left null in the update keep their current value.
     */
    public AgentPreferences merge(PreferencesUpdate update) {
        if (update == null) {
            return this;
        }
        return new AgentPreferences(
            update.enabledPersonas() != null ? update.enabledPersonas() : enabledPersonas,
            update.mutedTriggerTypes() != null ? update.mutedTriggerTypes() : mutedTriggerTypes,
            update.notificationLevel() != null ? update.notificationLevel() : notificationLevel,
            update.autoSuggestDelayMs() != null ? update.autoSuggestDelayMs() : autoSuggestDelayMs
        );
    }

    private static <E extends Enum<E>> Set<E> frozen(Collection<E> values, Class<E> type) {
        EnumSet<E> copy = EnumSet.noneOf(type);
        if (values != null) {
            copy.addAll(values);
        }
        return Collections.unmodifiableSet(copy);
    }
}
