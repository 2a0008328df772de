package io.atelier.domain.state;

import io.atelier.domain.agent.Persona;
import io.atelier.domain.trigger.TriggerType;

import java.util.Set;

/**
 * Partial preferences change. Null fields are left untouched by
 * {@link AgentPreferences#merge(PreferencesUpdate)}.
 */
public record PreferencesUpdate(
    Set<Persona> enabledPersonas,
    Set<TriggerType> mutedTriggerTypes,
    NotificationLevel notificationLevel,
    Long autoSuggestDelayMs
) {
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Set<Persona> enabledPersonas;
        private Set<TriggerType> mutedTriggerTypes;
        private NotificationLevel notificationLevel;
        private Long autoSuggestDelayMs;

        public Builder enabledPersonas(Set<Persona> enabledPersonas) {
            this.enabledPersonas = enabledPersonas;
            return this;
        }

        public Builder mutedTriggerTypes(Set<TriggerType> mutedTriggerTypes) {
            this.mutedTriggerTypes = mutedTriggerTypes;
            return this;
        }

        public Builder notificationLevel(NotificationLevel notificationLevel) {
            this.notificationLevel = notificationLevel;
            return this;
        }

        public Builder autoSuggestDelayMs(long autoSuggestDelayMs) {
            if (autoSuggestDelayMs <= 0) {
                throw new IllegalArgumentException("Auto-suggest delay must be positive");
            }
            this.autoSuggestDelayMs = autoSuggestDelayMs;
            return this;
        }

        public PreferencesUpdate build() {
            return new PreferencesUpdate(enabledPersonas, mutedTriggerTypes, notificationLevel, autoSuggestDelayMs);
        }
    }
}
