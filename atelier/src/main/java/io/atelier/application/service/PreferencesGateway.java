package io.atelier.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.atelier.application.port.output.PreferencesStore;
import io.atelier.application.port.output.PreferencesStoreException;
import io.atelier.domain.agent.Persona;
import io.atelier.domain.state.AgentPreferences;
import io.atelier.domain.state.NotificationLevel;
import io.atelier.domain.state.PreferencesUpdate;
import io.atelier.domain.trigger.TriggerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * Loads and saves {@link AgentPreferences} as JSON under a single key of the
 * {@link PreferencesStore}.
 *
 * <p>Stored fields are merged over the defaults, so documents written by older versions
 * (including the {@code enabledAgents}/{@code mutedTriggers}/{@code autoSuggestDelay} field
 * names) still load. Neither direction throws: failures are logged and the caller keeps
 * its in-memory preferences.
 */
public final class PreferencesGateway {
    private static final Logger log = LoggerFactory.getLogger(PreferencesGateway.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String KEY = "agentPreferences";

    private static final TypeReference<Set<Persona>> PERSONA_SET = new TypeReference<>() {};
    private static final TypeReference<Set<TriggerType>> TRIGGER_TYPE_SET = new TypeReference<>() {};

    private final PreferencesStore store;

    public PreferencesGateway(PreferencesStore store) {
        this.store = store;
    }

    /**
     * @return stored preferences merged over defaults, or empty if none are stored or they
     *         cannot be read
     */
    public Optional<AgentPreferences> load() {
        try {
            Optional<String> stored = store.get(KEY);
            if (stored.isEmpty()) {
                log.info("No stored agent preferences, using defaults");
                return Optional.empty();
            }

            AgentPreferences preferences = AgentPreferences.defaults().merge(parse(stored.get()));
            if (!preferences.isValid()) {
                log.warn("Stored agent preferences are invalid, using defaults");
                return Optional.empty();
            }

            log.info("Loaded agent preferences: {} personas enabled, {} trigger types muted",
                preferences.enabledPersonas().size(), preferences.mutedTriggerTypes().size());
            return Optional.of(preferences);
        } catch (PreferencesStoreException | JsonProcessingException | IllegalArgumentException e) {
            log.warn("Failed to load agent preferences, using defaults: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public AgentPreferences loadOrDefaults() {
        return load().orElseGet(AgentPreferences::defaults);
    }

    /**
     * Persist preferences. Failures are logged only.
     */
    public void save(AgentPreferences preferences) {
        try {
            String json = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(preferences);
            store.set(KEY, json);
            log.debug("Agent preferences saved");
        } catch (PreferencesStoreException | JsonProcessingException e) {
            log.warn("Failed to save agent preferences: {}", e.getMessage());
        }
    }

    private static PreferencesUpdate parse(String json) throws JsonProcessingException {
        JsonNode root = MAPPER.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Preferences document is not a JSON object");
        }

        PreferencesUpdate.Builder update = PreferencesUpdate.builder();

        JsonNode personas = field(root, "enabledPersonas", "enabledAgents");
        if (personas != null) {
            update.enabledPersonas(MAPPER.convertValue(personas, PERSONA_SET));
        }

        JsonNode muted = field(root, "mutedTriggerTypes", "mutedTriggers");
        if (muted != null) {
            update.mutedTriggerTypes(MAPPER.convertValue(muted, TRIGGER_TYPE_SET));
        }

        JsonNode level = field(root, "notificationLevel");
        if (level != null) {
            update.notificationLevel(NotificationLevel.fromWireName(level.asText()));
        }

        JsonNode delay = field(root, "autoSuggestDelayMs", "autoSuggestDelay");
        if (delay != null) {
            if (!delay.canConvertToLong()) {
                throw new IllegalArgumentException("autoSuggestDelayMs is not a number: " + delay);
            }
            update.autoSuggestDelayMs(delay.asLong());
        }

        return update.build();
    }

    private static JsonNode field(JsonNode root, String... names) {
        for (String name : names) {
            JsonNode node = root.get(name);
            if (node != null && !node.isNull()) {
                return node;
            }
        }
        return null;
    }
}
