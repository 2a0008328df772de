package io.atelier.infrastructure.persistence;

import io.atelier.application.port.output.PreferencesStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed store for embedding without a filesystem. Values last for the process only.
 */
public final class InMemoryPreferencesStore implements PreferencesStore {
    private final Map<String, String> values = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value) {
        values.put(key, value);
    }
}
