package io.atelier.application.port.output;

import java.util.Optional;

/**
 * Generic key-value persistence used for agent preferences.
 * Implementations throw {@link PreferencesStoreException} on I/O failure.
 */
public interface PreferencesStore {
    Optional<String> get(String key);

    void set(String key, String value);
}
