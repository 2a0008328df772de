package io.atelier.application.port.output;

/**
 * Raised by {@link PreferencesStore} adapters when the backing store cannot be read or written.
 */
public class PreferencesStoreException extends RuntimeException {
    private final String key;

    public PreferencesStoreException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
