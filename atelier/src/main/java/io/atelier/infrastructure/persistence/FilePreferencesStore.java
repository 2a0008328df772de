package io.atelier.infrastructure.persistence;

import io.atelier.application.port.output.PreferencesStore;
import io.atelier.application.port.output.PreferencesStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * File-backed key-value store: each key is a JSON file {@code <dir>/<key>.json}.
 *
 * <p>Writes go to a temp file first and are moved into place, so a crash mid-write leaves
 * the previous value intact.
 */
public final class FilePreferencesStore implements PreferencesStore {
    private static final Logger log = LoggerFactory.getLogger(FilePreferencesStore.class);

    private final Path directory;

    public FilePreferencesStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        Path file = fileFor(key);
        try {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new PreferencesStoreException(key, "Failed to read " + file, e);
        }
    }

    @Override
    public synchronized void set(String key, String value) {
        Path file = fileFor(key);
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, key, ".tmp");
            Files.writeString(temp, value, StandardCharsets.UTF_8);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Preferences written to {}", file);
        } catch (IOException e) {
            throw new PreferencesStoreException(key, "Failed to write " + file, e);
        }
    }

    public Path directory() {
        return directory;
    }

    private Path fileFor(String key) {
        if (key == null || key.isBlank() || !key.matches("[A-Za-z0-9._-]+") || key.startsWith(".")) {
            throw new IllegalArgumentException("Invalid preferences key: " + key);
        }
        return directory.resolve(key + ".json");
    }
}
