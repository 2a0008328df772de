package io.atelier.infrastructure.persistence;

import io.atelier.application.port.output.PreferencesStoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FilePreferencesStore against a temporary directory.
 */
class FilePreferencesStoreTest {

    @TempDir
    Path dir;

    @Test
    void testMissingKeyIsEmpty() {
        FilePreferencesStore store = new FilePreferencesStore(dir);

        assertEquals(Optional.empty(), store.get("agentPreferences"));
    }

    @Test
    void testWriteThenRead() throws IOException {
        FilePreferencesStore store = new FilePreferencesStore(dir.resolve("nested"));

        store.set("agentPreferences", "{\"a\":1}");
        store.set("agentPreferences", "{\"a\":2}");

        assertEquals(Optional.of("{\"a\":2}"), store.get("agentPreferences"));
        Path file = dir.resolve("nested").resolve("agentPreferences.json");
        assertEquals("{\"a\":2}", Files.readString(file, StandardCharsets.UTF_8));
        try (Stream<Path> files = Files.list(dir.resolve("nested"))) {
            assertEquals(1, files.count(), "No temp files left behind");
        }
    }

    @Test
    void testRejectsPathLikeKeys() {
        FilePreferencesStore store = new FilePreferencesStore(dir);

        assertThrows(IllegalArgumentException.class, () -> store.get("../escape"));
        assertThrows(IllegalArgumentException.class, () -> store.set("a/b", "x"));
        assertThrows(IllegalArgumentException.class, () -> store.get(""));
    }

    @Test
    void testUnreadableFileWrapsIOException() throws IOException {
        Files.createDirectories(dir.resolve("agentPreferences.json"));
        FilePreferencesStore store = new FilePreferencesStore(dir);

        PreferencesStoreException e = assertThrows(PreferencesStoreException.class,
            () -> store.get("agentPreferences"));
        assertEquals("agentPreferences", e.getKey());
        assertNotNull(e.getCause());
    }
}
