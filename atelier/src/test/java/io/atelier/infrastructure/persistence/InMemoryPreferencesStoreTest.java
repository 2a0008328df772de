package io.atelier.infrastructure.persistence;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryPreferencesStoreTest {

    @Test
    void testSetOverwrites() {
        InMemoryPreferencesStore store = new InMemoryPreferencesStore();
        assertEquals(Optional.empty(), store.get("k"));

        store.set("k", "1");
        store.set("k", "2");

        assertEquals(Optional.of("2"), store.get("k"));
    }
}
