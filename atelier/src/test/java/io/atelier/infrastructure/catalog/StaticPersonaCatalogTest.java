package io.atelier.infrastructure.catalog;

import io.atelier.domain.agent.Persona;
import io.atelier.domain.agent.PersonaProfile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StaticPersonaCatalogTest {

    private final StaticPersonaCatalog catalog = new StaticPersonaCatalog();

    @Test
    void testEveryPersonaHasProfile() {
        for (Persona persona : Persona.values()) {
            PersonaProfile profile = catalog.profile(persona);
            assertEquals(persona, profile.persona());
            assertFalse(profile.displayName().isBlank());
            assertFalse(profile.icon().isBlank());
            assertTrue(profile.color().startsWith("#"));
            assertTrue(profile.systemPrompt().contains(profile.displayName()),
                "Prompt introduces " + profile.displayName());
        }
    }

    @Test
    void testAllInDeclarationOrder() {
        List<PersonaProfile> all = catalog.all();

        assertEquals(Persona.values().length, all.size());
        assertEquals(Persona.MUSE, all.get(0).persona());
        assertEquals(Persona.HERITAGE, all.get(4).persona());
        assertThrows(UnsupportedOperationException.class, () -> all.get(0).expertise().add("x"));
    }
}
