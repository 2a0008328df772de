package io.atelier.application.port.output;

import io.atelier.domain.agent.Persona;
import io.atelier.domain.agent.PersonaProfile;

import java.util.List;

/**
 * Read-only persona metadata (names, icons, prompts).
 */
public interface PersonaCatalog {
    PersonaProfile profile(Persona persona);

    /**
     * @return every profile, in persona declaration order
     */
    List<PersonaProfile> all();
}
