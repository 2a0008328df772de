package io.atelier.domain.agent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The fixed set of agent identities the orchestrator speaks for.
 */
public enum Persona {
    MUSE("muse"),
    CURATOR("curator"),
    ARCHITECT("architect"),
    PACKAGER("packager"),
    HERITAGE("heritage");

    private final String id;

    Persona(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Resolve a persona from its lowercase identifier.
     *
     * @throws IllegalArgumentException if the id is unknown
     */
    @JsonCreator
    public static Persona fromId(String id) {
        for (Persona persona : values()) {
            if (persona.id.equalsIgnoreCase(id)) {
                return persona;
            }
        }
        throw new IllegalArgumentException("Unknown persona: " + id);
    }
}
