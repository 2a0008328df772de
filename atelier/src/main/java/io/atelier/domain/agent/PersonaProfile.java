package io.atelier.domain.agent;

import java.util.List;

/**
 * Static metadata for a persona: display text used when rendering messages and
 * the system prompt handed to an inference backend.
 */
public record PersonaProfile(
    Persona persona,
    String displayName,      // e.g. "The Muse"
    String title,            // one-line role
    String description,
    String icon,             // emoji prefix for titles
    String color,            // hex, e.g. "#A855F7"
    List<String> personality,
    List<String> expertise,
    String systemPrompt
) {
    public PersonaProfile {
        personality = personality == null ? List.of() : List.copyOf(personality);
        expertise = expertise == null ? List.of() : List.copyOf(expertise);
    }
}
