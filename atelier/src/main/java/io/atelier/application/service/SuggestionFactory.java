package io.atelier.application.service;

import io.atelier.application.port.output.PersonaCatalog;
import io.atelier.domain.agent.Persona;
import io.atelier.domain.agent.PersonaProfile;
import io.atelier.domain.message.ActionKind;
import io.atelier.domain.message.AgentAction;
import io.atelier.domain.message.Suggestion;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-persona suggestion template used when an analysis completes.
 */
public final class SuggestionFactory {
    static final double DEFAULT_CONFIDENCE = 0.85;
    static final String FALLBACK_DESCRIPTION = "I have some suggestions for improving your work.";

    private static final List<AgentAction> ACTIONS = List.of(
        AgentAction.primary("apply", "Apply", ActionKind.APPLY),
        AgentAction.secondary("modify", "Modify", ActionKind.MODIFY),
        AgentAction.secondary("skip", "Skip", ActionKind.DISMISS)
    );

    private final PersonaCatalog catalog;
    private final Map<Persona, String> descriptions;

    public SuggestionFactory(PersonaCatalog catalog) {
        this.catalog = catalog;
        this.descriptions = defaultDescriptions();
    }

    public Suggestion.Draft create(Persona persona) {
        PersonaProfile profile = catalog.profile(persona);
        return new Suggestion.Draft(
            persona,
            String.format("%s %s's Recommendation", profile.icon(), profile.displayName()),
            descriptions.getOrDefault(persona, FALLBACK_DESCRIPTION),
            null,
            DEFAULT_CONFIDENCE,
            ACTIONS
        );
    }

    private static Map<Persona, String> defaultDescriptions() {
        Map<Persona, String> d = new EnumMap<>(Persona.class);
        d.put(Persona.MUSE,
            "Try adding dramatic lighting and a shallow depth of field to create a more editorial feel. "
                + "Consider a warmer color grade to evoke emotion.");
        d.put(Persona.CURATOR,
            "This piece stands out from your collection. I recommend featuring it prominently and "
                + "generating 2-3 variations to offer options.");
        d.put(Persona.ARCHITECT,
            "You could save processing time by connecting the style node directly to the output, "
                + "skipping the intermediate merge step.");
        d.put(Persona.PACKAGER,
            "This is ready for marketplace! I suggest creating a bundle with the original, a transparent "
                + "background version, and social media crops.");
        d.put(Persona.HERITAGE,
            "The Kente pattern you selected originates from Ghana and represents royalty and achievement. "
                + "Consider adding this context to your product description.");
        return d;
    }
}
