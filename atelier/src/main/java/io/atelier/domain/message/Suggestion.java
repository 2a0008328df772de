package io.atelier.domain.message;

import io.atelier.domain.agent.Persona;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Actionable recommendation produced by the analysis pipeline.
 */
public record Suggestion(
    String id,
    Persona persona,
    String title,
    String description,
    String preview,          // optional preview image/asset reference
    double confidence,       // 0.0 - 1.0
    List<AgentAction> actions,
    Instant createdAt
) {
    public Suggestion {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(persona, "persona");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    /**
     * Caller-supplied part of a suggestion; id and creation time are assigned on insert.
     */
    public record Draft(
        Persona persona,
        String title,
        String description,
        String preview,
        double confidence,
        List<AgentAction> actions
    ) {
        public Draft {
            Objects.requireNonNull(persona, "persona");
            actions = actions == null ? List.of() : List.copyOf(actions);
        }

        public Suggestion toSuggestion(String id, Instant createdAt) {
            return new Suggestion(id, persona, title, description, preview, confidence, actions, createdAt);
        }
    }
}
