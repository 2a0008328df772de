package io.atelier.domain.message;

import io.atelier.domain.agent.Persona;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Notification surfaced to the user on behalf of a persona.
 *
 * <p>Immutable; read/dismiss transitions return copies. {@code dismissed} is monotone:
 * no transition turns it back off.
 */
public record AgentMessage(
    String id,
    Persona persona,
    MessageKind kind,
    String title,
    String body,
    Instant timestamp,
    boolean read,
    boolean dismissed,
    List<AgentAction> actions,
    MessageContext context      // null when not tied to a canvas element
) {
    public AgentMessage {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(persona, "persona");
        Objects.requireNonNull(kind, "kind");
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public AgentMessage markedRead() {
        return read ? this : new AgentMessage(id, persona, kind, title, body, timestamp,
                                              true, dismissed, actions, context);
    }

    public AgentMessage markedDismissed() {
        return dismissed ? this : new AgentMessage(id, persona, kind, title, body, timestamp,
                                                   read, true, actions, context);
    }

    /**
     * Counted towards the unread badge.
     */
    public boolean isUnread() {
        return !read && !dismissed;
    }
}
