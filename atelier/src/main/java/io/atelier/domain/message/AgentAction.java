package io.atelier.domain.message;

import java.util.Map;
import java.util.Objects;

/**
 * A button attached to a message or suggestion. Never mutated after creation.
 *
 * <p>{@code payload} is only meaningful for {@link ActionKind#CUSTOM}; recognized keys are
 * {@link #SWITCH_TO} (a persona id) and {@link #ACTION} ({@code "retry"} or {@code "export"}).
 */
public record AgentAction(
    String id,
    String label,
    String icon,         // optional
    boolean primary,
    ActionKind kind,
    Map<String, Object> payload
) {
    public static final String SWITCH_TO = "switchTo";
    public static final String ACTION = "action";

    public AgentAction {
        Objects.requireNonNull(id, "id");
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static AgentAction primary(String id, String label, ActionKind kind) {
        return new AgentAction(id, label, null, true, kind, Map.of());
    }

    public static AgentAction secondary(String id, String label, ActionKind kind) {
        return new AgentAction(id, label, null, false, kind, Map.of());
    }

    public static AgentAction custom(String id, String label, Map<String, Object> payload) {
        return new AgentAction(id, label, null, false, ActionKind.CUSTOM, payload);
    }
}
