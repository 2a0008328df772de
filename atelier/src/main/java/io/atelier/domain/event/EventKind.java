package io.atelier.domain.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event vocabulary observed by the host studio application.
 */
public enum EventKind {
    // ═══════════════════════════════════════════════════════════════
    // CANVAS
    // ═══════════════════════════════════════════════════════════════
    CANVAS_EMPTY("canvas_empty"),
    CARD_CREATED("card_created"),
    CARD_DELETED("card_deleted"),
    CONNECTION_CREATED("connection_created"),
    CONNECTION_DELETED("connection_deleted"),
    STYLE_APPLIED("style_applied"),
    TEXTILE_DROPPED("textile_dropped"),

    // ═══════════════════════════════════════════════════════════════
    // GENERATION
    // ═══════════════════════════════════════════════════════════════
    GENERATION_STARTED("generation_started"),
    GENERATION_COMPLETED("generation_completed"),
    GENERATION_FAILED("generation_failed"),
    QUALITY_ASSESSED("quality_assessed"),
    WORKFLOW_COMPLETED("workflow_completed"),

    // Synthesized by the idle watchdog
    USER_IDLE("user_idle");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * @throws IllegalArgumentException if the name is not part of the vocabulary
     */
    @JsonCreator
    public static EventKind fromWireName(String wireName) {
        for (EventKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(wireName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown event kind: " + wireName);
    }
}
