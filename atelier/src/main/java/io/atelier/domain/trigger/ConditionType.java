package io.atelier.domain.trigger;

/**
 * Variant tag of a {@link TriggerCondition}.
 */
public enum ConditionType {
    /** Matches a specific event kind. */
    EVENT,

    /** Matches a synthesized idle event whose idle time reaches a threshold. */
    IDLE_TIME,

    /** Needs host canvas state this core does not own; never matches. */
    STATE_BASED,

    /** Needs card content analysis this core does not own; never matches. */
    CONTENT_BASED
}
