package io.atelier.domain.trigger;

/**
 * Display priority of a trigger. Metadata for the UI (sorting, badges);
 * the evaluator fires every eligible trigger regardless of priority.
 */
public enum TriggerPriority {
    LOW,
    MEDIUM,
    HIGH
}
