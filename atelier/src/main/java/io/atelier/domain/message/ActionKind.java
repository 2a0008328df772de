package io.atelier.domain.message;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Response a user (or automation) can take on a message or suggestion.
 */
public enum ActionKind {
    APPLY,
    PREVIEW,
    MODIFY,
    DISMISS,
    SNOOZE,
    NEVER,
    CUSTOM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
