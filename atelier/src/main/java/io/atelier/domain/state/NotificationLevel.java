package io.atelier.domain.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How chatty the user wants the agents to be. Stored with the preferences and
 * read by the presentation layer.
 */
public enum NotificationLevel {
    ALL,
    IMPORTANT,
    MINIMAL,
    NONE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NotificationLevel fromWireName(String wireName) {
        return valueOf(wireName.toUpperCase(Locale.ROOT));
    }
}
