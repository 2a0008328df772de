package io.atelier.domain.message;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a message is for; drives how the UI badges it.
 */
public enum MessageKind {
    SUGGESTION,      // proactive suggestion
    ANALYSIS,        // analysis result
    WARNING,         // style drift or quality warning
    CELEBRATION,
    QUESTION,        // asks for user input
    RECOMMENDATION,  // post-generation recommendation
    EDUCATION;       // cultural/educational content

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
