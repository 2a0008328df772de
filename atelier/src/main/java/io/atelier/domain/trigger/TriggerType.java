package io.atelier.domain.trigger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Proactive trigger types, grouped by the persona that usually owns them.
 * The type selects the message template and is the unit of muting.
 */
public enum TriggerType {
    // Muse
    EMPTY_CANVAS("empty_canvas"),
    LONG_PAUSE("long_pause"),
    CREATIVE_BLOCK("creative_block"),
    POST_GENERATION("post_generation"),
    STYLE_OPPORTUNITY("style_opportunity"),

    // Curator
    QUALITY_DROP("quality_drop"),
    STYLE_DRIFT("style_drift"),
    BEST_PICK("best_pick"),
    COLLECTION_READY("collection_ready"),

    // Architect
    INEFFICIENT_FLOW("inefficient_flow"),
    MISSING_CONNECTION("missing_connection"),
    NEW_FEATURE("new_feature"),
    ERROR_OCCURRED("error_occurred"),

    // Packager
    WORKFLOW_COMPLETE("workflow_complete"),
    BUNDLE_OPPORTUNITY("bundle_opportunity"),
    SELLABLE_QUALITY("sellable_quality"),
    EXPORT_READY("export_ready"),

    // Heritage
    AFRICAN_TEXTILE_USED("african_textile_used"),
    CULTURAL_ELEMENT("cultural_element"),
    ATTRIBUTION_NEEDED("attribution_needed");

    private final String wireName;

    TriggerType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static TriggerType fromWireName(String wireName) {
        for (TriggerType type : values()) {
            if (type.wireName.equalsIgnoreCase(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown trigger type: " + wireName);
    }
}
