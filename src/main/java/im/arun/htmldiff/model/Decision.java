package im.arun.htmldiff.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A reviewer's choice for one reviewable node.
 */
public enum Decision {
    ACCEPT("accept"),
    REJECT("reject"),
    UNDECIDED("undecided");

    private final String value;

    Decision(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a wire name ("accept", "reject", "undecided"), case-insensitive.
     * Null or blank maps to {@link #UNDECIDED}.
     */
    @JsonCreator
    public static Decision fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            return UNDECIDED;
        }
        for (Decision decision : values()) {
            if (decision.value.equalsIgnoreCase(value.trim())) {
                return decision;
            }
        }
        throw new IllegalArgumentException("Unknown decision: " + value);
    }
}
