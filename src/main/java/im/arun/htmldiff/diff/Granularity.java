package im.arun.htmldiff.diff;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Token size used by the inline diff.
 */
public enum Granularity {
    CHARACTER("character"),
    WORD("word"),
    LINE("line");

    private final String value;

    Granularity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Granularity fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim();
        for (Granularity granularity : values()) {
            if (granularity.value.equalsIgnoreCase(normalized) || granularity.name().equalsIgnoreCase(normalized)) {
                return granularity;
            }
        }
        throw new IllegalArgumentException("Unknown granularity: " + value);
    }
}
