package im.arun.htmldiff.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Review status of a block or list item after diffing.
 */
public enum NodeStatus {
    UNCHANGED("unchanged"),
    ADDED("added"),
    REMOVED("removed"),
    CHANGED("changed");

    private final String value;

    NodeStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
