package im.arun.htmldiff.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminator for the closed set of document node kinds.
 */
public enum NodeType {
    ROOT("root"),
    LIST("list"),
    LIST_ITEM("li"),
    BLOCK("block");

    private final String value;

    NodeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
