package im.arun.htmldiff.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ListKind {
    UNORDERED("ul"),
    ORDERED("ol");

    private final String tagName;

    ListKind(String tagName) {
        this.tagName = tagName;
    }

    @JsonValue
    public String getTagName() {
        return tagName;
    }

    /**
     * @return the kind for "ul" or "ol", or null for any other tag
     */
    public static ListKind fromTagName(String tagName) {
        for (ListKind kind : values()) {
            if (kind.tagName.equalsIgnoreCase(tagName)) {
                return kind;
            }
        }
        return null;
    }
}
