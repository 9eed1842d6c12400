package im.arun.htmldiff.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tags recognised as standalone text blocks: paragraphs and headings.
 */
public enum BlockTag {
    PARAGRAPH("p"),
    HEADING1("h1"),
    HEADING2("h2"),
    HEADING3("h3"),
    HEADING4("h4"),
    HEADING5("h5"),
    HEADING6("h6");

    private final String tagName;

    BlockTag(String tagName) {
        this.tagName = tagName;
    }

    @JsonValue
    public String getTagName() {
        return tagName;
    }

    /**
     * @return the block tag for the given element name, or null if it is not a block
     */
    public static BlockTag fromTagName(String tagName) {
        for (BlockTag tag : values()) {
            if (tag.tagName.equalsIgnoreCase(tagName)) {
                return tag;
            }
        }
        return null;
    }
}
