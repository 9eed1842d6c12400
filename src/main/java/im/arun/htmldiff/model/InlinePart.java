package im.arun.htmldiff.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * A run of text/markup belonging to the original only ({@code removed}),
 * the modified only ({@code added}), or both.
 */
@Value
@JsonPropertyOrder({"text", "added", "removed"})
public class InlinePart {

    @JsonProperty("text")
    String text;

    @JsonProperty("added")
    boolean added;

    @JsonProperty("removed")
    boolean removed;

    public InlinePart(String text, boolean added, boolean removed) {
        if (added && removed) {
            throw new IllegalArgumentException("An inline part cannot be both added and removed");
        }
        this.text = text == null ? "" : text;
        this.added = added;
        this.removed = removed;
    }

    public static InlinePart unchanged(String text) {
        return new InlinePart(text, false, false);
    }

    public static InlinePart added(String text) {
        return new InlinePart(text, true, false);
    }

    public static InlinePart removed(String text) {
        return new InlinePart(text, false, true);
    }

    @JsonIgnore
    public boolean isChange() {
        return added || removed;
    }
}
