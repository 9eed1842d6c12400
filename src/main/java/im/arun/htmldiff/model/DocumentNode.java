package im.arun.htmldiff.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Base of the simplified document tree shared by the parser, the differ and the resolver.
 * The set of subclasses is closed; callers dispatch on {@link #getType()}.
 */
@JsonPropertyOrder({"type"})
public abstract class DocumentNode {

    DocumentNode() {
    }

    @JsonProperty("type")
    public abstract NodeType getType();
}
