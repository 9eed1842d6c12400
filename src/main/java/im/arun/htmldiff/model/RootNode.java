package im.arun.htmldiff.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * Document root; children are kept in document order.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class RootNode extends DocumentNode {

    @JsonProperty("children")
    List<DocumentNode> children;

    public RootNode(List<DocumentNode> children) {
        this.children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeType getType() {
        return NodeType.ROOT;
    }
}
