package im.arun.htmldiff.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * An ordered or unordered list. Only {@link ListItemNode} children are expected.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class ListNode extends DocumentNode {

    @JsonProperty("kind")
    ListKind kind;

    @JsonProperty("children")
    List<DocumentNode> children;

    public ListNode(ListKind kind, List<DocumentNode> children) {
        this.kind = kind;
        this.children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeType getType() {
        return NodeType.LIST;
    }
}
