package im.arun.htmldiff.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * One entry of a list. {@code content} is the item's own markup; nested lists and
 * blocks found inside the item are kept in {@code children}.
 */
@Value
@EqualsAndHashCode(callSuper = false)
@JsonPropertyOrder({"type", "id", "status", "content", "children"})
public class ListItemNode extends DocumentNode implements ReviewableNode {

    @JsonProperty("id")
    String id;

    @JsonProperty("status")
    NodeStatus status;

    @JsonProperty("content")
    List<InlinePart> content;

    @JsonProperty("children")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    List<DocumentNode> children;

    public ListItemNode(String id, NodeStatus status, List<InlinePart> content, List<DocumentNode> children) {
        this.id = id;
        this.status = status;
        this.content = content == null ? List.of() : List.copyOf(content);
        this.children = children == null ? List.of() : List.copyOf(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    @Override
    public NodeType getType() {
        return NodeType.LIST_ITEM;
    }
}
