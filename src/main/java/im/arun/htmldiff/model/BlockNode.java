package im.arun.htmldiff.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * A paragraph or heading.
 */
@Value
@EqualsAndHashCode(callSuper = false)
@JsonPropertyOrder({"type", "tag", "id", "status", "content"})
public class BlockNode extends DocumentNode implements ReviewableNode {

    @JsonProperty("tag")
    BlockTag tag;

    @JsonProperty("id")
    String id;

    @JsonProperty("status")
    NodeStatus status;

    @JsonProperty("content")
    List<InlinePart> content;

    public BlockNode(BlockTag tag, String id, NodeStatus status, List<InlinePart> content) {
        this.tag = tag;
        this.id = id;
        this.status = status;
        this.content = content == null ? List.of() : List.copyOf(content);
    }

    @Override
    public NodeType getType() {
        return NodeType.BLOCK;
    }
}
