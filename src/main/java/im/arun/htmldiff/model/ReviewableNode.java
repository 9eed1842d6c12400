package im.arun.htmldiff.model;

import java.util.List;

/**
 * A node carrying its own text that a reviewer can accept or reject:
 * a {@link BlockNode} or a {@link ListItemNode}.
 */
public interface ReviewableNode {

    String getId();

    NodeStatus getStatus();

    List<InlinePart> getContent();
}
