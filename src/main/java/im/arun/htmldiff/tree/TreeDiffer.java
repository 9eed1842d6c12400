package im.arun.htmldiff.tree;

import im.arun.htmldiff.diff.InlineDiffer;
import im.arun.htmldiff.model.BlockNode;
import im.arun.htmldiff.model.BlockTag;
import im.arun.htmldiff.model.DocumentNode;
import im.arun.htmldiff.model.InlinePart;
import im.arun.htmldiff.model.ListItemNode;
import im.arun.htmldiff.model.ListNode;
import im.arun.htmldiff.model.NodeStatus;
import im.arun.htmldiff.model.NodeType;
import im.arun.htmldiff.model.RootNode;
import im.arun.htmldiff.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Aligns an original and a modified tree into one annotated tree.
 *
 * <p>Children of roots, lists and list items are aligned by index. A node present on
 * one side only is copied with status {@code added} or {@code removed}. Nodes of the
 * same shape are compared structurally; nodes of different shape (a paragraph against
 * a list, an {@code h2} against a {@code p}) are flattened to text and compared as a
 * single paragraph-like block.</p>
 */
public class TreeDiffer {
    private static final Logger logger = LoggerFactory.getLogger(TreeDiffer.class);

    private final InlineDiffer inlineDiffer;

    public TreeDiffer() {
        this(new InlineDiffer());
    }

    public TreeDiffer(InlineDiffer inlineDiffer) {
        this.inlineDiffer = inlineDiffer;
    }

    /**
     * Diff two parsed documents. Neither may be null; a null parse result means
     * there is nothing to diff and must be handled by the caller.
     */
    public RootNode diff(RootNode original, RootNode modified) {
        Objects.requireNonNull(original, "original tree");
        Objects.requireNonNull(modified, "modified tree");

        NodeIdSequence ids = new NodeIdSequence();
        List<DocumentNode> children = diffChildren(original.getChildren(), modified.getChildren(), ids);

        logger.debug("Diffed {} original against {} modified top-level nodes",
            original.getChildren().size(), modified.getChildren().size());
        return new RootNode(children);
    }

    private List<DocumentNode> diffChildren(List<DocumentNode> a, List<DocumentNode> b, NodeIdSequence ids) {
        List<DocumentNode> result = new ArrayList<>();
        int maxLen = Math.max(a.size(), b.size());

        for (int i = 0; i < maxLen; i++) {
            DocumentNode aNode = i < a.size() ? a.get(i) : null;
            DocumentNode bNode = i < b.size() ? b.get(i) : null;

            if (aNode == null) {
                result.add(markSubtree(bNode, NodeStatus.ADDED, ids));
            } else if (bNode == null) {
                result.add(markSubtree(aNode, NodeStatus.REMOVED, ids));
            } else if (sameShape(aNode, bNode)) {
                result.add(diffSameShape(aNode, bNode, ids));
            } else {
                result.add(diffFallback(aNode, bNode, ids));
            }
        }

        return result;
    }

    private static boolean sameShape(DocumentNode a, DocumentNode b) {
        if (a.getType() != b.getType()) {
            return false;
        }
        if (a.getType() == NodeType.BLOCK) {
            return ((BlockNode) a).getTag() == ((BlockNode) b).getTag();
        }
        return a.getType() == NodeType.LIST || a.getType() == NodeType.LIST_ITEM;
    }

    private DocumentNode diffSameShape(DocumentNode a, DocumentNode b, NodeIdSequence ids) {
        switch (a.getType()) {
            case LIST: {
                ListNode aList = (ListNode) a;
                ListNode bList = (ListNode) b;
                return new ListNode(aList.getKind(), diffChildren(aList.getChildren(), bList.getChildren(), ids));
            }
            case LIST_ITEM:
                return diffItem((ListItemNode) a, (ListItemNode) b, ids);
            case BLOCK: {
                BlockNode aBlock = (BlockNode) a;
                BlockNode bBlock = (BlockNode) b;
                String id = ids.nextBlockId();
                List<InlinePart> parts = inlineDiffer.diff(
                    TreeUtils.joinText(aBlock.getContent()), TreeUtils.joinText(bBlock.getContent()));
                return new BlockNode(aBlock.getTag(), id, statusOf(parts), parts);
            }
            default:
                throw new IllegalStateException("Unexpected node type: " + a.getType());
        }
    }

    private ListItemNode diffItem(ListItemNode a, ListItemNode b, NodeIdSequence ids) {
        String id = ids.nextItemId();
        List<InlinePart> parts = inlineDiffer.diff(
            TreeUtils.joinText(a.getContent()), TreeUtils.joinText(b.getContent()));

        List<DocumentNode> children = List.of();
        if (a.hasChildren() || b.hasChildren()) {
            children = diffChildren(a.getChildren(), b.getChildren(), ids);
        }

        return new ListItemNode(id, statusOf(parts), parts, children);
    }

    private BlockNode diffFallback(DocumentNode a, DocumentNode b, NodeIdSequence ids) {
        BlockTag tag;
        if (b.getType() == NodeType.BLOCK) {
            tag = ((BlockNode) b).getTag();
        } else if (a.getType() == NodeType.BLOCK) {
            tag = ((BlockNode) a).getTag();
        } else {
            tag = BlockTag.PARAGRAPH;
        }

        logger.debug("Shape mismatch ({} vs {}), comparing flattened text", a.getType(), b.getType());

        String id = ids.nextBlockId();
        List<InlinePart> parts = inlineDiffer.diff(TreeUtils.flattenText(a), TreeUtils.flattenText(b));
        return new BlockNode(tag, id, statusOf(parts), parts);
    }

    /**
     * Copy a one-sided subtree, marking every block and item with the given status
     * and turning its content into a single added or removed part.
     */
    private DocumentNode markSubtree(DocumentNode node, NodeStatus status, NodeIdSequence ids) {
        switch (node.getType()) {
            case LIST: {
                ListNode list = (ListNode) node;
                return new ListNode(list.getKind(), markAll(list.getChildren(), status, ids));
            }
            case LIST_ITEM: {
                ListItemNode item = (ListItemNode) node;
                String id = ids.nextItemId();
                List<InlinePart> content = markedContent(TreeUtils.joinText(item.getContent()), status);
                return new ListItemNode(id, status, content, markAll(item.getChildren(), status, ids));
            }
            case BLOCK: {
                BlockNode block = (BlockNode) node;
                String id = ids.nextBlockId();
                return new BlockNode(block.getTag(), id, status,
                    markedContent(TreeUtils.joinText(block.getContent()), status));
            }
            default:
                throw new IllegalStateException("Unexpected node type: " + node.getType());
        }
    }

    private List<DocumentNode> markAll(List<DocumentNode> nodes, NodeStatus status, NodeIdSequence ids) {
        List<DocumentNode> result = new ArrayList<>();
        for (DocumentNode node : nodes) {
            result.add(markSubtree(node, status, ids));
        }
        return result;
    }

    private static List<InlinePart> markedContent(String text, NodeStatus status) {
        if (text.isEmpty()) {
            return List.of();
        }
        return List.of(status == NodeStatus.ADDED ? InlinePart.added(text) : InlinePart.removed(text));
    }

    private static NodeStatus statusOf(List<InlinePart> parts) {
        return TreeUtils.hasChanges(parts) ? NodeStatus.CHANGED : NodeStatus.UNCHANGED;
    }
}
