package im.arun.htmldiff.merge;

import im.arun.htmldiff.model.BlockNode;
import im.arun.htmldiff.model.Decision;
import im.arun.htmldiff.model.DocumentNode;
import im.arun.htmldiff.model.ListItemNode;
import im.arun.htmldiff.model.ListNode;
import im.arun.htmldiff.model.NodeStatus;
import im.arun.htmldiff.model.ReviewableNode;
import im.arun.htmldiff.model.RootNode;
import im.arun.htmldiff.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Rebuilds markup from an annotated tree and the reviewer's decisions.
 *
 * <p>An accepted node contributes its modified reading, anything else (rejected or
 * undecided) its original reading, so an edit is only applied once approved. Nested
 * children of a list item are resolved on their own decisions. The decision map is
 * only read.</p>
 */
public class TreeResolver {
    private static final Logger logger = LoggerFactory.getLogger(TreeResolver.class);

    public String resolve(DocumentNode tree, Map<String, Decision> decisions) {
        Map<String, Decision> lookup = decisions == null ? Map.of() : decisions;
        StringBuilder out = new StringBuilder();
        append(tree, lookup, out);
        logger.debug("Resolved tree with {} decisions into {} characters", lookup.size(), out.length());
        return out.toString();
    }

    private void append(DocumentNode node, Map<String, Decision> decisions, StringBuilder out) {
        switch (node.getType()) {
            case ROOT:
                for (DocumentNode child : ((RootNode) node).getChildren()) {
                    append(child, decisions, out);
                }
                break;
            case LIST:
                appendList((ListNode) node, decisions, out);
                break;
            case LIST_ITEM:
                appendItem((ListItemNode) node, decisions, out);
                break;
            case BLOCK:
                appendBlock((BlockNode) node, decisions, out);
                break;
            default:
                throw new IllegalStateException("Unexpected node type: " + node.getType());
        }
    }

    private void appendList(ListNode list, Map<String, Decision> decisions, StringBuilder out) {
        StringBuilder items = new StringBuilder();
        for (DocumentNode child : list.getChildren()) {
            append(child, decisions, items);
        }
        if (items.length() == 0) {
            return;
        }
        String tag = list.getKind().getTagName();
        out.append('<').append(tag).append('>').append(items).append("</").append(tag).append('>');
    }

    private void appendItem(ListItemNode item, Map<String, Decision> decisions, StringBuilder out) {
        Decision decision = decisionFor(item.getId(), decisions);

        StringBuilder nested = new StringBuilder();
        for (DocumentNode child : item.getChildren()) {
            append(child, decisions, nested);
        }

        if (isDropped(item.getStatus(), decision) && nested.length() == 0) {
            return;
        }

        out.append("<li>").append(readingOf(item, decision)).append(nested).append("</li>");
    }

    private void appendBlock(BlockNode block, Map<String, Decision> decisions, StringBuilder out) {
        Decision decision = decisionFor(block.getId(), decisions);
        if (isDropped(block.getStatus(), decision)) {
            return;
        }
        String tag = block.getTag().getTagName();
        out.append('<').append(tag).append('>').append(readingOf(block, decision)).append("</").append(tag).append('>');
    }

    private static String readingOf(ReviewableNode node, Decision decision) {
        if (decision == Decision.ACCEPT) {
            return TreeUtils.modifiedText(node.getContent());
        }
        return TreeUtils.originalText(node.getContent());
    }

    /**
     * A node that exists on one side only disappears when the decision picks the other side.
     */
    private static boolean isDropped(NodeStatus status, Decision decision) {
        if (status == NodeStatus.ADDED) {
            return decision != Decision.ACCEPT;
        }
        if (status == NodeStatus.REMOVED) {
            return decision == Decision.ACCEPT;
        }
        return false;
    }

    private static Decision decisionFor(String id, Map<String, Decision> decisions) {
        Decision decision = decisions.get(id);
        return decision == null ? Decision.UNDECIDED : decision;
    }
}
