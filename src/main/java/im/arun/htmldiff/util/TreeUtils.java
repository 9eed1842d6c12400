package im.arun.htmldiff.util;

import im.arun.htmldiff.model.BlockNode;
import im.arun.htmldiff.model.DiffSummary;
import im.arun.htmldiff.model.DocumentNode;
import im.arun.htmldiff.model.InlinePart;
import im.arun.htmldiff.model.ListItemNode;
import im.arun.htmldiff.model.ListNode;
import im.arun.htmldiff.model.ReviewableNode;
import im.arun.htmldiff.model.RootNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility methods for walking document trees and reading inline parts.
 */
public class TreeUtils {

    /**
     * Child nodes of a container node in document order.
     * Blocks have none; list items return their nested lists and blocks.
     */
    public static List<DocumentNode> childrenOf(DocumentNode node) {
        switch (node.getType()) {
            case ROOT:
                return ((RootNode) node).getChildren();
            case LIST:
                return ((ListNode) node).getChildren();
            case LIST_ITEM:
                return ((ListItemNode) node).getChildren();
            case BLOCK:
                return List.of();
            default:
                throw new IllegalStateException("Unexpected node type: " + node.getType());
        }
    }

    /**
     * Flatten a subtree to plain text for the shape-mismatch fallback.
     * List and root children are joined with a single space; a list item's own
     * content comes before its nested children.
     */
    public static String flattenText(DocumentNode node) {
        switch (node.getType()) {
            case BLOCK:
                return joinText(((BlockNode) node).getContent());
            case LIST_ITEM: {
                ListItemNode item = (ListItemNode) node;
                List<String> pieces = new ArrayList<>();
                pieces.add(joinText(item.getContent()));
                pieces.add(flattenChildren(item.getChildren()));
                return joinNonEmpty(pieces);
            }
            case ROOT:
            case LIST:
                return flattenChildren(childrenOf(node));
            default:
                throw new IllegalStateException("Unexpected node type: " + node.getType());
        }
    }

    private static String flattenChildren(List<DocumentNode> children) {
        List<String> pieces = new ArrayList<>();
        for (DocumentNode child : children) {
            pieces.add(flattenText(child));
        }
        return joinNonEmpty(pieces);
    }

    private static String joinNonEmpty(List<String> pieces) {
        StringBuilder sb = new StringBuilder();
        for (String piece : pieces) {
            if (piece.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(piece);
        }
        return sb.toString();
    }

    /**
     * Concatenate every part regardless of its flags.
     */
    public static String joinText(List<InlinePart> parts) {
        StringBuilder sb = new StringBuilder();
        for (InlinePart part : parts) {
            sb.append(part.getText());
        }
        return sb.toString();
    }

    /**
     * The original reading: every part except the added ones.
     */
    public static String originalText(List<InlinePart> parts) {
        StringBuilder sb = new StringBuilder();
        for (InlinePart part : parts) {
            if (!part.isAdded()) {
                sb.append(part.getText());
            }
        }
        return sb.toString();
    }

    /**
     * The modified reading: every part except the removed ones.
     */
    public static String modifiedText(List<InlinePart> parts) {
        StringBuilder sb = new StringBuilder();
        for (InlinePart part : parts) {
            if (!part.isRemoved()) {
                sb.append(part.getText());
            }
        }
        return sb.toString();
    }

    public static boolean hasChanges(List<InlinePart> parts) {
        return parts.stream().anyMatch(InlinePart::isChange);
    }

    /**
     * All blocks and list items of a tree in document (pre-)order.
     */
    public static List<ReviewableNode> reviewableNodes(DocumentNode root) {
        List<ReviewableNode> result = new ArrayList<>();
        collectReviewable(root, result);
        return result;
    }

    private static void collectReviewable(DocumentNode node, List<ReviewableNode> result) {
        if (node instanceof ReviewableNode) {
            result.add((ReviewableNode) node);
        }
        for (DocumentNode child : childrenOf(node)) {
            collectReviewable(child, result);
        }
    }

    /**
     * @return the reviewable node with the given id, or null if there is none
     */
    public static ReviewableNode findById(DocumentNode root, String id) {
        for (ReviewableNode node : reviewableNodes(root)) {
            if (node.getId().equals(id)) {
                return node;
            }
        }
        return null;
    }

    public static DiffSummary summarize(DocumentNode root) {
        DiffSummary summary = new DiffSummary();
        for (ReviewableNode node : reviewableNodes(root)) {
            summary.increment(node.getStatus());
        }
        return summary;
    }
}
