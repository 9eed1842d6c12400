package im.arun.htmldiff.merge;

import im.arun.htmldiff.model.Decision;
import im.arun.htmldiff.model.DocumentNode;
import im.arun.htmldiff.model.NodeStatus;
import im.arun.htmldiff.model.ReviewableNode;
import im.arun.htmldiff.util.TreeUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for building reviewer decision maps. Every method returns a new map and
 * leaves its arguments untouched.
 */
public final class DecisionMaps {

    private DecisionMaps() {}

    public static Map<String, Decision> acceptAll(DocumentNode tree) {
        return uniform(tree, Decision.ACCEPT);
    }

    public static Map<String, Decision> rejectAll(DocumentNode tree) {
        return uniform(tree, Decision.REJECT);
    }

    private static Map<String, Decision> uniform(DocumentNode tree, Decision decision) {
        Map<String, Decision> decisions = new LinkedHashMap<>();
        for (ReviewableNode node : TreeUtils.reviewableNodes(tree)) {
            decisions.put(node.getId(), decision);
        }
        return decisions;
    }

    /**
     * Apply a button press: choosing the decision that is already active clears it
     * back to undecided, anything else replaces it.
     */
    public static Map<String, Decision> toggle(Map<String, Decision> decisions, String id, Decision decision) {
        Map<String, Decision> updated = decisions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(decisions);
        Decision current = updated.get(id);

        if (decision == null || decision == Decision.UNDECIDED || decision == current) {
            updated.remove(id);
        } else {
            updated.put(id, decision);
        }
        return updated;
    }

    /**
     * Ids of nodes that carry an edit but have no accept/reject decision yet.
     */
    public static List<String> pending(DocumentNode tree, Map<String, Decision> decisions) {
        List<String> ids = new ArrayList<>();
        for (ReviewableNode node : TreeUtils.reviewableNodes(tree)) {
            if (node.getStatus() == NodeStatus.UNCHANGED) {
                continue;
            }
            Decision decision = decisions == null ? null : decisions.get(node.getId());
            if (decision == null || decision == Decision.UNDECIDED) {
                ids.add(node.getId());
            }
        }
        return ids;
    }
}
