package io.hearthwarrio.actionspace.core.ids;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.StructuralInconsistencyException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Verifies that two trees agree on their ID-bearing interaction nodes.
 * <p>
 * Strict mode requires equal role and name per ID; soft mode accepts a name contained in the other.
 */
public final class TreeConsistencyChecker {

    private TreeConsistencyChecker() {
    }

    public static void check(AccessibilityNode tree, AccessibilityNode other) {
        check(tree, other, false);
    }

    /**
     * @throws StructuralInconsistencyException listing every disagreement
     */
    public static void check(AccessibilityNode tree, AccessibilityNode other, boolean soft) {
        Map<String, AccessibilityNode> left = byId(tree);
        Map<String, AccessibilityNode> right = byId(other);

        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, AccessibilityNode> e : left.entrySet()) {
            AccessibilityNode b = right.get(e.getKey());
            if (b == null) {
                errors.add(e.getKey() + " is missing from the other tree");
            } else if (!consistent(e.getValue(), b, soft)) {
                errors.add(e.getKey() + ": " + describe(e.getValue()) + " != " + describe(b));
            }
        }
        for (String id : right.keySet()) {
            if (!left.containsKey(id)) {
                errors.add(id + " only exists in the other tree");
            }
        }
        if (!errors.isEmpty()) {
            throw new StructuralInconsistencyException(
                    "Trees disagree on " + errors.size() + " interaction node(s): " + String.join("; ", errors));
        }
    }

    private static Map<String, AccessibilityNode> byId(AccessibilityNode tree) {
        Map<String, AccessibilityNode> out = new LinkedHashMap<>();
        for (AccessibilityNode node : tree.interactionNodes(true)) {
            AccessibilityNode previous = out.put(node.getId(), node);
            if (previous != null) {
                throw new StructuralInconsistencyException(
                        "ID " + node.getId() + " is used twice: " + describe(previous) + " and " + describe(node));
            }
        }
        return out;
    }

    private static boolean consistent(AccessibilityNode a, AccessibilityNode b, boolean soft) {
        if (!a.getRole().equals(b.getRole())) {
            return false;
        }
        if (a.getName().equals(b.getName())) {
            return true;
        }
        return soft && (a.getName().contains(b.getName()) || b.getName().contains(a.getName()));
    }

    private static String describe(AccessibilityNode node) {
        return node.getRole() + " '" + node.getName() + "'";
    }
}
