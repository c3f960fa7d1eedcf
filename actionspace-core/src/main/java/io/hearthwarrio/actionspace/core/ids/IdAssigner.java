package io.hearthwarrio.actionspace.core.ids;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.IdScheme;
import io.hearthwarrio.actionspace.core.Role;
import io.hearthwarrio.actionspace.core.Trees;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Stamps sequential {@code <Prefix><N>} IDs on eligible nodes in depth-first pre-order.
 * <p>
 * Counters live in a map local to each call, so the result depends only on the tree.
 * Nodes that are not eligible keep whatever ID they already had.
 */
public final class IdAssigner {

    private IdAssigner() {
    }

    public static AccessibilityNode assignIds(AccessibilityNode root) {
        return assignIds(root, null);
    }

    /**
     * @param root         tree to label
     * @param onlyForRoles when non-null, only nodes with one of these role values are labeled
     * @return labeled copy of the tree
     */
    public static AccessibilityNode assignIds(AccessibilityNode root, Set<String> onlyForRoles) {
        Map<String, Integer> counters = new HashMap<>();
        List<String> idsInPreOrder = new ArrayList<>();

        Deque<AccessibilityNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AccessibilityNode node = stack.pop();
            idsInPreOrder.add(nextId(node, onlyForRoles, counters));
            List<AccessibilityNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }

        return Trees.rebuild(root, (node, index) -> {
            String id = idsInPreOrder.get(index);
            if (id == null || id.equals(node.getId())) {
                return node;
            }
            return node.withId(id);
        });
    }

    private static String nextId(AccessibilityNode node, Set<String> onlyForRoles, Map<String, Integer> counters) {
        Role role = node.getRole();
        if (!IdScheme.isEligible(role, node.getName())) {
            return null;
        }
        if (onlyForRoles != null && !onlyForRoles.contains(role.getValue())) {
            return null;
        }
        Optional<String> prefix = role.idPrefix();
        if (prefix.isEmpty()) {
            return null;
        }
        int n = counters.getOrDefault(prefix.get(), 1);
        counters.put(prefix.get(), n + 1);
        return prefix.get() + n;
    }
}
