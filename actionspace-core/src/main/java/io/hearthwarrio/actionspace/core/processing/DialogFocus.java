package io.hearthwarrio.actionspace.core.processing;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.NodeRole;
import io.hearthwarrio.actionspace.core.StructuralInconsistencyException;
import io.hearthwarrio.actionspace.core.Trees;

import java.util.ArrayList;
import java.util.List;

/**
 * When a single interactive dialog is open, only the dialog is actionable: the tree is narrowed to the
 * chain of ancestors leading to it.
 */
public final class DialogFocus {

    private DialogFocus() {
    }

    /**
     * @param root processed tree
     * @return the root-to-dialog chain, or the unchanged root when no interactive dialog exists
     * @throws StructuralInconsistencyException when several interactive dialogs are open at once
     */
    public static AccessibilityNode focus(AccessibilityNode root) {
        List<AccessibilityNode> dialogs = new ArrayList<>();
        for (Trees.Match<AccessibilityNode> match : Trees.findAllTopmost(root, n -> n.getRole().is(NodeRole.DIALOG))) {
            AccessibilityNode chain = chainTo(match);
            if (!chain.interactionNodes(false).isEmpty()) {
                dialogs.add(chain);
            }
        }
        if (dialogs.isEmpty()) {
            return root;
        }
        if (dialogs.size() > 1) {
            throw new StructuralInconsistencyException(
                    "Found " + dialogs.size() + " interactive dialogs; only one open dialog is supported at a time");
        }
        return dialogs.get(0);
    }

    private static AccessibilityNode chainTo(Trees.Match<AccessibilityNode> match) {
        List<AccessibilityNode> path = match.getPath();
        AccessibilityNode current = match.getNode();
        for (int i = path.size() - 2; i >= 0; i--) {
            current = path.get(i).withChildren(List.of(current));
        }
        return current;
    }
}
