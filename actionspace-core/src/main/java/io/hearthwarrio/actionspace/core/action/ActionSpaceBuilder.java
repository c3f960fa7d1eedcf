package io.hearthwarrio.actionspace.core.action;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.NodeCategory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds actions from a labeled tree and keeps them across observations.
 */
public final class ActionSpaceBuilder {

    private ActionSpaceBuilder() {
    }

    /**
     * One action per ID-bearing interaction node, in pre-order.
     */
    public static List<Action> build(AccessibilityNode tree) {
        List<Action> actions = new ArrayList<>();
        for (AccessibilityNode node : tree.flatten(ActionSpaceBuilder::isActionNode)) {
            actions.add(toAction(node));
        }
        return actions;
    }

    public static ActionSpace build(AccessibilityNode tree, String description) {
        return new ActionSpace(description, build(tree));
    }

    static Action toAction(AccessibilityNode node) {
        List<ActionParameter> parameters = ActionRole.fromId(node.getId()) == ActionRole.INPUT
                ? List.of(ActionParameter.text())
                : List.of();
        return new Action(
                node.getId(),
                node.getRole() + " '" + node.getName() + "'",
                Action.INTERACTION_CATEGORY,
                parameters
        );
    }

    /**
     * The part of the tree whose IDs are not known yet, or empty when everything is known.
     *
     * @param knownIds IDs already covered by earlier action spaces
     */
    public static Optional<AccessibilityNode> diffUncovered(AccessibilityNode tree, Set<String> knownIds) {
        return tree.subtreeFilter(node -> node.getId() != null && !knownIds.contains(node.getId()));
    }

    /**
     * Discovered actions first, then previous actions that were not rediscovered but whose ID still
     * exists in the current tree.
     */
    public static List<Action> merge(List<Action> previous, List<Action> discovered, AccessibilityNode currentTree) {
        List<Action> merged = new ArrayList<>(discovered);
        Set<String> discoveredIds = new HashSet<>();
        for (Action action : discovered) {
            discoveredIds.add(action.getId());
        }
        for (Action action : previous) {
            if (!discoveredIds.contains(action.getId()) && currentTree.find(action.getId()).isPresent()) {
                merged.add(action);
            }
        }
        return merged;
    }

    private static boolean isActionNode(AccessibilityNode node) {
        return node.getId() != null && node.getRole().in(NodeCategory.INTERACTION);
    }
}
