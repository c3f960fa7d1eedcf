package io.hearthwarrio.actionspace.core.processing;

import io.hearthwarrio.actionspace.core.NodeCategory;
import io.hearthwarrio.actionspace.core.NodeRole;
import io.hearthwarrio.actionspace.core.Role;

import java.util.EnumSet;
import java.util.Set;

/**
 * Decides which role survives when a parent is folded into its only child.
 */
final class RolePromotion {

    private static final Set<NodeRole> YIELDING_PARENTS = EnumSet.of(NodeRole.LISTITEM, NodeRole.PARAGRAPH, NodeRole.MAIN);
    private static final Set<NodeRole> YIELDING_CHILDREN = EnumSet.of(NodeRole.LIST, NodeRole.PARAGRAPH);

    private final Role winner;
    private final Role loser;

    private RolePromotion(Role winner, Role loser) {
        this.winner = winner;
        this.loser = loser;
    }

    Role winner() {
        return winner;
    }

    /**
     * @return role to record in the fold history, or null when nothing worth recording was lost
     */
    Role recorded() {
        return loser;
    }

    static RolePromotion between(Role parent, Role child) {
        if (parent.equals(child)) {
            return new RolePromotion(parent, null);
        }
        boolean parentLow = parent.isPlaceholder();
        boolean childLow = child.isPlaceholder();
        if (parentLow && childLow) {
            return new RolePromotion(Role.of(NodeRole.GROUP), null);
        }
        if (parentLow) {
            return new RolePromotion(child, null);
        }
        if (childLow) {
            return new RolePromotion(parent, null);
        }
        if (parent.known().map(YIELDING_PARENTS::contains).orElse(false)) {
            return new RolePromotion(child, parent);
        }
        if (child.known().map(YIELDING_CHILDREN::contains).orElse(false)) {
            return new RolePromotion(parent, child);
        }
        if (parent.in(NodeCategory.INTERACTION) && !child.in(NodeCategory.INTERACTION)) {
            return new RolePromotion(parent, child);
        }
        return new RolePromotion(child, parent);
    }
}
