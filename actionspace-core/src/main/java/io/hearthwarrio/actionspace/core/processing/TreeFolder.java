package io.hearthwarrio.actionspace.core.processing;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.NodeCategory;
import io.hearthwarrio.actionspace.core.NodeRole;
import io.hearthwarrio.actionspace.core.Role;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collapses wrapper nodes bottom-up into a denser tree.
 * <p>
 * A parent with a single surviving child is folded into it (see {@link RolePromotion} for the role
 * that survives); a parent with several children keeps them in order. Sibling order is never changed.
 */
public final class TreeFolder {

    private final PruningConfig config;
    private final TextGrouper textGrouper;

    public TreeFolder(PruningConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.textGrouper = new TextGrouper(config.getTextGrouping());
    }

    public AccessibilityNode fold(AccessibilityNode node) {
        AccessibilityNode base = node.withoutChildren();
        if (!node.hasChildren()) {
            return base;
        }

        List<AccessibilityNode> folded = new ArrayList<>(node.getChildren().size());
        for (AccessibilityNode child : node.getChildren()) {
            if (!keep(child)) {
                continue;
            }
            AccessibilityNode f = fold(child);
            if (keep(f)) {
                folded.add(f);
            }
        }

        if (folded.isEmpty()) {
            return base;
        }
        if (folded.size() == 1) {
            return foldSingleChild(base, folded.get(0));
        }

        AccessibilityNode parent = base;
        if (base.getRole().is(NodeRole.NONE) || base.getRole().is(NodeRole.GENERIC)) {
            parent = base.withRole(Role.of(NodeRole.GROUP));
        }
        return withChildren(parent, folded);
    }

    private boolean keep(AccessibilityNode node) {
        return node.hasChildren() || !config.shouldPrune(node);
    }

    private AccessibilityNode foldSingleChild(AccessibilityNode base, AccessibilityNode child) {
        if (base.hasBlankName()) {
            RolePromotion promotion = RolePromotion.between(base.getRole(), child.getRole());
            AccessibilityNode promoted = child.getRole().equals(promotion.winner())
                    ? child
                    : child.withRole(promotion.winner());
            if (promotion.recorded() != null) {
                promoted = promoted.addGroupRole(promotion.recorded().getValue());
            }
            return promoted;
        }
        if (child.getRole().in(NodeCategory.TEXT)
                && !child.hasChildren()
                && !child.hasBlankName()
                && base.getName().contains(child.getName())) {
            return base;
        }
        if (base.getRole().is(NodeRole.LINK)
                && child.getRole().is(NodeRole.BUTTON)
                && child.getName().equals(base.getName())) {
            return base;
        }
        if (child.getRole().in(NodeCategory.LIST)) {
            return child;
        }
        if (child.getRole().in(NodeCategory.STRUCTURAL)) {
            return withChildren(base, child.getChildren());
        }
        return withChildren(base, List.of(child));
    }

    private AccessibilityNode withChildren(AccessibilityNode parent, List<AccessibilityNode> children) {
        List<AccessibilityNode> kept = absorbDuplicateTexts(parent, children);
        if (kept.isEmpty()) {
            return parent;
        }
        AccessibilityNode node = parent.withChildren(kept);
        if (config.isGroupTexts()) {
            node = textGrouper.group(node);
        }
        return node;
    }

    /**
     * Text children of a named text or heading node that only repeat (part of) its name are dropped.
     */
    static List<AccessibilityNode> absorbDuplicateTexts(AccessibilityNode parent, List<AccessibilityNode> children) {
        if (!parent.getRole().in(NodeCategory.TEXT) || parent.hasBlankName()) {
            return children;
        }
        List<AccessibilityNode> kept = new ArrayList<>(children.size());
        for (AccessibilityNode child : children) {
            boolean duplicate = child.getRole().in(NodeCategory.TEXT)
                    && !child.hasChildren()
                    && parent.getName().contains(child.getName());
            if (!duplicate) {
                kept.add(child);
            }
        }
        return kept;
    }
}
