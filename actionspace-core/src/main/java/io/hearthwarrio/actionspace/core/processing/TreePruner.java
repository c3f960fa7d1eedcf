package io.hearthwarrio.actionspace.core.processing;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.NodeCategory;
import io.hearthwarrio.actionspace.core.NodeRole;
import io.hearthwarrio.actionspace.core.Role;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Removes uninteresting nodes and applies the fixed rewrite passes.
 * <p>
 * Passes run in this order: link/button folding, button-in-button folding, bottom-up pruning,
 * empty link removal, text collapsing inside interaction nodes. The input tree is never modified.
 */
public final class TreePruner {

    private static final Set<String> EMPTY_LINK_NAMES = Set.of("", "#");

    private final PruningConfig config;

    public TreePruner(PruningConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public PruningConfig getConfig() {
        return config;
    }

    /**
     * Runs every pass.
     *
     * @param root raw tree
     * @return pruned tree, or empty when nothing survives
     */
    public Optional<AccessibilityNode> prune(AccessibilityNode root) {
        AccessibilityNode node = foldLinkButton(root);
        node = foldButtonInButton(node);

        Optional<AccessibilityNode> pruned = pruneNonInterestingNodes(node);
        if (pruned.isEmpty()) {
            return Optional.empty();
        }
        pruned = pruneEmptyLinks(pruned.get());
        if (pruned.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(pruneTextChildInInteractionNodes(pruned.get()));
    }

    /**
     * A link whose only child is a button with the same name loses the child.
     */
    public AccessibilityNode foldLinkButton(AccessibilityNode node) {
        List<AccessibilityNode> children = node.getChildren();
        if (node.getRole().is(NodeRole.LINK)
                && children.size() == 1
                && children.get(0).getRole().is(NodeRole.BUTTON)
                && children.get(0).getName().equals(node.getName())) {
            return node.withoutChildren();
        }
        return mapChildren(node, this::foldLinkButton);
    }

    /**
     * A button whose only child is a button with the same name takes over the inner button's children.
     */
    public AccessibilityNode foldButtonInButton(AccessibilityNode node) {
        List<AccessibilityNode> children = node.getChildren();
        if (node.getRole().is(NodeRole.BUTTON)
                && children.size() == 1
                && children.get(0).getRole().is(NodeRole.BUTTON)
                && children.get(0).getName().equals(node.getName())) {
            return node.withChildren(children.get(0).getChildren());
        }
        return mapChildren(node, this::foldButtonInButton);
    }

    /**
     * Bottom-up removal: children are pruned first, then the node is checked with what is left.
     * <p>
     * When texts are pruned, a text node that still has children is replaced by those children.
     * A root replaced by several children becomes a {@code group} holding them.
     */
    public Optional<AccessibilityNode> pruneNonInterestingNodes(AccessibilityNode node) {
        List<AccessibilityNode> out = pruneToList(node);
        if (out.isEmpty()) {
            return Optional.empty();
        }
        if (out.size() == 1) {
            return Optional.of(out.get(0));
        }
        return Optional.of(node.toBuilder().role(Role.of(NodeRole.GROUP)).children(out).build());
    }

    private List<AccessibilityNode> pruneToList(AccessibilityNode node) {
        List<AccessibilityNode> kept = new ArrayList<>(node.getChildren().size());
        boolean changed = false;
        for (AccessibilityNode child : node.getChildren()) {
            List<AccessibilityNode> pruned = pruneToList(child);
            kept.addAll(pruned);
            changed |= pruned.size() != 1 || pruned.get(0) != child;
        }
        AccessibilityNode rebuilt = changed ? node.withChildren(kept) : node;
        if (kept.isEmpty()) {
            return config.shouldPrune(rebuilt) ? List.of() : List.of(rebuilt);
        }
        if (config.isPruneTexts() && rebuilt.getRole().in(NodeCategory.TEXT)) {
            return kept;
        }
        return List.of(rebuilt);
    }

    /**
     * Links named {@code ""} or {@code "#"} are dropped unless they wrap an image that pruning keeps.
     * A kept link takes the name of its first named image, so it can be labeled like any other link.
     */
    public Optional<AccessibilityNode> pruneEmptyLinks(AccessibilityNode node) {
        if (node.getRole().is(NodeRole.LINK) && EMPTY_LINK_NAMES.contains(node.getName())) {
            if (!node.hasChildren()) {
                return Optional.empty();
            }
            if (config.isPruneImages()) {
                return Optional.empty();
            }
            boolean wrapsImage = false;
            for (AccessibilityNode child : node.getChildren()) {
                if (!child.getRole().in(NodeCategory.IMAGE)) {
                    continue;
                }
                if (!child.hasBlankName()) {
                    return Optional.of(node.toBuilder().name(child.getName()).build());
                }
                wrapsImage = true;
            }
            return wrapsImage ? Optional.of(node) : Optional.empty();
        }

        List<AccessibilityNode> kept = new ArrayList<>(node.getChildren().size());
        boolean changed = false;
        for (AccessibilityNode child : node.getChildren()) {
            Optional<AccessibilityNode> pruned = pruneEmptyLinks(child);
            if (pruned.isPresent()) {
                kept.add(pruned.get());
                changed |= pruned.get() != child;
            } else {
                changed = true;
            }
        }
        return Optional.of(changed ? node.withChildren(kept) : node);
    }

    /**
     * A named interaction node whose subtree holds only text loses that subtree: its name already
     * carries the label. Subtrees of text plus images are left intact.
     */
    public AccessibilityNode pruneTextChildInInteractionNodes(AccessibilityNode node) {
        if (node.getRole().in(NodeCategory.INTERACTION) && node.hasChildren() && !node.getName().isEmpty()) {
            Set<String> otherThanText = node.subtreeRoles(false);
            otherThanText.removeAll(NodeCategory.TEXT.roles(true));
            if (otherThanText.isEmpty()) {
                return node.withoutChildren();
            }
            otherThanText.removeAll(NodeCategory.IMAGE.roles());
            if (otherThanText.isEmpty()) {
                return node;
            }
        }
        return mapChildren(node, this::pruneTextChildInInteractionNodes);
    }

    private static AccessibilityNode mapChildren(
            AccessibilityNode node,
            UnaryOperator<AccessibilityNode> fn
    ) {
        if (!node.hasChildren()) {
            return node;
        }
        List<AccessibilityNode> mapped = new ArrayList<>(node.getChildren().size());
        boolean changed = false;
        for (AccessibilityNode child : node.getChildren()) {
            AccessibilityNode next = fn.apply(child);
            mapped.add(next);
            changed |= next != child;
        }
        return changed ? node.withChildren(mapped) : node;
    }
}
