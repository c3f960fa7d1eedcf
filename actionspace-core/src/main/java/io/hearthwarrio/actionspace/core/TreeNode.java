package io.hearthwarrio.actionspace.core;

import java.util.List;

/**
 * Minimal immutable tree contract shared by {@link AccessibilityNode} and {@link DomNode}.
 * <p>
 * Implementations never mutate themselves; {@link #withChildren(List)} returns a copy.
 *
 * @param <N> concrete node type
 */
public interface TreeNode<N extends TreeNode<N>> {

    Role getRole();

    String getName();

    /**
     * @return stamped ID, or null when the node is not addressable
     */
    String getId();

    List<N> getChildren();

    N withChildren(List<N> children);

    default boolean hasChildren() {
        return !getChildren().isEmpty();
    }
}
