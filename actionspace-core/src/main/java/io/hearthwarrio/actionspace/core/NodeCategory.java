package io.hearthwarrio.actionspace.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Fixed partition of {@link NodeRole} values.
 * <p>
 * Every pruning, folding and ID decision is driven by the category of a role, never by the raw role string.
 */
public enum NodeCategory {
    INTERACTION,
    TEXT,
    LIST,
    TABLE,
    OTHER,
    IMAGE,
    STRUCTURAL,
    DATA_DISPLAY,
    CODE,
    TREE,
    PARAMETERS;

    /**
     * Role values belonging to this category.
     *
     * @return ordered, read-only set of role values
     */
    public Set<String> roles() {
        return roles(false);
    }

    /**
     * Role values belonging to this category, optionally extended with the placeholder roles
     * ({@code group}, {@code generic}, {@code none}).
     *
     * @param withPlaceholders whether placeholder roles should be included
     * @return ordered, read-only set of role values
     */
    public Set<String> roles(boolean withPlaceholders) {
        Set<String> out = new LinkedHashSet<>();
        for (NodeRole role : NodeRole.values()) {
            if (role.getCategory() == this) {
                out.add(role.getValue());
            }
        }
        if (withPlaceholders) {
            for (NodeRole placeholder : NodeRole.PLACEHOLDERS) {
                out.add(placeholder.getValue());
            }
        }
        return Collections.unmodifiableSet(out);
    }
}
