package io.hearthwarrio.actionspace.core.resolution;

import io.hearthwarrio.actionspace.core.DomNode;

import java.util.List;
import java.util.Objects;

/**
 * Everything a strategy needs for one resolution. Not shared between resolutions.
 */
public final class ResolutionContext {

    private final DomNode node;
    private final List<DomNode> ancestorsClosestFirst;
    private final LocatorHandle scope;
    private final PageQueryCapability page;
    private final ResolutionConfig config;

    private List<LocatorHandle> directCandidates;

    public ResolutionContext(
            DomNode node,
            List<DomNode> ancestorsClosestFirst,
            LocatorHandle scope,
            PageQueryCapability page,
            ResolutionConfig config
    ) {
        this.node = Objects.requireNonNull(node, "node must not be null");
        this.ancestorsClosestFirst = List.copyOf(ancestorsClosestFirst);
        this.scope = scope;
        this.page = Objects.requireNonNull(page, "page must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public DomNode getNode() {
        return node;
    }

    /**
     * Parent first, tree root last.
     */
    public List<DomNode> getAncestorsClosestFirst() {
        return ancestorsClosestFirst;
    }

    /**
     * @return iframe or shadow scope to search in, or {@code null} for the whole document
     */
    public LocatorHandle getScope() {
        return scope;
    }

    public PageQueryCapability getPage() {
        return page;
    }

    public ResolutionConfig getConfig() {
        return config;
    }

    /**
     * Query by role and (non-exact) name, with selected/checked when the node has them set.
     */
    public RoleQuery directQuery() {
        return RoleQuery.of(node, false);
    }

    /**
     * Matches of {@link #directQuery()}, queried once per context.
     */
    public List<LocatorHandle> directCandidates() {
        if (directCandidates == null) {
            directCandidates = List.copyOf(page.locate(scope, List.of(directQuery())));
        }
        return directCandidates;
    }
}
