package io.hearthwarrio.actionspace.core.resolution;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.ComputedAttributes;
import io.hearthwarrio.actionspace.core.DomNode;
import io.hearthwarrio.actionspace.core.InvalidActionException;
import io.hearthwarrio.actionspace.core.NodeCategory;
import io.hearthwarrio.actionspace.core.Trees;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a node ID back into a single live element.
 * <p>
 * Strategies run in order until one reports exactly one match. Nodes inside an iframe or a shadow tree are
 * first scoped through {@link PageQueryCapability#resolveThroughShadowOrIframe(List)}, and the strategies then
 * search inside that scope.
 * <p>
 * A failed resolution is returned as a {@link ResolutionFailure}; exceptions thrown by the page pass through.
 */
public final class SelectorResolver {

    private final PageQueryCapability page;
    private final ResolutionConfig config;
    private final List<ResolutionStrategy> strategies;

    public SelectorResolver(PageQueryCapability page) {
        this(page, ResolutionConfig.DEFAULT, ResolutionStrategies.defaults());
    }

    public SelectorResolver(PageQueryCapability page, ResolutionConfig config) {
        this(page, config, ResolutionStrategies.defaults());
    }

    public SelectorResolver(
            PageQueryCapability page,
            ResolutionConfig config,
            List<? extends ResolutionStrategy> strategies
    ) {
        this.page = Objects.requireNonNull(page, "page must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.strategies = ResolutionStrategies.normalize(strategies);
        if (this.strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one resolution strategy is required");
        }
    }

    public SelectorResolver withConfig(ResolutionConfig config) {
        return new SelectorResolver(page, config, strategies);
    }

    public SelectorResolver withStrategies(List<? extends ResolutionStrategy> strategies) {
        return new SelectorResolver(page, config, strategies);
    }

    public List<ResolutionStrategy> getStrategies() {
        return strategies;
    }

    public ResolutionConfig getConfig() {
        return config;
    }

    /**
     * Resolves against an accessibility tree; no iframe or shadow information is available there.
     */
    public ResolutionResult resolve(String nodeId, AccessibilityNode tree) {
        return resolve(nodeId, DomNode.fromAccessibilityNode(tree));
    }

    /**
     * @param nodeId ID of the node to locate
     * @param tree   tree holding the node, typically the raw tree of the observation
     * @return selector or failure, never null
     * @throws InvalidActionException when no node of {@code tree} carries {@code nodeId}
     */
    public ResolutionResult resolve(String nodeId, DomNode tree) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(tree, "tree must not be null");

        Trees.Match<DomNode> match = tree.findPath(nodeId)
                .orElseThrow(() -> new InvalidActionException(nodeId, "no node with this ID in the tree"));
        DomNode node = match.getNode();

        if (!isLocatable(node)) {
            return ResolutionResult.failed(new ResolutionFailure(
                    nodeId,
                    node.getRole().getValue(),
                    node.getName(),
                    "role '" + node.getRole() + "' is not locatable",
                    Map.of()
            ));
        }

        ComputedAttributes computed = node.getComputedAttributes();
        LocatorHandle scope = null;
        List<SelectorSegment> segments = segmentsOf(computed);
        if (computed.needsScopedResolution() && !segments.isEmpty()) {
            scope = page.resolveThroughShadowOrIframe(segments);
        }

        ResolutionContext context = new ResolutionContext(
                node,
                ancestorsInScope(match.getAncestorsClosestFirst(), computed),
                scope,
                page,
                config
        );

        Map<String, StrategyOutcome> attempts = new LinkedHashMap<>();
        List<ResolutionStrategy> toRun = config.isConflictResolution() ? strategies : strategies.subList(0, 1);
        for (ResolutionStrategy strategy : toRun) {
            if (!strategy.supports(node)) {
                attempts.put(strategy.id(), StrategyOutcome.notApplicable("unsupported role " + node.getRole()));
                continue;
            }
            StrategyOutcome outcome = Objects.requireNonNull(
                    strategy.attempt(context),
                    () -> "Strategy " + strategy.id() + " returned null"
            );
            attempts.put(strategy.id(), outcome);
            if (outcome.isResolved()) {
                return ResolutionResult.resolved(toSelector(nodeId, strategy, outcome, computed));
            }
        }

        String reason = config.isConflictResolution()
                ? "no strategy found a unique element"
                : "conflict resolution is disabled";
        return ResolutionResult.failed(new ResolutionFailure(
                nodeId,
                node.getRole().getValue(),
                node.getName(),
                reason,
                attempts
        ));
    }

    private UniqueSelector toSelector(
            String nodeId,
            ResolutionStrategy strategy,
            StrategyOutcome outcome,
            ComputedAttributes computed
    ) {
        LocatorHandle handle = outcome.getHandle().orElseThrow();
        List<String> selectors = new ArrayList<>();
        selectors.add(outcome.getSelector().orElseThrow());
        for (String s : page.describeSelectors(handle)) {
            if (s != null && !s.isBlank() && !selectors.contains(s)) {
                selectors.add(s);
            }
        }
        for (String s : computed.getSelectors()) {
            if (s != null && !s.isBlank() && !selectors.contains(s)) {
                selectors.add(s);
            }
        }
        return new UniqueSelector(
                nodeId,
                strategy.id(),
                selectors,
                computed.getIframeParentSelectors(),
                computed.isInShadowRoot(),
                handle
        );
    }

    /**
     * Ancestors outside the node's frame or shadow tree cannot be queried from inside it.
     */
    static List<DomNode> ancestorsInScope(List<DomNode> ancestors, ComputedAttributes computed) {
        List<DomNode> kept = new ArrayList<>(ancestors.size());
        for (DomNode ancestor : ancestors) {
            if (ancestor.getComputedAttributes().sameScopeAs(computed)) {
                kept.add(ancestor);
            }
        }
        return kept;
    }

    static List<SelectorSegment> segmentsOf(ComputedAttributes computed) {
        List<SelectorSegment> segments = new ArrayList<>();
        for (String frame : computed.getIframeParentSelectors()) {
            segments.add(SelectorSegment.iframe(frame));
        }
        for (String host : computed.getShadowHostSelectors()) {
            segments.add(SelectorSegment.shadowHost(host));
        }
        return segments;
    }

    /**
     * Images and text carry no interaction and are never located.
     */
    public static boolean isLocatable(DomNode node) {
        return !node.getRole().in(NodeCategory.IMAGE) && !node.getRole().in(NodeCategory.TEXT);
    }
}
