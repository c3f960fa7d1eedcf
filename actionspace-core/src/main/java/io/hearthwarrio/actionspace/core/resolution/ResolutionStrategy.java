package io.hearthwarrio.actionspace.core.resolution;

import io.hearthwarrio.actionspace.core.DomNode;

/**
 * One way of narrowing an addressable node down to a single live element.
 * <p>
 * Strategies run in {@link #order()} sequence (ascending); the first {@link StrategyOutcome.Kind#RESOLVED}
 * outcome wins. A strategy must only return a handle that the page reported as the single match of its query.
 */
public interface ResolutionStrategy {

    /**
     * Stable identifier used in diagnostics and recorded on the resulting selector.
     *
     * @return strategy identifier
     */
    default String id() {
        return getClass().getSimpleName();
    }

    /**
     * Lower values run earlier.
     *
     * @return order value
     */
    default int order() {
        return 0;
    }

    /**
     * Whether this strategy is worth trying for the node.
     *
     * @param node node being resolved
     * @return true if applicable
     */
    default boolean supports(DomNode node) {
        return true;
    }

    /**
     * Tries to find exactly one element.
     *
     * @param context node, ancestors, scope and page access for this resolution
     * @return outcome, never null
     */
    StrategyOutcome attempt(ResolutionContext context);
}
