package io.hearthwarrio.actionspace.webdriver;

import io.hearthwarrio.actionspace.core.resolution.ResolutionFailure;
import io.hearthwarrio.actionspace.core.resolution.UniqueSelector;

/**
 * Receives information about a resolved node.
 * <p>
 * Implementations may log to stdout, Allure, files, etc.
 */
@FunctionalInterface
public interface ResolvedSelectorLogger {

    /**
     * Called after a node ID has been narrowed down to one element.
     *
     * @param nodeId   action ID that was resolved
     * @param role     role of the node in the observed tree
     * @param name     accessible name of the node
     * @param selector selector found by the resolver
     */
    void logResolvedSelector(String nodeId, String role, String name, UniqueSelector selector);

    /**
     * Called when no strategy found a unique element. Ignored by default.
     */
    default void logUnresolved(ResolutionFailure failure) {
    }

    /**
     * Declares how much selector info this logger needs.
     */
    default SelectorLogDetail detail() {
        return SelectorLogDetail.ALL;
    }
}
