package io.hearthwarrio.actionspace.core.resolution;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the live page, provided by the browser driver integration.
 * <p>
 * Implementations never mutate the page. Their exceptions (detached elements, timeouts, closed sessions)
 * propagate through the resolver unchanged.
 */
public interface PageQueryCapability {

    /**
     * @return URL of the current document
     */
    String currentUrl();

    /**
     * Nested role query: each query is evaluated inside the elements matched by the previous one.
     *
     * @param scope search root, or {@code null} for the whole document
     * @param path  queries from outermost to innermost (non-empty)
     * @return distinct matches of the last query, in document order
     */
    List<LocatorHandle> locate(LocatorHandle scope, List<RoleQuery> path);

    /**
     * @return number of elements {@link #locate} would return
     */
    default int count(LocatorHandle scope, List<RoleQuery> path) {
        return locate(scope, path).size();
    }

    Optional<String> getAttribute(LocatorHandle handle, String name);

    boolean isEditable(LocatorHandle handle);

    boolean isEnabled(LocatorHandle handle);

    boolean isVisible(LocatorHandle handle);

    /**
     * @param levels number of parent steps (at least 1)
     * @return the ancestor, or empty when the document root is passed first
     */
    Optional<LocatorHandle> climbAncestor(LocatorHandle handle, int levels);

    /**
     * @return the handles whose text content contains {@code text}, order preserved
     */
    List<LocatorHandle> filterContainsText(List<LocatorHandle> handles, String text);

    /**
     * Enters the frames and shadow roots named by the segments, in order.
     *
     * @return scope to run role queries in
     */
    LocatorHandle resolveThroughShadowOrIframe(List<SelectorSegment> segments);

    /**
     * Fallback selectors (CSS, XPath, ...) that address the element behind {@code handle} on their own.
     */
    default List<String> describeSelectors(LocatorHandle handle) {
        return List.of();
    }
}
