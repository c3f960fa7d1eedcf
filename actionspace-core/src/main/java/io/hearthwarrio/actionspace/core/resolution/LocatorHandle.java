package io.hearthwarrio.actionspace.core.resolution;

/**
 * Opaque reference to one live page element (or a search scope) owned by a {@link PageQueryCapability}.
 * <p>
 * Handles are only meaningful to the capability that produced them.
 */
public interface LocatorHandle {

    /**
     * Short human-readable form used in diagnostics.
     *
     * @return description
     */
    String describe();
}
