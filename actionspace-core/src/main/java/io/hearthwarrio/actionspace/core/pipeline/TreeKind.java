package io.hearthwarrio.actionspace.core.pipeline;

/**
 * The three representations kept for one observation.
 */
public enum TreeKind {
    /**
     * Folded and pruned; what the action space is built from.
     */
    PROCESSED,
    /**
     * Pruned only; owner of the ID space.
     */
    SIMPLE,
    /**
     * Pruned raw snapshot, kept for locating elements.
     */
    RAW
}
