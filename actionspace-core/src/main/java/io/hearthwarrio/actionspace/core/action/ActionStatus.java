package io.hearthwarrio.actionspace.core.action;

public enum ActionStatus {
    VALID,
    /**
     * The action could not be located or executed on the live page.
     */
    FAILED,
    /**
     * Removed from the listing by the caller.
     */
    EXCLUDED
}
