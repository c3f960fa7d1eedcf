package io.hearthwarrio.actionspace.webdriver;

/**
 * Controls which selector data should be logged for a resolved node.
 */
public enum SelectorLogDetail {

    /**
     * Do not log any selector data.
     */
    NONE,

    /**
     * Log only the primary (role-based) selector.
     */
    PRIMARY_ONLY,

    /**
     * Log every fallback selector plus the iframe/shadow path.
     */
    ALL
}
