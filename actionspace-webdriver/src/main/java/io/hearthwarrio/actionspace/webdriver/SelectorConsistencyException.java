package io.hearthwarrio.actionspace.webdriver;

import io.hearthwarrio.actionspace.core.ActionSpaceException;

/**
 * A fallback selector of a resolved node does not lead back to the element the resolver found.
 */
public class SelectorConsistencyException extends ActionSpaceException {

    public SelectorConsistencyException(String message) {
        super(message);
    }

    public SelectorConsistencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
