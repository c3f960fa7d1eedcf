package io.hearthwarrio.actionspace.core;

/**
 * The requested action ID does not exist in the current tree.
 */
public class InvalidActionException extends ActionSpaceException {

    private final String actionId;

    public InvalidActionException(String actionId, String reason) {
        super("Action '" + actionId + "' is not available: " + reason);
        this.actionId = actionId;
    }

    public String getActionId() {
        return actionId;
    }
}
