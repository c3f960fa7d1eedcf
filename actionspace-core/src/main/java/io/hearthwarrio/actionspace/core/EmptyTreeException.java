package io.hearthwarrio.actionspace.core;

/**
 * A pruning or filtering stage removed every node of the tree.
 */
public class EmptyTreeException extends ActionSpaceException {
    public EmptyTreeException(String stage) {
        super("Filtering removed every node while " + stage);
    }
}
