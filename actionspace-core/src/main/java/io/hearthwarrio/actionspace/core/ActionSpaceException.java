package io.hearthwarrio.actionspace.core;

/**
 * Base type of every error raised by the action space pipeline.
 */
public class ActionSpaceException extends RuntimeException {
    public ActionSpaceException(String message) {
        super(message);
    }

    public ActionSpaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
