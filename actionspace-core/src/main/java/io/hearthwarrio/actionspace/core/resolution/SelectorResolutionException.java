package io.hearthwarrio.actionspace.core.resolution;

import io.hearthwarrio.actionspace.core.ActionSpaceException;

/**
 * Raised when a caller demands a selector for a node that could not be resolved.
 */
public class SelectorResolutionException extends ActionSpaceException {

    private final transient ResolutionFailure failure;

    public SelectorResolutionException(ResolutionFailure failure) {
        super(failure.report());
        this.failure = failure;
    }

    public ResolutionFailure getFailure() {
        return failure;
    }
}
