package io.hearthwarrio.actionspace.core;

/**
 * An ID-bearing node (or an action built from one) breaks the addressing invariants.
 */
public class EligibilityViolationException extends ActionSpaceException {
    public EligibilityViolationException(String message) {
        super(message);
    }
}
