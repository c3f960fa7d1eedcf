package io.hearthwarrio.actionspace.core.resolution;

import java.util.Objects;
import java.util.Optional;

/**
 * Either a {@link UniqueSelector} or a {@link ResolutionFailure}; never both, never neither.
 */
public final class ResolutionResult {

    private final UniqueSelector selector;
    private final ResolutionFailure failure;

    private ResolutionResult(UniqueSelector selector, ResolutionFailure failure) {
        this.selector = selector;
        this.failure = failure;
    }

    public static ResolutionResult resolved(UniqueSelector selector) {
        return new ResolutionResult(Objects.requireNonNull(selector, "selector must not be null"), null);
    }

    public static ResolutionResult failed(ResolutionFailure failure) {
        return new ResolutionResult(null, Objects.requireNonNull(failure, "failure must not be null"));
    }

    public boolean isResolved() {
        return selector != null;
    }

    public Optional<UniqueSelector> getSelector() {
        return Optional.ofNullable(selector);
    }

    public Optional<ResolutionFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * @throws SelectorResolutionException carrying the failure report when unresolved
     */
    public UniqueSelector orElseThrow() {
        if (selector == null) {
            throw new SelectorResolutionException(failure);
        }
        return selector;
    }

    @Override
    public String toString() {
        return isResolved() ? "ResolutionResult{" + selector + '}' : "ResolutionResult{" + failure + '}';
    }
}
