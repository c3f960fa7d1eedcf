package io.hearthwarrio.actionspace.core.resolution;

import java.util.Objects;
import java.util.Optional;

/**
 * Typed result of one {@link ResolutionStrategy} attempt.
 */
public final class StrategyOutcome {

    public enum Kind {
        RESOLVED,
        AMBIGUOUS,
        NO_MATCH,
        NOT_APPLICABLE
    }

    private final Kind kind;
    private final LocatorHandle handle;
    private final String selector;
    private final int count;
    private final String detail;

    private StrategyOutcome(Kind kind, LocatorHandle handle, String selector, int count, String detail) {
        this.kind = kind;
        this.handle = handle;
        this.selector = selector;
        this.count = count;
        this.detail = detail == null ? "" : detail;
    }

    /**
     * @param handle   the single matching element
     * @param selector role-based selector that produced it
     */
    public static StrategyOutcome resolved(LocatorHandle handle, String selector) {
        Objects.requireNonNull(handle, "handle must not be null");
        Objects.requireNonNull(selector, "selector must not be null");
        return new StrategyOutcome(Kind.RESOLVED, handle, selector, 1, "");
    }

    public static StrategyOutcome ambiguous(int count, String detail) {
        return new StrategyOutcome(Kind.AMBIGUOUS, null, null, count, detail);
    }

    public static StrategyOutcome noMatch(String detail) {
        return new StrategyOutcome(Kind.NO_MATCH, null, null, 0, detail);
    }

    public static StrategyOutcome notApplicable(String detail) {
        return new StrategyOutcome(Kind.NOT_APPLICABLE, null, null, 0, detail);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isResolved() {
        return kind == Kind.RESOLVED;
    }

    public Optional<LocatorHandle> getHandle() {
        return Optional.ofNullable(handle);
    }

    public Optional<String> getSelector() {
        return Optional.ofNullable(selector);
    }

    /**
     * Number of matches seen; meaningful for {@link Kind#AMBIGUOUS}.
     */
    public int getCount() {
        return count;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        switch (kind) {
            case RESOLVED:
                return "resolved by " + selector;
            case AMBIGUOUS:
                return "ambiguous (" + count + " matches)" + (detail.isEmpty() ? "" : ": " + detail);
            case NO_MATCH:
                return "no match" + (detail.isEmpty() ? "" : ": " + detail);
            default:
                return "not applicable" + (detail.isEmpty() ? "" : ": " + detail);
        }
    }
}
