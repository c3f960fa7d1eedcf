package io.hearthwarrio.actionspace.core.resolution;

import java.util.Objects;

/**
 * One boundary crossed on the way to an element living in an iframe or a shadow tree.
 */
public final class SelectorSegment {

    public enum Kind {
        IFRAME,
        SHADOW_HOST
    }

    private final Kind kind;
    private final String selector;

    public SelectorSegment(Kind kind, String selector) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
    }

    public static SelectorSegment iframe(String selector) {
        return new SelectorSegment(Kind.IFRAME, selector);
    }

    public static SelectorSegment shadowHost(String selector) {
        return new SelectorSegment(Kind.SHADOW_HOST, selector);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * CSS selector of the frame element or shadow host, relative to the previous segment.
     */
    public String getSelector() {
        return selector;
    }

    @Override
    public String toString() {
        return kind + "(" + selector + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SelectorSegment)) {
            return false;
        }
        SelectorSegment that = (SelectorSegment) o;
        return kind == that.kind && selector.equals(that.selector);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, selector);
    }
}
