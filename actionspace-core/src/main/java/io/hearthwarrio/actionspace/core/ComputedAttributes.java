package io.hearthwarrio.actionspace.core;

import java.util.List;
import java.util.Objects;

/**
 * Where a node lives on the live page, and the selectors found for it.
 * <p>
 * The frame and shadow context is recorded when the page is captured; selectors are added once the node is located.
 * <p>
 * {@code iframeParentSelectors} lists the CSS selectors of the enclosing frames, outermost first.
 * {@code shadowHostSelectors} lists the CSS selectors of the enclosing shadow hosts, outermost first.
 */
public final class ComputedAttributes {

    public static final ComputedAttributes EMPTY = new ComputedAttributes(List.of(), false, List.of(), List.of());

    private final List<String> selectors;
    private final boolean inShadowRoot;
    private final List<String> iframeParentSelectors;
    private final List<String> shadowHostSelectors;

    public ComputedAttributes(
            List<String> selectors,
            boolean inShadowRoot,
            List<String> iframeParentSelectors,
            List<String> shadowHostSelectors
    ) {
        this.selectors = selectors == null ? List.of() : List.copyOf(selectors);
        this.inShadowRoot = inShadowRoot;
        this.iframeParentSelectors = iframeParentSelectors == null ? List.of() : List.copyOf(iframeParentSelectors);
        this.shadowHostSelectors = shadowHostSelectors == null ? List.of() : List.copyOf(shadowHostSelectors);
    }

    /**
     * Context of a node inside the given frames and shadow hosts, with no selectors yet.
     */
    public static ComputedAttributes scopedTo(List<String> iframeParentSelectors, List<String> shadowHostSelectors) {
        if (iframeParentSelectors.isEmpty() && shadowHostSelectors.isEmpty()) {
            return EMPTY;
        }
        return new ComputedAttributes(List.of(), !shadowHostSelectors.isEmpty(), iframeParentSelectors, shadowHostSelectors);
    }

    public List<String> getSelectors() {
        return selectors;
    }

    public boolean isInShadowRoot() {
        return inShadowRoot;
    }

    public boolean isInIframe() {
        return !iframeParentSelectors.isEmpty();
    }

    public List<String> getIframeParentSelectors() {
        return iframeParentSelectors;
    }

    public List<String> getShadowHostSelectors() {
        return shadowHostSelectors;
    }

    public ComputedAttributes withSelectors(List<String> selectors) {
        return new ComputedAttributes(selectors, inShadowRoot, iframeParentSelectors, shadowHostSelectors);
    }

    /**
     * Whether the node cannot be reached with a flat page-level query.
     */
    public boolean needsScopedResolution() {
        return inShadowRoot || isInIframe();
    }

    /**
     * Whether both nodes sit behind the same frames and shadow hosts.
     */
    public boolean sameScopeAs(ComputedAttributes other) {
        return iframeParentSelectors.equals(other.iframeParentSelectors)
                && shadowHostSelectors.equals(other.shadowHostSelectors);
    }

    @Override
    public String toString() {
        return "ComputedAttributes{" +
                "selectors=" + selectors +
                ", inShadowRoot=" + inShadowRoot +
                ", iframeParentSelectors=" + iframeParentSelectors +
                ", shadowHostSelectors=" + shadowHostSelectors +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComputedAttributes)) return false;
        ComputedAttributes that = (ComputedAttributes) o;
        return inShadowRoot == that.inShadowRoot &&
                selectors.equals(that.selectors) &&
                iframeParentSelectors.equals(that.iframeParentSelectors) &&
                shadowHostSelectors.equals(that.shadowHostSelectors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(selectors, inShadowRoot, iframeParentSelectors, shadowHostSelectors);
    }
}
