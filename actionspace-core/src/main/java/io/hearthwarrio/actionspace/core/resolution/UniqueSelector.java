package io.hearthwarrio.actionspace.core.resolution;

import java.util.List;
import java.util.Objects;

/**
 * Address of exactly one live element, as handed to the code that performs the interaction.
 */
public final class UniqueSelector {

    private final String nodeId;
    private final String strategyId;
    private final List<String> selectors;
    private final List<String> iframePath;
    private final boolean inShadowRoot;
    private final LocatorHandle handle;

    public UniqueSelector(
            String nodeId,
            String strategyId,
            List<String> selectors,
            List<String> iframePath,
            boolean inShadowRoot,
            LocatorHandle handle
    ) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId must not be null");
        this.strategyId = Objects.requireNonNull(strategyId, "strategyId must not be null");
        if (selectors == null || selectors.isEmpty()) {
            throw new IllegalArgumentException("selectors must not be empty");
        }
        this.selectors = List.copyOf(selectors);
        this.iframePath = iframePath == null ? List.of() : List.copyOf(iframePath);
        this.inShadowRoot = inShadowRoot;
        this.handle = Objects.requireNonNull(handle, "handle must not be null");
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getStrategyId() {
        return strategyId;
    }

    /**
     * Ordered fallback selectors; the role-based one comes first.
     */
    public List<String> getSelectors() {
        return selectors;
    }

    public String getPrimarySelector() {
        return selectors.get(0);
    }

    /**
     * Selectors of the enclosing iframes, outermost first.
     */
    public List<String> getIframePath() {
        return iframePath;
    }

    public boolean isInShadowRoot() {
        return inShadowRoot;
    }

    /**
     * Live handle found during resolution. Only valid while the page is unchanged.
     */
    public LocatorHandle getHandle() {
        return handle;
    }

    @Override
    public String toString() {
        return "UniqueSelector{" +
                "nodeId='" + nodeId + '\'' +
                ", strategyId='" + strategyId + '\'' +
                ", selectors=" + selectors +
                ", iframePath=" + iframePath +
                ", inShadowRoot=" + inShadowRoot +
                '}';
    }
}
