package io.hearthwarrio.actionspace.webdriver;

import io.hearthwarrio.actionspace.core.resolution.ResolutionFailure;
import io.hearthwarrio.actionspace.core.resolution.UniqueSelector;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Default stdout logger for resolved nodes.
 */
public final class StdOutResolvedSelectorLogger implements ResolvedSelectorLogger {

    static final String PREFIX = "[ActionSpace] ";

    private final SelectorLogDetail detail;
    private final PrintStream out;

    public StdOutResolvedSelectorLogger(SelectorLogDetail detail) {
        this(detail, System.out);
    }

    StdOutResolvedSelectorLogger(SelectorLogDetail detail, PrintStream out) {
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public SelectorLogDetail detail() {
        return detail;
    }

    @Override
    public void logResolvedSelector(String nodeId, String role, String name, UniqueSelector selector) {
        StringBuilder sb = new StringBuilder(256);
        sb.append(PREFIX).append("id=").append(safe(nodeId))
                .append(", role=").append(safe(role))
                .append(", name='").append(safe(name)).append('\'');

        if (detail == SelectorLogDetail.NONE) {
            // still log something minimal
            out.println(sb);
            return;
        }

        sb.append(", strategy=").append(selector.getStrategyId());
        if (detail == SelectorLogDetail.PRIMARY_ONLY) {
            sb.append(", selector=").append(selector.getPrimarySelector());
        } else {
            sb.append(", selectors=").append(selector.getSelectors());
            if (!selector.getIframePath().isEmpty()) {
                sb.append(", iframes=").append(selector.getIframePath());
            }
            if (selector.isInShadowRoot()) {
                sb.append(", shadow=true");
            }
        }
        out.println(sb);
    }

    @Override
    public void logUnresolved(ResolutionFailure failure) {
        out.println(PREFIX + failure.report());
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
