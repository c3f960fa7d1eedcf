package io.hearthwarrio.actionspace.core.resolution.strategies;

import io.hearthwarrio.actionspace.core.DomNode;
import io.hearthwarrio.actionspace.core.NodeRole;
import io.hearthwarrio.actionspace.core.resolution.LocatorHandle;
import io.hearthwarrio.actionspace.core.resolution.ResolutionContext;
import io.hearthwarrio.actionspace.core.resolution.ResolutionStrategy;
import io.hearthwarrio.actionspace.core.resolution.StrategyOutcome;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Several links with the same name that all lead to the same place are interchangeable: the first one is taken.
 * <p>
 * Hrefs are compared without scheme, without the current host and without {@code #}.
 * A candidate without an href makes the strategy inapplicable.
 */
public final class LinkHrefStrategy implements ResolutionStrategy {

    public static final int ORDER = 200;

    @Override
    public String id() {
        return "link-href";
    }

    @Override
    public int order() {
        return ORDER;
    }

    @Override
    public boolean supports(DomNode node) {
        return node.getRole().is(NodeRole.LINK);
    }

    @Override
    public StrategyOutcome attempt(ResolutionContext context) {
        List<LocatorHandle> candidates = context.directCandidates();
        if (candidates.size() < 2) {
            return StrategyOutcome.notApplicable("needs several candidate links, got " + candidates.size());
        }

        String host = hostOf(context.getPage().currentUrl());
        Set<String> normalized = new LinkedHashSet<>();
        for (LocatorHandle candidate : candidates) {
            Optional<String> href = context.getPage().getAttribute(candidate, "href");
            if (href.isEmpty()) {
                return StrategyOutcome.notApplicable(candidate.describe() + " has no href");
            }
            normalized.add(normalizeHref(href.get(), host));
        }

        if (normalized.size() == 1) {
            return StrategyOutcome.resolved(
                    candidates.get(0),
                    context.directQuery().toSelector() + " >> nth=0"
            );
        }
        return StrategyOutcome.ambiguous(candidates.size(), "links lead to " + normalized);
    }

    static String stripScheme(String url) {
        return url.replace("http://", "").replace("https://", "");
    }

    static String hostOf(String url) {
        if (url == null) {
            return "";
        }
        String stripped = stripScheme(url);
        int slash = stripped.indexOf('/');
        return slash < 0 ? stripped : stripped.substring(0, slash);
    }

    static String normalizeHref(String href, String host) {
        String out = stripScheme(href);
        if (!host.isEmpty()) {
            out = out.replace(host, "");
        }
        return out.replace("#", "");
    }
}
