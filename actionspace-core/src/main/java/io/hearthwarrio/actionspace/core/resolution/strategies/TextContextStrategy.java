package io.hearthwarrio.actionspace.core.resolution.strategies;

import io.hearthwarrio.actionspace.core.DomNode;
import io.hearthwarrio.actionspace.core.NodeCategory;
import io.hearthwarrio.actionspace.core.resolution.LocatorHandle;
import io.hearthwarrio.actionspace.core.resolution.PageQueryCapability;
import io.hearthwarrio.actionspace.core.resolution.ResolutionContext;
import io.hearthwarrio.actionspace.core.resolution.ResolutionStrategy;
import io.hearthwarrio.actionspace.core.resolution.RoleQuery;
import io.hearthwarrio.actionspace.core.resolution.StrategyOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Disambiguates candidates by the text around them.
 * <p>
 * Picks the closest ancestor holding more text names than the threshold, climbs the same number of levels from
 * every candidate and keeps the candidates whose ancestor contains all those texts. When several remain, the search
 * restarts one level higher with the collected text count as the new threshold. A single surviving ancestor is
 * then searched for the node's exact role and name.
 */
public final class TextContextStrategy implements ResolutionStrategy {

    public static final int ORDER = 400;

    @Override
    public String id() {
        return "text-context";
    }

    @Override
    public int order() {
        return ORDER;
    }

    @Override
    public StrategyOutcome attempt(ResolutionContext context) {
        List<LocatorHandle> candidates = context.directCandidates();
        if (candidates.size() < 2) {
            return StrategyOutcome.notApplicable("needs several candidates, got " + candidates.size());
        }

        PageQueryCapability page = context.getPage();
        List<DomNode> ancestors = context.getAncestorsClosestFirst();
        Set<String> textRoles = context.getConfig().getTextContextRoles();
        RoleQuery exact = RoleQuery.exact(context.getNode().getRole().getValue(), context.getNode().getName());

        int minDepth = context.getConfig().getTextContextMinDepth();
        int minTextCount = context.getConfig().getTextContextMinTextCount();
        int lastSurvivors = candidates.size();

        while (minDepth <= ancestors.size()) {
            int depth = -1;
            List<String> texts = List.of();
            for (int d = minDepth; d <= ancestors.size(); d++) {
                List<String> found = textNames(ancestors.get(d - 1), textRoles);
                if (found.size() > minTextCount) {
                    depth = d;
                    texts = found;
                    break;
                }
            }
            if (depth < 0) {
                break;
            }

            List<LocatorHandle> survivors = new ArrayList<>();
            for (LocatorHandle candidate : candidates) {
                Optional<LocatorHandle> ancestor = page.climbAncestor(candidate, depth);
                if (ancestor.isEmpty()) {
                    continue;
                }
                List<LocatorHandle> kept = List.of(ancestor.get());
                for (String text : texts) {
                    kept = page.filterContainsText(kept, text);
                    if (kept.isEmpty()) {
                        break;
                    }
                }
                if (!kept.isEmpty()) {
                    survivors.add(kept.get(0));
                }
            }

            String described = "text-context(depth=" + depth + ", texts=" + texts + ")";
            if (survivors.isEmpty()) {
                return StrategyOutcome.noMatch(described);
            }
            if (survivors.size() > 1) {
                lastSurvivors = survivors.size();
                minDepth = depth + 1;
                minTextCount = texts.size();
                continue;
            }

            List<LocatorHandle> refined = page.locate(survivors.get(0), List.of(exact));
            String selector = described + " >> " + exact.toSelector();
            if (refined.size() == 1) {
                return StrategyOutcome.resolved(refined.get(0), selector);
            }
            if (refined.isEmpty()) {
                return StrategyOutcome.noMatch(selector);
            }
            return StrategyOutcome.ambiguous(refined.size(), selector);
        }

        return StrategyOutcome.ambiguous(lastSurvivors, "no ancestor level separates the candidates by text");
    }

    /**
     * Text names below {@code node}, in reading order. Interaction subtrees contribute nothing.
     */
    static List<String> textNames(DomNode node, Set<String> textRoles) {
        List<String> out = new ArrayList<>();
        collectTextNames(node, textRoles, out);
        return out;
    }

    private static void collectTextNames(DomNode node, Set<String> textRoles, List<String> out) {
        if (node.getRole().in(NodeCategory.INTERACTION)) {
            return;
        }
        if (textRoles.contains(node.getRole().getValue())) {
            if (!node.getName().isBlank()) {
                out.add(node.getName());
            }
            return;
        }
        for (DomNode child : node.getChildren()) {
            collectTextNames(child, textRoles, out);
        }
    }
}
