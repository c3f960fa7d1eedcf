package io.hearthwarrio.actionspace.core.resolution.strategies;

import io.hearthwarrio.actionspace.core.resolution.LocatorHandle;
import io.hearthwarrio.actionspace.core.resolution.ResolutionContext;
import io.hearthwarrio.actionspace.core.resolution.ResolutionStrategy;
import io.hearthwarrio.actionspace.core.resolution.StrategyOutcome;

import java.util.List;

/**
 * Queries the page by the node's role and name (plus selected/checked when set).
 */
public final class DirectRoleNameStrategy implements ResolutionStrategy {

    public static final int ORDER = 100;

    @Override
    public String id() {
        return "direct-role-name";
    }

    @Override
    public int order() {
        return ORDER;
    }

    @Override
    public StrategyOutcome attempt(ResolutionContext context) {
        List<LocatorHandle> candidates = context.directCandidates();
        String selector = context.directQuery().toSelector();
        if (candidates.size() == 1) {
            return StrategyOutcome.resolved(candidates.get(0), selector);
        }
        if (candidates.isEmpty()) {
            return StrategyOutcome.noMatch(selector);
        }
        return StrategyOutcome.ambiguous(candidates.size(), selector);
    }
}
