package io.hearthwarrio.actionspace.core.resolution.strategies;

import io.hearthwarrio.actionspace.core.DomNode;
import io.hearthwarrio.actionspace.core.NodeRole;
import io.hearthwarrio.actionspace.core.resolution.LocatorHandle;
import io.hearthwarrio.actionspace.core.resolution.ResolutionContext;
import io.hearthwarrio.actionspace.core.resolution.ResolutionStrategy;
import io.hearthwarrio.actionspace.core.resolution.RoleQuery;
import io.hearthwarrio.actionspace.core.resolution.StrategyOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * Prepends the closest ancestors to the query, one more at a time, until exactly one element matches.
 * <p>
 * The tree root is never part of a window. Ancestors that cannot be queried by role (placeholders
 * without a name, the document itself) are skipped, and a window that adds nothing queryable is not re-run.
 */
public final class AncestorPathStrategy implements ResolutionStrategy {

    public static final int ORDER = 300;

    @Override
    public String id() {
        return "ancestor-path";
    }

    @Override
    public int order() {
        return ORDER;
    }

    @Override
    public StrategyOutcome attempt(ResolutionContext context) {
        List<DomNode> ancestors = context.getAncestorsClosestFirst();
        if (ancestors.size() < 2) {
            return StrategyOutcome.notApplicable("node has no ancestor below the root");
        }

        RoleQuery self = RoleQuery.exact(context.getNode().getRole().getValue(), context.getNode().getName());
        List<RoleQuery> previous = null;
        int lastCount = 0;
        String lastSelector = "";

        for (int k = 1; k < ancestors.size(); k++) {
            List<RoleQuery> path = new ArrayList<>();
            for (int i = k - 1; i >= 0; i--) {
                DomNode ancestor = ancestors.get(i);
                if (isQueryable(ancestor)) {
                    path.add(RoleQuery.exact(ancestor.getRole().getValue(), ancestor.getName()));
                }
            }
            path.add(self);
            if (path.equals(previous)) {
                continue;
            }
            previous = path;

            List<LocatorHandle> found = context.getPage().locate(context.getScope(), path);
            lastCount = found.size();
            lastSelector = RoleQuery.toSelector(path);
            if (found.size() == 1) {
                return StrategyOutcome.resolved(found.get(0), lastSelector);
            }
        }

        if (lastCount > 1) {
            return StrategyOutcome.ambiguous(lastCount, lastSelector);
        }
        return StrategyOutcome.noMatch(lastSelector);
    }

    static boolean isQueryable(DomNode ancestor) {
        if (ancestor.getRole().is(NodeRole.WEB_AREA)
                || ancestor.getRole().getValue().equalsIgnoreCase("RootWebArea")) {
            return false;
        }
        return !(ancestor.getRole().isPlaceholder() && ancestor.getName().isBlank());
    }
}
