package io.hearthwarrio.actionspace.core.resolution;

import io.hearthwarrio.actionspace.core.resolution.strategies.AncestorPathStrategy;
import io.hearthwarrio.actionspace.core.resolution.strategies.DirectRoleNameStrategy;
import io.hearthwarrio.actionspace.core.resolution.strategies.LinkHrefStrategy;
import io.hearthwarrio.actionspace.core.resolution.strategies.TextContextStrategy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Utility methods for {@link ResolutionStrategy} collections.
 */
public final class ResolutionStrategies {

    private ResolutionStrategies() {
    }

    /**
     * Direct role/name query, link href comparison, ancestor path climbing, text context.
     */
    public static List<ResolutionStrategy> defaults() {
        return normalize(List.of(
                new DirectRoleNameStrategy(),
                new LinkHrefStrategy(),
                new AncestorPathStrategy(),
                new TextContextStrategy()
        ));
    }

    /**
     * Normalizes a strategy list:
     * <ul>
     *   <li>removes null entries</li>
     *   <li>orders by {@link ResolutionStrategy#order()} then {@link ResolutionStrategy#id()}</li>
     *   <li>deduplicates by {@link ResolutionStrategy#id()} (first one wins)</li>
     * </ul>
     *
     * @param strategies input list (may be null)
     * @return normalized immutable list
     */
    public static List<ResolutionStrategy> normalize(List<? extends ResolutionStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            return List.of();
        }

        List<ResolutionStrategy> cleaned = new ArrayList<>();
        for (ResolutionStrategy s : strategies) {
            if (s != null) {
                cleaned.add(s);
            }
        }
        cleaned.sort(Comparator.comparingInt(ResolutionStrategy::order).thenComparing(ResolutionStrategy::id));

        Map<String, ResolutionStrategy> byId = new LinkedHashMap<>();
        for (ResolutionStrategy s : cleaned) {
            byId.putIfAbsent(s.id(), s);
        }
        return List.copyOf(byId.values());
    }
}
