package io.hearthwarrio.actionspace.core.action;

import io.hearthwarrio.actionspace.core.InvalidActionException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, validated list of the actions available on a page.
 */
public final class ActionSpace {

    private final String description;
    private final List<Action> actions;

    /**
     * @throws InvalidActionException when an action has no usable role, no description, or a duplicate ID
     */
    public ActionSpace(String description, List<Action> actions) {
        this.description = description == null ? "" : description;
        this.actions = actions == null ? List.of() : List.copyOf(actions);

        Set<String> seen = new HashSet<>();
        for (Action action : this.actions) {
            if (action.getRole() == ActionRole.OTHER) {
                throw new InvalidActionException(action.getId(),
                        "listed actions must use an L, B, I or O prefix, got '" + action.getId().charAt(0) + "'");
            }
            if (action.getDescription().isEmpty()) {
                throw new InvalidActionException(action.getId(), "listed actions must have a description");
            }
            if (!seen.add(action.getId())) {
                throw new InvalidActionException(action.getId(), "listed twice");
            }
        }
    }

    public String getDescription() {
        return description;
    }

    public List<Action> actions() {
        return actions;
    }

    public List<Action> actions(ActionStatus status) {
        List<Action> out = new ArrayList<>();
        for (Action action : actions) {
            if (action.getStatus() == status) {
                out.add(action);
            }
        }
        return out;
    }

    public List<Action> actions(ActionStatus status, ActionRole role) {
        List<Action> out = new ArrayList<>();
        for (Action action : actions(status)) {
            if (action.getRole() == role) {
                out.add(action);
            }
        }
        return out;
    }

    public Optional<Action> find(String id) {
        for (Action action : actions) {
            if (action.getId().equals(id)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }

    public Set<String> ids() {
        Set<String> ids = new HashSet<>();
        for (Action action : actions) {
            ids.add(action.getId());
        }
        return ids;
    }

    /**
     * Copy in which the given action has the given status.
     *
     * @throws InvalidActionException when the ID is not listed
     */
    public ActionSpace withStatus(String id, ActionStatus status) {
        if (find(id).isEmpty()) {
            throw new InvalidActionException(id, "not listed in the action space");
        }
        List<Action> updated = new ArrayList<>(actions.size());
        for (Action action : actions) {
            updated.add(action.getId().equals(id) ? action.withStatus(status) : action);
        }
        return new ActionSpace(description, updated);
    }

    /**
     * Valid actions as markdown.
     */
    public String markdown() {
        return markdown(ActionStatus.VALID);
    }

    /**
     * One {@code # category} heading per category in order of first appearance, a blank line between groups,
     * and the actions of each category sorted by ID.
     */
    public String markdown(ActionStatus status) {
        Map<String, List<Action>> byCategory = new LinkedHashMap<>();
        for (Action action : actions(status)) {
            byCategory.computeIfAbsent(action.getCategory(), c -> new ArrayList<>()).add(action);
        }

        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, List<Action>> e : byCategory.entrySet()) {
            lines.add(lines.isEmpty() ? "# " + e.getKey() : "\n# " + e.getKey());
            List<Action> sorted = new ArrayList<>(e.getValue());
            sorted.sort(Comparator.comparing(Action::getId));
            for (Action action : sorted) {
                lines.add(action.markdownLine());
            }
        }
        return String.join("\n", lines);
    }

    @Override
    public String toString() {
        return "ActionSpace{" +
                "description='" + description + '\'' +
                ", actions=" + actions +
                '}';
    }
}
