package io.hearthwarrio.actionspace.examples;

import io.hearthwarrio.actionspace.core.action.Action;
import io.hearthwarrio.actionspace.core.action.ActionSpace;

import java.util.ArrayList;
import java.util.List;

final class Actions {

    private Actions() {
    }

    /**
     * IDs of the actions with the given description, in document order.
     */
    static List<String> idsOf(ActionSpace space, String description) {
        List<String> ids = new ArrayList<>();
        for (Action action : space.actions()) {
            if (action.getDescription().equals(description)) {
                ids.add(action.getId());
            }
        }
        return ids;
    }

    static String idOf(ActionSpace space, String description) {
        List<String> ids = idsOf(space, description);
        if (ids.size() != 1) {
            throw new AssertionError("Expected one action " + description + " but got " + ids + " in\n" + space.markdown());
        }
        return ids.get(0);
    }
}
