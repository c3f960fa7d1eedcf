package io.hearthwarrio.actionspace.core.action;

/**
 * Kind of interaction, derived from the first letter of an action ID.
 */
public enum ActionRole {
    LINK("link"),
    BUTTON("button"),
    INPUT("input"),
    OPTION("option"),
    OTHER("other");

    private final String value;

    ActionRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ActionRole fromId(String id) {
        if (id == null || id.isEmpty()) {
            return OTHER;
        }
        switch (id.charAt(0)) {
            case 'L':
                return LINK;
            case 'B':
                return BUTTON;
            case 'I':
                return INPUT;
            case 'O':
                return OPTION;
            default:
                return OTHER;
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
