package io.hearthwarrio.actionspace.core.action;

import io.hearthwarrio.actionspace.core.EligibilityViolationException;

import java.util.List;
import java.util.Objects;

/**
 * One addressable thing the user can do on the page.
 * <p>
 * The role follows from the ID prefix. Input actions carry exactly one parameter; anything else is rejected.
 */
public final class Action {

    public static final String INTERACTION_CATEGORY = "Interaction action";

    private final String id;
    private final String description;
    private final String category;
    private final List<ActionParameter> parameters;
    private final ActionStatus status;

    public Action(String id, String description, String category, List<ActionParameter> parameters) {
        this(id, description, category, parameters, ActionStatus.VALID);
    }

    public Action(
            String id,
            String description,
            String category,
            List<ActionParameter> parameters,
            ActionStatus status
    ) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.description = description == null ? "" : description;
        this.category = category == null ? "" : category;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.status = status == null ? ActionStatus.VALID : status;

        if (getRole() == ActionRole.INPUT && this.parameters.size() != 1) {
            throw new EligibilityViolationException(
                    "Input action " + id + " must have exactly one parameter, got " + this.parameters.size());
        }
    }

    public String getId() {
        return id;
    }

    public ActionRole getRole() {
        return ActionRole.fromId(id);
    }

    public String getDescription() {
        return description;
    }

    public String getCategory() {
        return category;
    }

    public List<ActionParameter> getParameters() {
        return parameters;
    }

    public ActionStatus getStatus() {
        return status;
    }

    public Action withStatus(ActionStatus status) {
        return new Action(id, description, category, parameters, status);
    }

    /**
     * Markdown list item: {@code * ID: description (param: type)}.
     */
    public String markdownLine() {
        StringBuilder sb = new StringBuilder("* ").append(id).append(": ").append(description);
        for (ActionParameter p : parameters) {
            sb.append(" (").append(p.description()).append(')');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Action{" +
                "id='" + id + '\'' +
                ", role=" + getRole() +
                ", description='" + description + '\'' +
                ", category='" + category + '\'' +
                ", parameters=" + parameters +
                ", status=" + status +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Action)) {
            return false;
        }
        Action that = (Action) o;
        return id.equals(that.id)
                && description.equals(that.description)
                && category.equals(that.category)
                && parameters.equals(that.parameters)
                && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, description, category, parameters, status);
    }
}
