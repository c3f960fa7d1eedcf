package io.hearthwarrio.actionspace.core.resolution;

import io.hearthwarrio.actionspace.core.DomNode;

import java.util.List;
import java.util.Objects;

/**
 * Query for elements by accessible role and name, optionally constrained by selected/checked state.
 */
public final class RoleQuery {

    private final String role;
    private final String name;
    private final boolean exact;
    private final Boolean selected;
    private final Boolean checked;

    public RoleQuery(String role, String name, boolean exact, Boolean selected, Boolean checked) {
        this.role = Objects.requireNonNull(role, "role must not be null");
        this.name = name == null ? "" : name;
        this.exact = exact;
        this.selected = selected;
        this.checked = checked;
    }

    /**
     * Query for the node's role and name. Selected/checked constraints are added only when the node has them set.
     */
    public static RoleQuery of(DomNode node, boolean exact) {
        Boolean selected = node.getFlags().getSelected().filter(Boolean::booleanValue).orElse(null);
        Boolean checked = node.getFlags().getChecked().filter(Boolean::booleanValue).orElse(null);
        return new RoleQuery(node.getRole().getValue(), node.getName(), exact, selected, checked);
    }

    public static RoleQuery exact(String role, String name) {
        return new RoleQuery(role, name, true, null, null);
    }

    public String getRole() {
        return role;
    }

    public String getName() {
        return name;
    }

    /**
     * Exact queries compare the whole name; others match a case-insensitive substring.
     */
    public boolean isExact() {
        return exact;
    }

    public Boolean getSelected() {
        return selected;
    }

    public Boolean getChecked() {
        return checked;
    }

    /**
     * Whether an element with the given role, accessible name and state satisfies this query.
     */
    public boolean matches(String elementRole, String elementName, boolean elementSelected, boolean elementChecked) {
        if (!role.equalsIgnoreCase(elementRole == null ? "" : elementRole)) {
            return false;
        }
        String candidate = elementName == null ? "" : elementName.trim();
        if (exact) {
            if (!candidate.equals(name.trim())) {
                return false;
            }
        } else if (!candidate.toLowerCase().contains(name.trim().toLowerCase())) {
            return false;
        }
        if (selected != null && selected != elementSelected) {
            return false;
        }
        return checked == null || checked == elementChecked;
    }

    /**
     * @return selector text in the {@code role=button[name="OK"]} notation
     */
    public String toSelector() {
        StringBuilder sb = new StringBuilder("role=").append(role);
        sb.append("[name=\"").append(name.replace("\"", "\\\"")).append('"');
        if (!exact) {
            sb.append(" i");
        }
        sb.append(']');
        if (selected != null) {
            sb.append("[selected=").append(selected).append(']');
        }
        if (checked != null) {
            sb.append("[checked=").append(checked).append(']');
        }
        return sb.toString();
    }

    public static String toSelector(List<RoleQuery> path) {
        StringBuilder sb = new StringBuilder();
        for (RoleQuery q : path) {
            if (sb.length() > 0) {
                sb.append(" >> ");
            }
            sb.append(q.toSelector());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toSelector();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RoleQuery)) {
            return false;
        }
        RoleQuery that = (RoleQuery) o;
        return exact == that.exact
                && role.equals(that.role)
                && name.equals(that.name)
                && Objects.equals(selected, that.selected)
                && Objects.equals(checked, that.checked);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, name, exact, selected, checked);
    }
}
