package io.hearthwarrio.actionspace.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Role of a tree node: either a recognised {@link NodeRole} or an unclassified browser role kept verbatim.
 * <p>
 * Recognised roles are stored under their canonical value, so {@code "Button"} and {@code "button"} compare equal.
 */
public final class Role {

    private final String value;
    private final NodeRole known;

    private Role(String value, NodeRole known) {
        this.value = value;
        this.known = known;
    }

    public static Role of(NodeRole role) {
        Objects.requireNonNull(role, "role must not be null");
        return new Role(role.getValue(), role);
    }

    /**
     * Parses a raw role value reported by the browser.
     *
     * @param value raw role (null is treated as empty)
     * @return recognised role, or an "other" role carrying the raw value
     */
    public static Role of(String value) {
        String v = value == null ? "" : value;
        Optional<NodeRole> known = NodeRole.fromValue(v);
        if (known.isPresent()) {
            return of(known.get());
        }
        return other(v);
    }

    public static Role other(String value) {
        return new Role(value == null ? "" : value, null);
    }

    public String getValue() {
        return value;
    }

    public boolean isKnown() {
        return known != null;
    }

    public Optional<NodeRole> known() {
        return Optional.ofNullable(known);
    }

    public boolean is(NodeRole role) {
        return known == role;
    }

    public boolean in(NodeCategory category) {
        return known != null && known.getCategory() == category;
    }

    /**
     * Whether this role is {@code group}, {@code generic} or {@code none}.
     */
    public boolean isPlaceholder() {
        return known != null && known.isPlaceholder();
    }

    public Optional<String> idPrefix() {
        return known == null ? Optional.empty() : known.getIdPrefix();
    }

    @Override
    public String toString() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Role)) return false;
        Role that = (Role) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
