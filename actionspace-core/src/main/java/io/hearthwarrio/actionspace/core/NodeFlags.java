package io.hearthwarrio.actionspace.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Free-form state flags the browser reports next to role and name.
 * <p>
 * Boolean flags are tri-state: unset flags are absent, not false.
 */
public final class NodeFlags {

    public static final NodeFlags NONE = builder().build();

    private final Boolean modal;
    private final Boolean required;
    private final Boolean selected;
    private final Boolean checked;
    private final Boolean enabled;
    private final Boolean visible;
    private final Boolean focused;
    private final String description;
    private final String value;

    private NodeFlags(Builder b) {
        this.modal = b.modal;
        this.required = b.required;
        this.selected = b.selected;
        this.checked = b.checked;
        this.enabled = b.enabled;
        this.visible = b.visible;
        this.focused = b.focused;
        this.description = normalizeNull(b.description);
        this.value = normalizeNull(b.value);
    }

    private static String normalizeNull(String s) {
        return s == null ? "" : s;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .modal(modal)
                .required(required)
                .selected(selected)
                .checked(checked)
                .enabled(enabled)
                .visible(visible)
                .focused(focused)
                .description(description)
                .value(value);
    }

    public Optional<Boolean> getModal() {
        return Optional.ofNullable(modal);
    }

    public Optional<Boolean> getRequired() {
        return Optional.ofNullable(required);
    }

    public Optional<Boolean> getSelected() {
        return Optional.ofNullable(selected);
    }

    public Optional<Boolean> getChecked() {
        return Optional.ofNullable(checked);
    }

    public Optional<Boolean> getEnabled() {
        return Optional.ofNullable(enabled);
    }

    public Optional<Boolean> getVisible() {
        return Optional.ofNullable(visible);
    }

    public Optional<Boolean> getFocused() {
        return Optional.ofNullable(focused);
    }

    public String getDescription() {
        return description;
    }

    public String getValue() {
        return value;
    }

    /**
     * Flags that carry information, in declaration order.
     *
     * @return flag name to value, omitting unset flags and empty strings
     */
    public Map<String, Object> relevant() {
        Map<String, Object> out = new LinkedHashMap<>();
        putIfSet(out, "modal", modal);
        putIfSet(out, "required", required);
        putIfSet(out, "selected", selected);
        putIfSet(out, "checked", checked);
        putIfSet(out, "enabled", enabled);
        putIfSet(out, "visible", visible);
        putIfSet(out, "focused", focused);
        if (!description.isEmpty()) {
            out.put("description", description);
        }
        if (!value.isEmpty()) {
            out.put("value", value);
        }
        return out;
    }

    private static void putIfSet(Map<String, Object> out, String key, Boolean flag) {
        if (flag != null) {
            out.put(key, flag);
        }
    }

    @Override
    public String toString() {
        return "NodeFlags" + relevant();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeFlags)) return false;
        NodeFlags that = (NodeFlags) o;
        return Objects.equals(modal, that.modal) &&
                Objects.equals(required, that.required) &&
                Objects.equals(selected, that.selected) &&
                Objects.equals(checked, that.checked) &&
                Objects.equals(enabled, that.enabled) &&
                Objects.equals(visible, that.visible) &&
                Objects.equals(focused, that.focused) &&
                description.equals(that.description) &&
                value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(modal, required, selected, checked, enabled, visible, focused, description, value);
    }

    public static final class Builder {
        private Boolean modal;
        private Boolean required;
        private Boolean selected;
        private Boolean checked;
        private Boolean enabled;
        private Boolean visible;
        private Boolean focused;
        private String description;
        private String value;

        private Builder() {
        }

        public Builder modal(Boolean modal) {
            this.modal = modal;
            return this;
        }

        public Builder required(Boolean required) {
            this.required = required;
            return this;
        }

        public Builder selected(Boolean selected) {
            this.selected = selected;
            return this;
        }

        public Builder checked(Boolean checked) {
            this.checked = checked;
            return this;
        }

        public Builder enabled(Boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder visible(Boolean visible) {
            this.visible = visible;
            return this;
        }

        public Builder focused(Boolean focused) {
            this.focused = focused;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder value(String value) {
            this.value = value;
            return this;
        }

        public NodeFlags build() {
            return new NodeFlags(this);
        }
    }
}
