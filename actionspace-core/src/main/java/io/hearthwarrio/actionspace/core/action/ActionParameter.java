package io.hearthwarrio.actionspace.core.action;

import java.util.List;
import java.util.Objects;

/**
 * Typed parameter of an action, e.g. the text typed into an input.
 */
public final class ActionParameter {

    public static final String DEFAULT_NAME = "param";
    public static final String TYPE_STRING = "string";

    private final String name;
    private final String type;
    private final String defaultValue;
    private final List<String> values;

    public ActionParameter(String name, String type) {
        this(name, type, null, List.of());
    }

    public ActionParameter(String name, String type, String defaultValue, List<String> values) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.defaultValue = defaultValue;
        this.values = values == null ? List.of() : List.copyOf(values);
    }

    /**
     * Free text parameter attached to input actions.
     */
    public static ActionParameter text() {
        return new ActionParameter(DEFAULT_NAME, TYPE_STRING);
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    /**
     * @return default value or {@code null}
     */
    public String getDefaultValue() {
        return defaultValue;
    }

    /**
     * Allowed values; empty when unrestricted.
     */
    public List<String> getValues() {
        return values;
    }

    /**
     * {@code name: type}, followed by {@code = [v1, v2]} when values are restricted.
     */
    public String description() {
        String base = name + ": " + type;
        if (!values.isEmpty()) {
            base += " = [" + String.join(", ", values) + "]";
        }
        return base;
    }

    @Override
    public String toString() {
        return description();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ActionParameter)) {
            return false;
        }
        ActionParameter that = (ActionParameter) o;
        return name.equals(that.name)
                && type.equals(that.type)
                && Objects.equals(defaultValue, that.defaultValue)
                && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, defaultValue, values);
    }
}
