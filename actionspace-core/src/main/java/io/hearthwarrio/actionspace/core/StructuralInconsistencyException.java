package io.hearthwarrio.actionspace.core;

import java.util.List;

/**
 * Two trees that should describe the same page disagree on an addressable node.
 * <p>
 * Fatal for the current observation: the caller is expected to take a fresh snapshot.
 */
public class StructuralInconsistencyException extends ActionSpaceException {

    private final String role;
    private final String name;
    private final List<String> path;

    public StructuralInconsistencyException(String message) {
        this(message, "", "", List.of());
    }

    public StructuralInconsistencyException(String message, String role, String name, List<String> path) {
        super(message);
        this.role = role == null ? "" : role;
        this.name = name == null ? "" : name;
        this.path = path == null ? List.of() : List.copyOf(path);
    }

    public String getRole() {
        return role;
    }

    public String getName() {
        return name;
    }

    /**
     * @return {@code role 'name'} labels from the root down to the offending node (may be empty)
     */
    public List<String> getPath() {
        return path;
    }
}
