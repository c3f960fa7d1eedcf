package io.hearthwarrio.actionspace.core;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Addressing rules: which nodes may carry an ID and what a well-formed ID looks like.
 */
public final class IdScheme {

    private static final Pattern ID_PATTERN = Pattern.compile("^([A-Z])([1-9][0-9]*)$");

    private IdScheme() {
    }

    /**
     * A node is eligible when its role has an ID prefix and it either has a non-blank name or is an image.
     */
    public static boolean isEligible(Role role, String name) {
        if (role.idPrefix().isEmpty()) {
            return false;
        }
        return (name != null && !name.isBlank()) || role.in(NodeCategory.IMAGE);
    }

    public static boolean isWellFormed(String id) {
        return id != null && ID_PATTERN.matcher(id).matches();
    }

    /**
     * @return prefix letter of a well-formed ID, or empty
     */
    public static Optional<String> prefixOf(String id) {
        if (!isWellFormed(id)) {
            return Optional.empty();
        }
        return Optional.of(id.substring(0, 1));
    }

    /**
     * Rejects a stamped ID that the assignment pass could not have produced for this node.
     *
     * @throws EligibilityViolationException on any violation
     */
    public static void checkStamped(Role role, String name, String id) {
        if (id == null) {
            return;
        }
        if (!isWellFormed(id)) {
            throw new EligibilityViolationException("Malformed ID '" + id + "' on node role '" + role + "'");
        }
        if (!isEligible(role, name)) {
            throw new EligibilityViolationException(
                    "Node role '" + role + "', name '" + name + "' is not eligible for an ID but carries '" + id + "'");
        }
        String expected = role.idPrefix().orElse("");
        if (!id.startsWith(expected)) {
            throw new EligibilityViolationException(
                    "ID '" + id + "' does not use prefix '" + expected + "' of role '" + role + "'");
        }
    }
}
