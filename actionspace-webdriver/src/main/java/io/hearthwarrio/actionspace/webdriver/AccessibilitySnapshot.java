package io.hearthwarrio.actionspace.webdriver;

import io.hearthwarrio.actionspace.core.AccessibilityNode;

import java.util.Objects;

/**
 * The two trees taken from one accessibility capture: everything the browser exposes, and the same tree
 * without unnamed placeholder nodes.
 */
public final class AccessibilitySnapshot {

    private final AccessibilityNode raw;
    private final AccessibilityNode simple;

    public AccessibilitySnapshot(AccessibilityNode raw, AccessibilityNode simple) {
        this.raw = Objects.requireNonNull(raw, "raw must not be null");
        this.simple = Objects.requireNonNull(simple, "simple must not be null");
    }

    public AccessibilityNode getRaw() {
        return raw;
    }

    public AccessibilityNode getSimple() {
        return simple;
    }
}
