package io.hearthwarrio.actionspace.core.pipeline;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.DomNode;
import io.hearthwarrio.actionspace.core.InvalidActionException;
import io.hearthwarrio.actionspace.core.TreeVisualizer;
import io.hearthwarrio.actionspace.core.ids.TreeConsistencyChecker;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one observation: processed, simple and raw trees sharing one ID space.
 */
public final class ProcessedTree {

    private final AccessibilityNode processed;
    private final AccessibilityNode simple;
    private final AccessibilityNode raw;

    private ProcessedTree(AccessibilityNode processed, AccessibilityNode simple, AccessibilityNode raw) {
        this.processed = Objects.requireNonNull(processed, "processed must not be null");
        this.simple = Objects.requireNonNull(simple, "simple must not be null");
        this.raw = Objects.requireNonNull(raw, "raw must not be null");
    }

    /**
     * Builds the result after checking that simple and raw trees agree on their interaction IDs.
     *
     * @throws io.hearthwarrio.actionspace.core.StructuralInconsistencyException when they do not
     */
    public static ProcessedTree of(AccessibilityNode processed, AccessibilityNode simple, AccessibilityNode raw) {
        TreeConsistencyChecker.check(simple, raw);
        return new ProcessedTree(processed, simple, raw);
    }

    static ProcessedTree softChecked(AccessibilityNode processed, AccessibilityNode simple, AccessibilityNode raw) {
        TreeConsistencyChecker.check(simple, raw, true);
        return new ProcessedTree(processed, simple, raw);
    }

    public AccessibilityNode tree(TreeKind kind) {
        switch (kind) {
            case PROCESSED:
                return processed;
            case SIMPLE:
                return simple;
            case RAW:
                return raw;
            default:
                throw new IllegalArgumentException("Unsupported tree kind: " + kind);
        }
    }

    public AccessibilityNode processed() {
        return processed;
    }

    public String visualize(TreeKind kind) {
        return TreeVisualizer.visualize(tree(kind));
    }

    public List<AccessibilityNode> interactionNodes(TreeKind kind) {
        return tree(kind).interactionNodes(true);
    }

    public Optional<List<AccessibilityNode>> findPath(String id, TreeKind kind) {
        return tree(kind).findPath(id);
    }

    /**
     * @throws InvalidActionException when no node of the chosen tree carries the ID
     */
    public List<AccessibilityNode> requirePath(String id, TreeKind kind) {
        return findPath(id, kind).orElseThrow(() ->
                new InvalidActionException(id, "not present in the " + kind.name().toLowerCase() + " tree"));
    }

    public DomNode toDomNode(TreeKind kind) {
        return DomNode.fromAccessibilityNode(tree(kind));
    }

    @Override
    public String toString() {
        return "ProcessedTree{" +
                "processedIds=" + processed.flatten(n -> n.getId() != null).size() +
                ", simpleIds=" + simple.flatten(n -> n.getId() != null).size() +
                ", rawIds=" + raw.flatten(n -> n.getId() != null).size() +
                '}';
    }
}
