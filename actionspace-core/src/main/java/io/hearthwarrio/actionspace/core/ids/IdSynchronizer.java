package io.hearthwarrio.actionspace.core.ids;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.NodeRole;
import io.hearthwarrio.actionspace.core.StructuralInconsistencyException;
import io.hearthwarrio.actionspace.core.Trees;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Copies IDs from one tree onto the equivalent nodes of another tree describing the same page.
 * <p>
 * Equivalence is role plus name. Candidates are the topmost matches of the target in pre-order;
 * the first one already carrying the ID, or else the first unlabeled one, receives it.
 */
public final class IdSynchronizer {

    private IdSynchronizer() {
    }

    private static final class Reference {
        final AccessibilityNode node;
        final List<String> path;

        Reference(AccessibilityNode node, List<String> path) {
            this.node = node;
            this.path = path;
        }
    }

    /**
     * @param target tree to label
     * @param source tree holding the reference IDs
     * @return labeled copy of {@code target}
     * @throws StructuralInconsistencyException when an ID-bearing source node has no usable match in the target
     */
    public static AccessibilityNode syncIds(AccessibilityNode target, AccessibilityNode source) {
        return syncIds(target, source, node -> true);
    }

    /**
     * Same as {@link #syncIds(AccessibilityNode, AccessibilityNode)}, restricted to the source nodes
     * accepted by {@code which}.
     */
    public static AccessibilityNode syncIds(
            AccessibilityNode target,
            AccessibilityNode source,
            Predicate<? super AccessibilityNode> which
    ) {
        List<Reference> references = new ArrayList<>();
        collectReferences(source, new ArrayList<>(), references);
        references.removeIf(ref -> !which.test(ref.node));

        AccessibilityNode result = target;
        for (Reference ref : references) {
            result = stamp(result, ref);
        }
        return result;
    }

    private static AccessibilityNode stamp(AccessibilityNode target, Reference ref) {
        AccessibilityNode node = ref.node;
        String refId = node.getId();
        List<Trees.Match<AccessibilityNode>> matches = target.findAllPathsByRoleAndName(node.getRole(), node.getName());
        if (matches.isEmpty()) {
            throw new StructuralInconsistencyException(
                    "No match for node role '" + node.getRole() + "', name '" + node.getName() + "' (id " + refId +
                            ", path " + String.join(" > ", ref.path) + ") in target tree",
                    node.getRole().getValue(),
                    node.getName(),
                    ref.path
            );
        }

        for (Trees.Match<AccessibilityNode> match : matches) {
            String existing = match.getNode().getId();
            if (refId.equals(existing)) {
                return target;
            }
            if (existing == null) {
                return Trees.updateAt(target, match.getIndexPath(), n -> n.withId(refId));
            }
        }

        List<String> taken = new ArrayList<>();
        for (Trees.Match<AccessibilityNode> match : matches) {
            taken.add(match.getNode().getId());
        }
        throw new StructuralInconsistencyException(
                "All " + matches.size() + " matches for node role '" + node.getRole() + "', name '" + node.getName() +
                        "' already carry other IDs " + taken + "; cannot place " + refId,
                node.getRole().getValue(),
                node.getName(),
                ref.path
        );
    }

    private static void collectReferences(AccessibilityNode node, List<String> path, List<Reference> out) {
        path.add(node.getRole() + " '" + node.getName() + "'");
        if (node.getId() != null) {
            out.add(new Reference(node, List.copyOf(path)));
        }
        for (AccessibilityNode child : node.getChildren()) {
            collectReferences(child, path, out);
        }
        path.remove(path.size() - 1);
    }

    /**
     * Copies image IDs in pre-order: the n-th source image with a given role and name labels the n-th
     * target image with the same role and name. Images absorbed by folding simply have no counterpart,
     * extra images on either side are left untouched.
     */
    public static AccessibilityNode syncImageIds(AccessibilityNode target, AccessibilityNode source) {
        Map<String, Deque<String>> idsByKey = new HashMap<>();
        for (AccessibilityNode image : source.flatten(IdSynchronizer::isAddressableImage)) {
            if (image.getId() != null) {
                idsByKey.computeIfAbsent(imageKey(image), k -> new ArrayDeque<>()).add(image.getId());
            }
        }
        if (idsByKey.isEmpty()) {
            return target;
        }

        List<AccessibilityNode> targetImages = target.flatten(IdSynchronizer::isAddressableImage);
        List<Integer> targetIndices = Trees.preOrderIndices(target, IdSynchronizer::isAddressableImage);
        Map<Integer, String> idByIndex = new HashMap<>();
        for (int i = 0; i < targetImages.size(); i++) {
            Deque<String> queue = idsByKey.get(imageKey(targetImages.get(i)));
            if (queue != null && !queue.isEmpty()) {
                idByIndex.put(targetIndices.get(i), queue.poll());
            }
        }
        if (idByIndex.isEmpty()) {
            return target;
        }
        return Trees.rebuild(target, (node, index) -> {
            String id = idByIndex.get(index);
            if (id == null || id.equals(node.getId())) {
                return node;
            }
            return node.withId(id);
        });
    }

    private static String imageKey(AccessibilityNode image) {
        return image.getRole().getValue() + " '" + image.getName() + "'";
    }

    private static boolean isAddressableImage(AccessibilityNode node) {
        return node.getRole().is(NodeRole.IMAGE) || node.getRole().is(NodeRole.IMG);
    }
}
