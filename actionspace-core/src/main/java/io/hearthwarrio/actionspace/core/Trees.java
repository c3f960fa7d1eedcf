package io.hearthwarrio.actionspace.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Generic, side-effect free algorithms over {@link TreeNode} trees.
 * <p>
 * Every rewriting method returns a new tree that shares the subtrees it did not touch.
 */
public final class Trees {

    private Trees() {
    }

    /**
     * A node reached from the root, with the path that leads to it.
     *
     * @param <N> node type
     */
    public static final class Match<N extends TreeNode<N>> {
        private final List<N> path;
        private final List<Integer> indexPath;

        Match(List<N> path, List<Integer> indexPath) {
            this.path = List.copyOf(path);
            this.indexPath = List.copyOf(indexPath);
        }

        public N getNode() {
            return path.get(path.size() - 1);
        }

        /**
         * @return nodes from the root down to (and including) the matched node
         */
        public List<N> getPath() {
            return path;
        }

        /**
         * @return ancestors of the matched node, closest first
         */
        public List<N> getAncestorsClosestFirst() {
            List<N> ancestors = new ArrayList<>(path.subList(0, path.size() - 1));
            Collections.reverse(ancestors);
            return ancestors;
        }

        /**
         * @return child indices leading from the root to the matched node
         */
        public List<Integer> getIndexPath() {
            return indexPath;
        }
    }

    /**
     * Pre-order search by ID.
     */
    public static <N extends TreeNode<N>> Optional<N> find(N root, String id) {
        if (id == null) {
            return Optional.empty();
        }
        return findFirst(root, n -> id.equals(n.getId())).map(Match::getNode);
    }

    /**
     * Pre-order search returning the first matching node together with its path.
     */
    public static <N extends TreeNode<N>> Optional<Match<N>> findFirst(N root, Predicate<? super N> predicate) {
        Objects.requireNonNull(root, "root must not be null");
        List<N> path = new ArrayList<>();
        List<Integer> indexPath = new ArrayList<>();
        return Optional.ofNullable(findFirst(root, predicate, path, indexPath));
    }

    private static <N extends TreeNode<N>> Match<N> findFirst(
            N node,
            Predicate<? super N> predicate,
            List<N> path,
            List<Integer> indexPath
    ) {
        path.add(node);
        if (predicate.test(node)) {
            Match<N> match = new Match<>(path, indexPath);
            path.remove(path.size() - 1);
            return match;
        }
        List<N> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            indexPath.add(i);
            Match<N> found = findFirst(children.get(i), predicate, path, indexPath);
            indexPath.remove(indexPath.size() - 1);
            if (found != null) {
                path.remove(path.size() - 1);
                return found;
            }
        }
        path.remove(path.size() - 1);
        return null;
    }

    /**
     * Collects every topmost match in pre-order: once a node matches, its descendants are not searched.
     */
    public static <N extends TreeNode<N>> List<Match<N>> findAllTopmost(N root, Predicate<? super N> predicate) {
        Objects.requireNonNull(root, "root must not be null");
        List<Match<N>> out = new ArrayList<>();
        collectTopmost(root, predicate, new ArrayList<>(), new ArrayList<>(), out);
        return out;
    }

    private static <N extends TreeNode<N>> void collectTopmost(
            N node,
            Predicate<? super N> predicate,
            List<N> path,
            List<Integer> indexPath,
            List<Match<N>> out
    ) {
        path.add(node);
        if (predicate.test(node)) {
            out.add(new Match<>(path, indexPath));
        } else {
            List<N> children = node.getChildren();
            for (int i = 0; i < children.size(); i++) {
                indexPath.add(i);
                collectTopmost(children.get(i), predicate, path, indexPath, out);
                indexPath.remove(indexPath.size() - 1);
            }
        }
        path.remove(path.size() - 1);
    }

    /**
     * Pre-order list of nodes satisfying the predicate, the root included.
     */
    public static <N extends TreeNode<N>> List<N> flatten(N root, Predicate<? super N> predicate) {
        List<N> out = new ArrayList<>();
        Deque<N> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            N node = stack.pop();
            if (predicate.test(node)) {
                out.add(node);
            }
            List<N> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return out;
    }

    /**
     * Keeps the nodes for which the predicate holds somewhere in their subtree.
     * Ancestors of a kept node stay in place even when they fail the predicate themselves.
     *
     * @return filtered tree, or empty when no node satisfies the predicate
     */
    public static <N extends TreeNode<N>> Optional<N> subtreeFilter(N root, Predicate<? super N> predicate) {
        List<N> children = root.getChildren();
        List<N> kept = new ArrayList<>(children.size());
        boolean changed = false;
        for (N child : children) {
            Optional<N> filtered = subtreeFilter(child, predicate);
            if (filtered.isPresent()) {
                kept.add(filtered.get());
                changed |= filtered.get() != child;
            } else {
                changed = true;
            }
        }
        if (kept.isEmpty() && !predicate.test(root)) {
            return Optional.empty();
        }
        return Optional.of(changed ? root.withChildren(kept) : root);
    }

    /**
     * Removes every node matching the predicate together with its subtree.
     *
     * @return remaining tree, or empty when the root itself is removed
     */
    public static <N extends TreeNode<N>> Optional<N> removeMatching(N root, Predicate<? super N> predicate) {
        if (predicate.test(root)) {
            return Optional.empty();
        }
        List<N> children = root.getChildren();
        List<N> kept = new ArrayList<>(children.size());
        boolean changed = false;
        for (N child : children) {
            Optional<N> rest = removeMatching(child, predicate);
            if (rest.isPresent()) {
                kept.add(rest.get());
                changed |= rest.get() != child;
            } else {
                changed = true;
            }
        }
        return Optional.of(changed ? root.withChildren(kept) : root);
    }

    /**
     * Drops every node whose role value is listed, with its subtree.
     *
     * @throws EmptyTreeException when the root itself is excluded
     */
    public static <N extends TreeNode<N>> N subtreeWithout(N root, Set<String> excludedRoles) {
        return removeMatching(root, n -> excludedRoles.contains(n.getRole().getValue()))
                .orElseThrow(() -> new EmptyTreeException(
                        "removing roles " + excludedRoles + " from root '" + root.getRole() + "'"));
    }

    /**
     * Replaces the node addressed by child indices and rebuilds its ancestors.
     */
    public static <N extends TreeNode<N>> N updateAt(N root, List<Integer> indexPath, UnaryOperator<N> update) {
        return updateAt(root, indexPath, 0, update);
    }

    private static <N extends TreeNode<N>> N updateAt(N node, List<Integer> indexPath, int depth, UnaryOperator<N> update) {
        if (depth == indexPath.size()) {
            return update.apply(node);
        }
        int index = indexPath.get(depth);
        List<N> children = new ArrayList<>(node.getChildren());
        children.set(index, updateAt(children.get(index), indexPath, depth + 1, update));
        return node.withChildren(children);
    }

    /**
     * Rebuilds the tree bottom-up without recursion.
     * <p>
     * {@code rewrite} receives each node (with already rebuilt children) and its pre-order index.
     * Nodes whose children and rewrite are unchanged are reused as-is.
     */
    public static <N extends TreeNode<N>> N rebuild(N root, BiFunction<N, Integer, N> rewrite) {
        Deque<Frame<N>> stack = new ArrayDeque<>();
        int preOrder = 0;
        stack.push(new Frame<>(root, preOrder++));
        N result = null;
        while (!stack.isEmpty()) {
            Frame<N> frame = stack.peek();
            List<N> children = frame.node.getChildren();
            if (frame.next < children.size()) {
                stack.push(new Frame<>(children.get(frame.next++), preOrder++));
                continue;
            }
            stack.pop();
            N withChildren = frame.changed ? frame.node.withChildren(frame.rebuilt) : frame.node;
            N rewritten = rewrite.apply(withChildren, frame.preOrderIndex);
            Frame<N> parent = stack.peek();
            if (parent == null) {
                result = rewritten;
            } else {
                parent.rebuilt.add(rewritten);
                parent.changed |= rewritten != frame.node;
            }
        }
        return result;
    }

    private static final class Frame<N> {
        final N node;
        final int preOrderIndex;
        final List<N> rebuilt = new ArrayList<>();
        int next;
        boolean changed;

        Frame(N node, int preOrderIndex) {
            this.node = node;
            this.preOrderIndex = preOrderIndex;
        }
    }

    /**
     * Pre-order indices (as passed to {@link #rebuild}) of the nodes satisfying the predicate.
     */
    public static <N extends TreeNode<N>> List<Integer> preOrderIndices(N root, Predicate<? super N> predicate) {
        List<Integer> out = new ArrayList<>();
        Deque<N> stack = new ArrayDeque<>();
        stack.push(root);
        int index = 0;
        while (!stack.isEmpty()) {
            N node = stack.pop();
            if (predicate.test(node)) {
                out.add(index);
            }
            index++;
            List<N> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return out;
    }

    /**
     * Number of nodes in the tree.
     */
    public static <N extends TreeNode<N>> int size(N root) {
        return flatten(root, n -> true).size();
    }
}
