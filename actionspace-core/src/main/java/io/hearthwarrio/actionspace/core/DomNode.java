package io.hearthwarrio.actionspace.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Attribute-rich node used once an element has to be acted on.
 * <p>
 * {@link #getSubtreeIds()} is computed on construction and always equals this node's ID (when present)
 * plus the subtree IDs of its children. A stamped ID is validated against {@link IdScheme} on construction.
 */
public final class DomNode implements TreeNode<DomNode> {

    private final String id;
    private final Role role;
    private final String text;
    private final List<DomNode> children;
    private final NodeFlags flags;
    private final DomAttributes attributes;
    private final ComputedAttributes computedAttributes;
    private final Set<String> subtreeIds;

    public DomNode(
            String id,
            Role role,
            String text,
            List<DomNode> children,
            NodeFlags flags,
            DomAttributes attributes,
            ComputedAttributes computedAttributes
    ) {
        this.role = Objects.requireNonNull(role, "role must not be null");
        this.text = text == null ? "" : text;
        IdScheme.checkStamped(this.role, this.text, id);
        this.id = id;
        this.children = children == null ? List.of() : List.copyOf(children);
        this.flags = flags == null ? NodeFlags.NONE : flags;
        this.attributes = attributes == null ? DomAttributes.EMPTY : attributes;
        this.computedAttributes = computedAttributes == null ? ComputedAttributes.EMPTY : computedAttributes;
        this.subtreeIds = computeSubtreeIds(id, this.children);
    }

    private static Set<String> computeSubtreeIds(String id, List<DomNode> children) {
        Set<String> ids = new LinkedHashSet<>();
        if (id != null) {
            ids.add(id);
        }
        for (DomNode child : children) {
            ids.addAll(child.subtreeIds);
        }
        return Collections.unmodifiableSet(ids);
    }

    /**
     * Converts an accessibility tree. DOM attributes stay empty until the node is located on the page;
     * the frame and shadow context captured with the tree is carried over.
     */
    public static DomNode fromAccessibilityNode(AccessibilityNode node) {
        List<DomNode> children = new ArrayList<>(node.getChildren().size());
        for (AccessibilityNode child : node.getChildren()) {
            children.add(fromAccessibilityNode(child));
        }
        return new DomNode(
                node.getId(),
                node.getRole(),
                node.getName(),
                children,
                node.getFlags(),
                DomAttributes.EMPTY,
                node.getContext()
        );
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public Role getRole() {
        return role;
    }

    /**
     * Same as {@link #getText()}; the accessible name of the node.
     */
    @Override
    public String getName() {
        return text;
    }

    public String getText() {
        return text;
    }

    @Override
    public List<DomNode> getChildren() {
        return children;
    }

    public NodeFlags getFlags() {
        return flags;
    }

    public DomAttributes getAttributes() {
        return attributes;
    }

    public ComputedAttributes getComputedAttributes() {
        return computedAttributes;
    }

    public Set<String> getSubtreeIds() {
        return subtreeIds;
    }

    @Override
    public DomNode withChildren(List<DomNode> children) {
        return new DomNode(id, role, text, children, flags, attributes, computedAttributes);
    }

    public DomNode withAttributes(DomAttributes attributes) {
        return new DomNode(id, role, text, children, flags, attributes, computedAttributes);
    }

    public DomNode withComputedAttributes(ComputedAttributes computedAttributes) {
        return new DomNode(id, role, text, children, flags, attributes, computedAttributes);
    }

    public boolean isInteraction() {
        return id != null && role.in(NodeCategory.INTERACTION);
    }

    public boolean isImage() {
        return role.in(NodeCategory.IMAGE);
    }

    // ----------- tree algorithms -----------

    public Optional<DomNode> find(String id) {
        return Trees.find(this, id);
    }

    public List<DomNode> flatten(Predicate<? super DomNode> predicate) {
        return Trees.flatten(this, predicate);
    }

    public Optional<DomNode> subtreeFilter(Predicate<? super DomNode> predicate) {
        return Trees.subtreeFilter(this, predicate);
    }

    public DomNode subtreeWithout(Set<String> excludedRoles) {
        return Trees.subtreeWithout(this, excludedRoles);
    }

    /**
     * Root-to-node path of the node carrying the given ID.
     */
    public Optional<Trees.Match<DomNode>> findPath(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Trees.findFirst(this, n -> id.equals(n.getId()));
    }

    /**
     * ID-bearing interaction nodes in pre-order, detached from their children.
     */
    public List<DomNode> interactionNodes() {
        List<DomNode> out = new ArrayList<>();
        for (DomNode node : flatten(DomNode::isInteraction)) {
            out.add(node.children.isEmpty() ? node : node.withChildren(List.of()));
        }
        return out;
    }

    public List<DomNode> imageNodes() {
        return flatten(DomNode::isImage);
    }

    @Override
    public String toString() {
        return "DomNode{" +
                "id='" + id + '\'' +
                ", role='" + role + '\'' +
                ", text='" + text + '\'' +
                ", children=" + children.size() +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DomNode)) return false;
        DomNode that = (DomNode) o;
        return Objects.equals(id, that.id) &&
                role.equals(that.role) &&
                text.equals(that.text) &&
                flags.equals(that.flags) &&
                attributes.equals(that.attributes) &&
                computedAttributes.equals(that.computedAttributes) &&
                children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, role, text, flags, attributes, computedAttributes, children);
    }
}
