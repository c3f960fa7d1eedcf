package io.hearthwarrio.actionspace.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Immutable accessibility tree node (raw, simple or processed representation).
 * <p>
 * {@link #getChildrenRolesCount()} is derived from the children at construction time and is therefore
 * always consistent with the subtree.
 */
public final class AccessibilityNode implements TreeNode<AccessibilityNode> {

    private final Role role;
    private final String name;
    private final List<AccessibilityNode> children;
    private final String id;
    private final String groupRole;
    private final List<String> groupRoles;
    private final String markdown;
    private final NodeFlags flags;
    private final ComputedAttributes context;
    private final Map<String, Integer> childrenRolesCount;

    private AccessibilityNode(Builder b) {
        this.role = Objects.requireNonNull(b.role, "role must not be null");
        this.name = b.name == null ? "" : b.name;
        this.children = List.copyOf(b.children);
        this.id = b.id;
        this.groupRole = b.groupRole;
        this.groupRoles = List.copyOf(b.groupRoles);
        this.markdown = b.markdown;
        this.flags = b.flags == null ? NodeFlags.NONE : b.flags;
        this.context = b.context == null ? ComputedAttributes.EMPTY : b.context;
        this.childrenRolesCount = countChildrenRoles(children);
    }

    private static Map<String, Integer> countChildrenRoles(List<AccessibilityNode> children) {
        if (children.isEmpty()) {
            return Map.of();
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (AccessibilityNode child : children) {
            counts.merge(child.role.getValue(), 1, Integer::sum);
            for (Map.Entry<String, Integer> e : child.childrenRolesCount.entrySet()) {
                counts.merge(e.getKey(), e.getValue(), Integer::sum);
            }
        }
        return Collections.unmodifiableMap(counts);
    }

    public static Builder builder(String role, String name) {
        return new Builder(Role.of(role), name);
    }

    public static Builder builder(Role role, String name) {
        return new Builder(role, name);
    }

    /**
     * Shorthand for a node with role, name and children only.
     */
    public static AccessibilityNode of(String role, String name, AccessibilityNode... children) {
        return builder(role, name).children(List.of(children)).build();
    }

    public Builder toBuilder() {
        return new Builder(role, name)
                .children(children)
                .id(id)
                .groupRole(groupRole)
                .groupRoles(groupRoles)
                .markdown(markdown)
                .flags(flags)
                .context(context);
    }

    @Override
    public Role getRole() {
        return role;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<AccessibilityNode> getChildren() {
        return children;
    }

    @Override
    public String getId() {
        return id;
    }

    /**
     * Role this node absorbed during folding, if any.
     */
    public String getGroupRole() {
        return groupRole;
    }

    /**
     * Earlier group roles, oldest first. Together with {@link #getGroupRole()} this is the fold history.
     */
    public List<String> getGroupRoles() {
        return groupRoles;
    }

    public String getMarkdown() {
        return markdown;
    }

    public NodeFlags getFlags() {
        return flags;
    }

    /**
     * Frames and shadow hosts the node sits behind; {@link ComputedAttributes#EMPTY} for top-document nodes.
     */
    public ComputedAttributes getContext() {
        return context;
    }

    /**
     * Role value to number of descendants carrying it (the node itself excluded).
     */
    public Map<String, Integer> getChildrenRolesCount() {
        return childrenRolesCount;
    }

    public Set<String> childrenRoles() {
        return childrenRolesCount.keySet();
    }

    /**
     * Role values of all descendants, optionally including this node's own role.
     */
    public Set<String> subtreeRoles(boolean includeSelf) {
        Set<String> roles = new LinkedHashSet<>();
        if (includeSelf) {
            roles.add(role.getValue());
        }
        roles.addAll(childrenRolesCount.keySet());
        return roles;
    }

    public boolean hasBlankName() {
        return name.isBlank();
    }

    @Override
    public AccessibilityNode withChildren(List<AccessibilityNode> children) {
        return toBuilder().children(children).build();
    }

    public AccessibilityNode withoutChildren() {
        return children.isEmpty() ? this : withChildren(List.of());
    }

    public AccessibilityNode withId(String id) {
        return toBuilder().id(id).build();
    }

    public AccessibilityNode withRole(Role role) {
        return toBuilder().role(role).build();
    }

    /**
     * Records a new group role, pushing the previous one (if any) onto the history.
     */
    public AccessibilityNode addGroupRole(String newGroupRole) {
        Builder b = toBuilder();
        if (groupRole != null) {
            List<String> history = new ArrayList<>(groupRoles);
            history.add(groupRole);
            b.groupRoles(history);
        }
        return b.groupRole(newGroupRole).build();
    }

    // ----------- tree algorithms -----------

    public Optional<AccessibilityNode> find(String id) {
        return Trees.find(this, id);
    }

    public List<AccessibilityNode> flatten(Predicate<? super AccessibilityNode> predicate) {
        return Trees.flatten(this, predicate);
    }

    public Optional<AccessibilityNode> subtreeFilter(Predicate<? super AccessibilityNode> predicate) {
        return Trees.subtreeFilter(this, predicate);
    }

    public AccessibilityNode subtreeWithout(Set<String> excludedRoles) {
        return Trees.subtreeWithout(this, excludedRoles);
    }

    /**
     * Root-to-node path of the node carrying the given ID.
     */
    public Optional<List<AccessibilityNode>> findPath(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Trees.findFirst(this, n -> id.equals(n.getId())).map(Trees.Match::getPath);
    }

    /**
     * Topmost nodes with the given role and name, in pre-order, each with its root-to-node path.
     */
    public List<Trees.Match<AccessibilityNode>> findAllPathsByRoleAndName(Role role, String name) {
        return Trees.findAllTopmost(this, n -> n.role.equals(role) && n.name.equals(name));
    }

    /**
     * Interaction nodes with a non-blank name, in pre-order.
     *
     * @param onlyWithId whether unlabeled nodes should be skipped
     */
    public List<AccessibilityNode> interactionNodes(boolean onlyWithId) {
        return flatten(n -> n.role.in(NodeCategory.INTERACTION)
                && !n.name.isBlank()
                && (!onlyWithId || n.id != null));
    }

    public List<AccessibilityNode> imageNodes() {
        return flatten(n -> n.role.in(NodeCategory.IMAGE));
    }

    @Override
    public String toString() {
        return "AccessibilityNode{" +
                "role='" + role + '\'' +
                ", name='" + name + '\'' +
                (id == null ? "" : ", id='" + id + '\'') +
                (groupRole == null ? "" : ", groupRole='" + groupRole + '\'') +
                ", children=" + children.size() +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AccessibilityNode)) return false;
        AccessibilityNode that = (AccessibilityNode) o;
        return role.equals(that.role) &&
                name.equals(that.name) &&
                Objects.equals(id, that.id) &&
                Objects.equals(groupRole, that.groupRole) &&
                groupRoles.equals(that.groupRoles) &&
                Objects.equals(markdown, that.markdown) &&
                flags.equals(that.flags) &&
                context.equals(that.context) &&
                children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, name, id, groupRole, groupRoles, markdown, flags, context, children);
    }

    public static final class Builder {
        private Role role;
        private String name;
        private List<AccessibilityNode> children = List.of();
        private String id;
        private String groupRole;
        private List<String> groupRoles = List.of();
        private String markdown;
        private NodeFlags flags = NodeFlags.NONE;
        private ComputedAttributes context = ComputedAttributes.EMPTY;

        private Builder(Role role, String name) {
            this.role = role;
            this.name = name;
        }

        public Builder role(Role role) {
            this.role = role;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder children(List<AccessibilityNode> children) {
            this.children = children == null ? List.of() : children;
            return this;
        }

        public Builder child(AccessibilityNode child) {
            List<AccessibilityNode> next = new ArrayList<>(children);
            next.add(child);
            this.children = next;
            return this;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder groupRole(String groupRole) {
            this.groupRole = groupRole;
            return this;
        }

        public Builder groupRoles(List<String> groupRoles) {
            this.groupRoles = groupRoles == null ? List.of() : groupRoles;
            return this;
        }

        public Builder markdown(String markdown) {
            this.markdown = markdown;
            return this;
        }

        public Builder flags(NodeFlags flags) {
            this.flags = flags;
            return this;
        }

        public Builder context(ComputedAttributes context) {
            this.context = context;
            return this;
        }

        public AccessibilityNode build() {
            return new AccessibilityNode(this);
        }
    }
}
