package io.hearthwarrio.actionspace.core.processing;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.NodeCategory;
import io.hearthwarrio.actionspace.core.NodeRole;
import io.hearthwarrio.actionspace.core.Role;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Collapses runs of text children into a single text group carrying a markdown rendering.
 */
final class TextGrouper {

    static final String TEXT_GROUP = "text-group";

    private final TextGroupingThresholds thresholds;
    private final Set<String> textRoles = NodeCategory.TEXT.roles();
    private final Set<String> textOrPlaceholderRoles = NodeCategory.TEXT.roles(true);

    TextGrouper(TextGroupingThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
    }

    AccessibilityNode group(AccessibilityNode node) {
        if (!node.hasChildren() || !shouldGroup(node)) {
            return node;
        }

        List<AccessibilityNode> textChildren = new ArrayList<>();
        List<AccessibilityNode> otherChildren = new ArrayList<>();
        Set<String> textChildRoles = new LinkedHashSet<>();
        for (AccessibilityNode child : node.getChildren()) {
            if (isTextGroup(child)) {
                textChildren.add(child);
                textChildRoles.addAll(child.subtreeRoles(true));
            } else {
                otherChildren.add(child);
            }
        }
        if (textChildren.isEmpty()) {
            return node;
        }

        String markdown;
        if (textChildRoles.contains(NodeRole.HEADING.getValue())) {
            markdown = toMarkdown(textChildren, "\n");
        } else {
            List<String> fragments = new ArrayList<>();
            for (AccessibilityNode child : textChildren) {
                collectTexts(child, fragments);
            }
            if (fragments.isEmpty()) {
                return node;
            }
            markdown = concat(fragments);
        }

        if (otherChildren.isEmpty()) {
            AccessibilityNode.Builder b = node.toBuilder().children(List.of());
            if (node.hasBlankName()) {
                b.name(markdown);
            } else {
                markdown = "# " + node.getName() + "\n\n" + markdown;
            }
            return b.markdown(markdown).build().addGroupRole(TEXT_GROUP);
        }

        otherChildren.add(AccessibilityNode.builder(Role.of(NodeRole.TEXT), markdown)
                .groupRole(TEXT_GROUP)
                .markdown(markdown)
                .build());
        return node.withChildren(otherChildren);
    }

    /**
     * Either every child is text (and the node itself is not a text/placeholder wrapper), or enough text
     * groups sit next to enough non-text children.
     */
    boolean shouldGroup(AccessibilityNode node) {
        int invalidChildren = 0;
        int validGroups = 0;
        for (AccessibilityNode child : node.getChildren()) {
            int groups = validGroups(child);
            validGroups += groups;
            if (groups == 0) {
                invalidChildren++;
            }
        }
        boolean onlyTextChildren = textOrPlaceholderRoles.containsAll(node.childrenRoles())
                && !textOrPlaceholderRoles.contains(node.getRole().getValue());
        return onlyTextChildren
                || (validGroups >= thresholds.getMinValidGroups()
                && invalidChildren >= thresholds.getMinInvalidChildren());
    }

    private int validGroups(AccessibilityNode child) {
        if (!child.hasChildren()) {
            return textRoles.contains(child.getRole().getValue()) ? 1 : 0;
        }
        if (!textOrPlaceholderRoles.containsAll(child.childrenRoles())) {
            return 0;
        }
        int count = 0;
        for (String role : textRoles) {
            count += child.getChildrenRolesCount().getOrDefault(role, 0);
        }
        return count;
    }

    private boolean isTextGroup(AccessibilityNode child) {
        if (!child.hasChildren()) {
            return child.getRole().in(NodeCategory.TEXT);
        }
        return textOrPlaceholderRoles.containsAll(child.childrenRoles());
    }

    private String toMarkdown(List<AccessibilityNode> children, String joinWith) {
        StringBuilder sb = new StringBuilder();
        for (AccessibilityNode child : children) {
            Role role = child.getRole();
            if (role.is(NodeRole.HEADING)) {
                sb.append("## ").append(child.getName()).append(joinWith);
            } else if (role.is(NodeRole.TEXT)) {
                sb.append(child.getName()).append(joinWith);
            } else if (role.isPlaceholder()) {
                sb.append(toMarkdown(child.getChildren(), "\n *"));
            }
        }
        return sb.toString();
    }

    private void collectTexts(AccessibilityNode node, List<String> out) {
        if (node.getRole().is(NodeRole.HEADING) || node.getRole().is(NodeRole.TEXT)) {
            out.add(node.getName());
            return;
        }
        for (AccessibilityNode child : node.getChildren()) {
            collectTexts(child, out);
        }
    }

    String concat(List<String> fragments) {
        int longest = 0;
        for (String f : fragments) {
            longest = Math.max(longest, f.length());
        }
        if (longest <= thresholds.getShortFragmentMaxLength()) {
            return String.join("", fragments);
        }

        // consecutive one-char fragments are glued together
        List<String> grouped = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String f : fragments) {
            if (f.length() == 1) {
                current.append(f);
                continue;
            }
            if (current.length() > 0) {
                grouped.add(current.toString());
                current.setLength(0);
            }
            grouped.add(f);
        }
        if (current.length() > 0) {
            grouped.add(current.toString());
        }

        if (fragments.size() <= thresholds.getBulletMaxFragments()) {
            return String.join(", ", grouped);
        }
        return String.join(" ", grouped);
    }
}
