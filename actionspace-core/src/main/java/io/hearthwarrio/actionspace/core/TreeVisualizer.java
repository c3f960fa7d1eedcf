package io.hearthwarrio.actionspace.core;

import java.util.List;

/**
 * Renders an accessibility tree as an indented text outline, one node per line:
 * <pre>
 * [WebArea] 'Login'
 * ├── [button] 'Sign in'  (B1)
 * └── [link as listitem] 'Forgot?'  (L1)
 * </pre>
 */
public final class TreeVisualizer {

    static final int MARKDOWN_PREVIEW_LENGTH = 40;

    private TreeVisualizer() {
    }

    public static String visualize(AccessibilityNode root) {
        StringBuilder sb = new StringBuilder(256);
        sb.append(label(root)).append('\n');
        appendMarkdownPreview(sb, root, "");
        if (root.getMarkdown() == null) {
            appendChildren(sb, root.getChildren(), "");
        }
        return sb.toString();
    }

    private static void appendChildren(StringBuilder sb, List<AccessibilityNode> children, String prefix) {
        for (int i = 0; i < children.size(); i++) {
            AccessibilityNode child = children.get(i);
            boolean last = i == children.size() - 1;
            sb.append(prefix).append(last ? "└── " : "├── ").append(label(child)).append('\n');

            String childPrefix = prefix + (last ? "    " : "│   ");
            if (child.getMarkdown() != null) {
                appendMarkdownPreview(sb, child, childPrefix);
                continue;
            }
            appendChildren(sb, child.getChildren(), childPrefix);
        }
    }

    private static void appendMarkdownPreview(StringBuilder sb, AccessibilityNode node, String prefix) {
        String markdown = node.getMarkdown();
        if (markdown == null) {
            return;
        }
        String preview = markdown.length() > MARKDOWN_PREVIEW_LENGTH
                ? markdown.substring(0, MARKDOWN_PREVIEW_LENGTH) + "..."
                : markdown;
        sb.append(prefix).append("    ").append(preview.replace('\n', ' ')).append('\n');
    }

    static String label(AccessibilityNode node) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(node.getRole().getValue());
        if (node.getGroupRole() != null) {
            sb.append(" as ").append(node.getGroupRole());
        }
        sb.append("] '").append(node.getName()).append('\'');
        if (node.getId() != null) {
            sb.append("  (").append(node.getId()).append(')');
        }
        if (node.getFlags().getSelected().orElse(false)) {
            sb.append(" (selected)");
        }
        return sb.toString();
    }
}
