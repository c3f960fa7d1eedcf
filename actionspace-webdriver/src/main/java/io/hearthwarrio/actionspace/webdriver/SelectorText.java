package io.hearthwarrio.actionspace.webdriver;

/**
 * Quoting helpers for XPath and CSS selectors built from page values.
 */
final class SelectorText {

    private SelectorText() {
    }

    static String xpathLiteral(String value) {
        if (value == null) {
            return "''";
        }
        if (!value.contains("'")) {
            return "'" + value + "'";
        }
        if (!value.contains("\"")) {
            return "\"" + value + "\"";
        }

        String[] parts = value.split("'", -1);
        StringBuilder sb = new StringBuilder("concat(");
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append(", \"'\", ");
            }
            sb.append("'").append(parts[i]).append("'");
        }
        sb.append(")");
        return sb.toString();
    }

    static String cssAttrLiteral(String value) {
        String v = value == null ? "" : value;
        v = v.replace("\\", "\\\\").replace("'", "\\'");
        return "'" + v + "'";
    }

    static String cssEscapeIdentifier(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            boolean ok = Character.isLetterOrDigit(ch) || ch == '-' || ch == '_';
            if (ok) {
                sb.append(ch);
            } else {
                sb.append('\\').append(ch);
            }
        }
        // identifiers may not start with a digit
        if (sb.length() > 0 && Character.isDigit(sb.charAt(0))) {
            return "\\3" + sb.charAt(0) + " " + sb.substring(1);
        }
        return sb.toString();
    }

    /**
     * XPath selectors start with a slash or a parenthesized expression; everything else is CSS.
     */
    static boolean isXPath(String selector) {
        return selector != null && (selector.startsWith("/") || selector.startsWith("(") || selector.startsWith("./"));
    }

    /**
     * Role and text-context selectors are only understood by the resolver itself.
     */
    static boolean isRoleNotation(String selector) {
        return selector != null && (selector.startsWith("role=") || selector.startsWith("text-context("));
    }

    static String normalizeText(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().replaceAll("\\s+", " ");
    }
}
