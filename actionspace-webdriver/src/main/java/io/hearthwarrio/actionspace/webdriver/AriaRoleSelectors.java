package io.hearthwarrio.actionspace.webdriver;

import java.util.*;

/**
 * CSS selectors for the elements that may carry a given ARIA role, implicitly or through a {@code role} attribute.
 * <p>
 * The selector only narrows the candidates; the browser-computed role is still compared afterwards.
 */
public final class AriaRoleSelectors {

    private static final Map<String, List<String>> IMPLICIT = new HashMap<>();

    static {
        implicit("button", "button", "input[type='button']", "input[type='submit']", "input[type='reset']",
                "input[type='image']", "summary");
        implicit("link", "a[href]", "area[href]");
        implicit("textbox", "input:not([type])", "input[type='text']", "input[type='email']", "input[type='tel']",
                "input[type='url']", "input[type='password']", "textarea", "[contenteditable='true']",
                "[contenteditable='']");
        implicit("searchbox", "input[type='search']");
        implicit("checkbox", "input[type='checkbox']");
        implicit("radio", "input[type='radio']");
        implicit("combobox", "select:not([multiple]):not([size])", "input[list]");
        implicit("listbox", "select[multiple]", "select[size]", "datalist");
        implicit("option", "option");
        implicit("slider", "input[type='range']");
        implicit("spinbutton", "input[type='number']");
        implicit("heading", "h1", "h2", "h3", "h4", "h5", "h6");
        implicit("paragraph", "p");
        implicit("dialog", "dialog");
        implicit("img", "img[alt]:not([alt=''])", "svg");
        implicit("image", "img[alt]:not([alt=''])", "svg");
        implicit("figure", "figure");
        implicit("navigation", "nav");
        implicit("main", "main");
        implicit("form", "form");
        implicit("region", "section[aria-label]", "section[aria-labelledby]");
        implicit("list", "ul", "ol", "menu");
        implicit("listitem", "li");
        implicit("table", "table");
        implicit("row", "tr");
        implicit("cell", "td");
        implicit("columnheader", "th");
        implicit("group", "fieldset", "details", "optgroup");
        implicit("article", "article");
        implicit("banner", "header");
        implicit("contentinfo", "footer");
        implicit("complementary", "aside");
        implicit("progressbar", "progress");
        implicit("meter", "meter");
    }

    private AriaRoleSelectors() {
    }

    private static void implicit(String role, String... selectors) {
        IMPLICIT.put(role, Collections.unmodifiableList(Arrays.asList(selectors)));
    }

    /**
     * @param role ARIA role as reported in the accessibility tree
     * @return CSS selector list matching every element that could expose {@code role}
     */
    public static String css(String role) {
        String r = role == null ? "" : role.trim().toLowerCase(Locale.ROOT);
        if (r.isEmpty()) {
            throw new IllegalArgumentException("role must not be blank");
        }
        StringJoiner joiner = new StringJoiner(", ");
        for (String s : IMPLICIT.getOrDefault(r, List.of())) {
            joiner.add(s);
        }
        joiner.add("[role=" + SelectorText.cssAttrLiteral(r) + "]");
        return joiner.toString();
    }

    /**
     * @return whether the role has implicit HTML hosts, not only explicit {@code role} attributes
     */
    public static boolean hasImplicitHosts(String role) {
        return role != null && IMPLICIT.containsKey(role.trim().toLowerCase(Locale.ROOT));
    }
}
