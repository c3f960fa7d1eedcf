package io.hearthwarrio.actionspace.webdriver;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AriaRoleSelectorsTest {

    @Test
    void implicitHostsComeBeforeTheRoleAttribute() {
        String css = AriaRoleSelectors.css("button");

        assertTrue(css.startsWith("button, input[type='button']"), css);
        assertTrue(css.endsWith("[role='button']"), css);
    }

    @Test
    void roleIsNormalized() {
        assertEquals(AriaRoleSelectors.css("link"), AriaRoleSelectors.css(" Link "));
        assertTrue(AriaRoleSelectors.css("link").contains("a[href]"));
    }

    @Test
    void rolesWithoutHtmlHostsUseTheAttributeOnly() {
        assertEquals("[role='treeitem']", AriaRoleSelectors.css("treeitem"));
        assertFalse(AriaRoleSelectors.hasImplicitHosts("treeitem"));
        assertTrue(AriaRoleSelectors.hasImplicitHosts("combobox"));
    }

    @Test
    void blankRoleIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> AriaRoleSelectors.css(" "));
    }
}
