package io.hearthwarrio.actionspace.core.resolution.strategies;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.DomNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LinkHrefStrategyTest {

    @Test
    void extractsHostOfCurrentUrl() {
        assertEquals("shop.test", LinkHrefStrategy.hostOf("https://shop.test/cart?x=1"));
        assertEquals("shop.test:8080", LinkHrefStrategy.hostOf("http://shop.test:8080"));
        assertEquals("", LinkHrefStrategy.hostOf(null));
    }

    @Test
    void normalizesAbsoluteAndRelativeHrefsAlike() {
        String host = "shop.test";

        assertEquals("/help", LinkHrefStrategy.normalizeHref("https://shop.test/help", host));
        assertEquals("/help", LinkHrefStrategy.normalizeHref("/help#", host));
        assertEquals("/help", LinkHrefStrategy.normalizeHref("http://shop.test/help", host));
        assertEquals("other.test/help", LinkHrefStrategy.normalizeHref("https://other.test/help", host));
    }

    @Test
    void onlySupportsLinks() {
        LinkHrefStrategy strategy = new LinkHrefStrategy();

        assertTrue(strategy.supports(DomNode.fromAccessibilityNode(AccessibilityNode.of("link", "Docs"))));
        assertFalse(strategy.supports(DomNode.fromAccessibilityNode(AccessibilityNode.of("button", "Docs"))));
    }
}
