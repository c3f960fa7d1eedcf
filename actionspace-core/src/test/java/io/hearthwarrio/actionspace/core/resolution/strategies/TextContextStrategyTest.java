package io.hearthwarrio.actionspace.core.resolution.strategies;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.DomNode;
import io.hearthwarrio.actionspace.core.resolution.ResolutionConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TextContextStrategyTest {

    @Test
    void collectsTextNamesOutsideInteractions() {
        DomNode card = DomNode.fromAccessibilityNode(AccessibilityNode.of("article", "",
                AccessibilityNode.of("heading", "Blue mug"),
                AccessibilityNode.of("generic", "",
                        AccessibilityNode.of("text", "12 EUR"),
                        AccessibilityNode.of("text", " ")),
                AccessibilityNode.of("button", "Add to cart",
                        AccessibilityNode.of("text", "Add to cart")),
                AccessibilityNode.of("paragraph", "In stock",
                        AccessibilityNode.of("text", "ignored below a text node"))));

        List<String> texts = TextContextStrategy.textNames(card, ResolutionConfig.DEFAULT.getTextContextRoles());

        assertEquals(List.of("Blue mug", "12 EUR", "In stock"), texts);
    }

    @Test
    void honoursConfiguredRoles() {
        DomNode card = DomNode.fromAccessibilityNode(AccessibilityNode.of("article", "",
                AccessibilityNode.of("heading", "Blue mug"),
                AccessibilityNode.of("text", "12 EUR")));

        List<String> texts = TextContextStrategy.textNames(card,
                ResolutionConfig.DEFAULT.withTextContextRoles("heading").getTextContextRoles());

        assertEquals(List.of("Blue mug"), texts);
    }
}
