package io.hearthwarrio.actionspace.core.ids;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.StructuralInconsistencyException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IdSynchronizerTest {

    private static AccessibilityNode labeledSource() {
        return IdAssigner.assignIds(AccessibilityNode.of("WebArea", "",
                AccessibilityNode.of("button", "OK"),
                AccessibilityNode.of("link", "Help")));
    }

    @Test
    void copiesIdsOntoNodesWithSameRoleAndName() {
        AccessibilityNode target = AccessibilityNode.of("WebArea", "",
                AccessibilityNode.of("generic", "",
                        AccessibilityNode.of("link", "Help"),
                        AccessibilityNode.of("button", "OK")));

        AccessibilityNode synced = IdSynchronizer.syncIds(target, labeledSource());

        assertEquals("OK", synced.find("B1").orElseThrow().getName());
        assertEquals("Help", synced.find("L1").orElseThrow().getName());
    }

    @Test
    void isIdempotent() {
        AccessibilityNode target = AccessibilityNode.of("WebArea", "",
                AccessibilityNode.of("button", "OK"),
                AccessibilityNode.of("link", "Help"));

        AccessibilityNode once = IdSynchronizer.syncIds(target, labeledSource());

        assertEquals(once, IdSynchronizer.syncIds(once, labeledSource()));
    }

    @Test
    void distributesRepeatedNamesInOrder() {
        AccessibilityNode source = IdAssigner.assignIds(AccessibilityNode.of("WebArea", "",
                AccessibilityNode.of("dialog", "Delete", AccessibilityNode.of("button", "OK")),
                AccessibilityNode.of("dialog", "Rename", AccessibilityNode.of("button", "OK"))));
        AccessibilityNode target = AccessibilityNode.of("WebArea", "",
                AccessibilityNode.of("button", "OK"),
                AccessibilityNode.of("button", "OK"));

        AccessibilityNode synced = IdSynchronizer.syncIds(target, source);

        assertEquals("B1", synced.getChildren().get(0).getId());
        assertEquals("B2", synced.getChildren().get(1).getId());
    }

    @Test
    void reportsMissingNodeWithItsPath() {
        AccessibilityNode target = AccessibilityNode.of("WebArea", "",
                AccessibilityNode.of("button", "OK"));

        StructuralInconsistencyException e = assertThrows(StructuralInconsistencyException.class,
                () -> IdSynchronizer.syncIds(target, labeledSource()));

        assertEquals("link", e.getRole());
        assertEquals("Help", e.getName());
        assertEquals(List.of("WebArea ''", "link 'Help'"), e.getPath());
        assertTrue(e.getMessage().contains("No match"));
    }

    @Test
    void refusesToOverwriteOtherIds() {
        AccessibilityNode target = AccessibilityNode.of("WebArea", "",
                AccessibilityNode.builder("button", "OK").id("B7").build(),
                AccessibilityNode.of("link", "Help"));

        StructuralInconsistencyException e = assertThrows(StructuralInconsistencyException.class,
                () -> IdSynchronizer.syncIds(target, labeledSource()));

        assertTrue(e.getMessage().contains("already carry other IDs [B7]"));
    }

    @Test
    void honoursSourceFilter() {
        AccessibilityNode target = AccessibilityNode.of("WebArea", "",
                AccessibilityNode.of("link", "Help"));

        AccessibilityNode synced = IdSynchronizer.syncIds(target, labeledSource(),
                n -> n.getRole().getValue().equals("link"));

        assertEquals("L1", synced.getChildren().get(0).getId());
    }

    @Test
    void copiesImageIdsInOrderByName() {
        AccessibilityNode source = IdAssigner.assignIds(AccessibilityNode.of("WebArea", "",
                AccessibilityNode.of("img", "logo"),
                AccessibilityNode.of("img", "")));
        AccessibilityNode target = AccessibilityNode.of("WebArea", "",
                AccessibilityNode.of("link", "Home",
                        AccessibilityNode.of("img", "logo")),
                AccessibilityNode.of("img", ""),
                AccessibilityNode.of("img", "spare"));

        AccessibilityNode synced = IdSynchronizer.syncImageIds(target, source);

        assertEquals("F1", synced.getChildren().get(0).getChildren().get(0).getId());
        assertEquals("F2", synced.getChildren().get(1).getId());
        assertNull(synced.getChildren().get(2).getId());
        assertNull(synced.getChildren().get(0).getId());
    }
}
