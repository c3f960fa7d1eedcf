package io.hearthwarrio.actionspace.webdriver;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.ActionSpaceException;
import io.hearthwarrio.actionspace.core.DomNode;
import io.hearthwarrio.actionspace.core.pipeline.AccessibilityTreePipeline;
import io.hearthwarrio.actionspace.core.pipeline.ProcessedTree;
import io.hearthwarrio.actionspace.core.pipeline.TreeKind;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class CdpAccessibilitySnapshotterTest {

    private static Map<String, Object> node(String id, String parentId, String role, String name, String... childIds) {
        Map<String, Object> n = new LinkedHashMap<>();
        n.put("nodeId", id);
        if (parentId != null) {
            n.put("parentId", parentId);
        }
        n.put("ignored", false);
        n.put("role", Map.of("type", "role", "value", role));
        n.put("name", Map.of("type", "computedString", "value", name));
        n.put("childIds", Arrays.asList(childIds));
        return n;
    }

    private static Map<String, Object> property(String name, Object value) {
        return Map.of("name", name, "value", Map.of("type", "booleanOrUndefined", "value", value));
    }

    private static List<Object> loginPageNodes() {
        Map<String, Object> root = node("1", null, "RootWebArea", "Login", "2", "3");
        Map<String, Object> wrapper = node("2", "1", "generic", "", "4", "5");
        Map<String, Object> ignored = node("3", "1", "none", "", "6");
        ignored.put("ignored", true);
        Map<String, Object> email = node("4", "2", "textbox", "Email");
        email.put("value", Map.of("type", "string", "value", "a@b.test"));
        email.put("properties", List.of(property("focused", true), property("required", true)));
        Map<String, Object> text = node("5", "2", "StaticText", "Hello", "7");
        Map<String, Object> inline = node("7", "5", "InlineTextBox", "Hello");
        Map<String, Object> signIn = node("6", "3", "button", "Sign in");
        signIn.put("properties", List.of(property("disabled", true)));
        return List.of(root, wrapper, ignored, email, text, signIn, inline);
    }

    @Test
    void rawTreeKeepsPlaceholdersAndLiftsIgnoredNodes() {
        AccessibilityNode raw = CdpAccessibilitySnapshotter.fromCdpNodes(loginPageNodes()).getRaw();

        assertEquals("WebArea", raw.getRole().getValue());
        assertEquals("Login", raw.getName());
        assertEquals(2, raw.getChildren().size());

        AccessibilityNode wrapper = raw.getChildren().get(0);
        assertEquals("generic", wrapper.getRole().getValue());
        assertEquals(2, wrapper.getChildren().size());

        AccessibilityNode text = wrapper.getChildren().get(1);
        assertEquals("text", text.getRole().getValue());
        assertTrue(text.getChildren().isEmpty(), "inline text boxes must be dropped");

        AccessibilityNode signIn = raw.getChildren().get(1);
        assertEquals("button", signIn.getRole().getValue(), "children of an ignored node are lifted");
    }

    @Test
    void simpleTreeDropsUnnamedPlaceholders() {
        AccessibilityNode simple = CdpAccessibilitySnapshotter.fromCdpNodes(loginPageNodes()).getSimple();

        List<String> roles = new ArrayList<>();
        for (AccessibilityNode child : simple.getChildren()) {
            roles.add(child.getRole().getValue());
        }
        assertEquals(List.of("textbox", "text", "button"), roles);
    }

    @Test
    void propertiesBecomeFlags() {
        AccessibilityNode raw = CdpAccessibilitySnapshotter.fromCdpNodes(loginPageNodes()).getRaw();
        AccessibilityNode email = raw.getChildren().get(0).getChildren().get(0);
        AccessibilityNode signIn = raw.getChildren().get(1);

        assertEquals(Optional.of(true), email.getFlags().getFocused());
        assertEquals(Optional.of(true), email.getFlags().getRequired());
        assertEquals("a@b.test", email.getFlags().getValue());
        assertEquals(Optional.of(false), signIn.getFlags().getEnabled());
    }

    @Test
    void checkedTristateMixedCountsAsUnchecked() {
        Map<String, Object> root = node("1", null, "RootWebArea", "", "2", "3");
        Map<String, Object> on = node("2", "1", "checkbox", "On");
        on.put("properties", List.of(Map.of("name", "checked", "value", Map.of("type", "tristate", "value", "true"))));
        Map<String, Object> mixed = node("3", "1", "checkbox", "Mixed");
        mixed.put("properties", List.of(Map.of("name", "checked", "value", Map.of("type", "tristate", "value", "mixed"))));

        AccessibilityNode raw = CdpAccessibilitySnapshotter.fromCdpNodes(List.of(root, on, mixed)).getRaw();

        assertEquals(Optional.of(true), raw.getChildren().get(0).getFlags().getChecked());
        assertEquals(Optional.of(false), raw.getChildren().get(1).getFlags().getChecked());
    }

    @Test
    void capturedTreesFeedThePipeline() {
        AccessibilitySnapshot snapshot = CdpAccessibilitySnapshotter.fromCdpNodes(loginPageNodes());

        ProcessedTree tree = new AccessibilityTreePipeline().process(snapshot.getRaw(), snapshot.getSimple());

        AccessibilityNode email = tree.tree(TreeKind.RAW).find("I1").orElseThrow();
        assertEquals("Email", email.getName());
        assertTrue(tree.tree(TreeKind.PROCESSED).find("I1").isPresent());
    }

    @Test
    void nodesCarryShadowAndFrameContext() {
        Map<String, Object> root = node("1", null, "RootWebArea", "Shop", "2", "3");
        root.put("backendDOMNodeId", 1);
        Map<String, Object> inShadow = node("2", "1", "button", "Add to cart");
        inShadow.put("backendDOMNodeId", 7);
        Map<String, Object> frame = node("3", "1", "Iframe", "");
        frame.put("backendDOMNodeId", 8);

        Map<String, Object> frameRoot = node("1", null, "RootWebArea", "Checkout", "2");
        frameRoot.put("backendDOMNodeId", 9);
        Map<String, Object> pay = node("2", "1", "button", "Pay");
        pay.put("backendDOMNodeId", 12);

        AccessibilitySnapshot snapshot = CdpAccessibilitySnapshotter.fromCdp(
                List.of(root, inShadow, frame),
                DomContextIndex.fromDocument(DomContextIndexTest.document()),
                Map.<String, List<?>>of("8", List.of(frameRoot, pay))
        );
        AccessibilityNode raw = snapshot.getRaw();

        assertFalse(raw.getContext().needsScopedResolution());
        assertEquals(List.of("my-widget#card"), raw.getChildren().get(0).getContext().getShadowHostSelectors());

        AccessibilityNode frameDocument = raw.getChildren().get(1).getChildren().get(0);
        assertEquals("WebArea", frameDocument.getRole().getValue());
        assertEquals("Checkout", frameDocument.getName());
        AccessibilityNode payButton = frameDocument.getChildren().get(0);
        assertEquals("Pay", payButton.getName());
        assertEquals(List.of(DomContextIndexTest.FRAME_PATH), payButton.getContext().getIframeParentSelectors());

        ProcessedTree tree = new AccessibilityTreePipeline().process(snapshot.getRaw(), snapshot.getSimple());
        DomNode dom = tree.toDomNode(TreeKind.RAW);
        assertEquals(List.of(DomContextIndexTest.FRAME_PATH),
                dom.findPath("B2").orElseThrow().getNode().getComputedAttributes().getIframeParentSelectors());
        assertTrue(dom.findPath("B1").orElseThrow().getNode().getComputedAttributes().isInShadowRoot());
    }

    @Test
    void responseWithoutRootIsRejected() {
        Map<String, Object> a = node("1", "2", "generic", "");
        Map<String, Object> b = node("2", "1", "generic", "");

        ActionSpaceException e = assertThrows(
                ActionSpaceException.class,
                () -> CdpAccessibilitySnapshotter.fromCdpNodes(List.of(a, b))
        );
        assertTrue(e.getMessage().contains("no root"), e.getMessage());
    }
}
