package io.hearthwarrio.actionspace.webdriver;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.ActionSpaceException;
import io.hearthwarrio.actionspace.core.NodeFlags;
import io.hearthwarrio.actionspace.core.NodeRole;
import io.hearthwarrio.actionspace.core.Role;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chromium.HasCdp;

import java.util.*;

/**
 * Reads the accessibility tree of the current page through the Chrome DevTools Protocol
 * ({@code Accessibility.getFullAXTree}).
 * <p>
 * Nodes the browser marks as ignored are dropped and their children lifted into the parent. Inline text boxes
 * are dropped with their subtree. Chromium role names are translated where the pipeline uses other ones
 * ({@code StaticText} becomes {@code text}, {@code RootWebArea} becomes {@code WebArea}).
 * <p>
 * Each node carries the frames and shadow hosts it sits behind, read from {@code DOM.getDocument} with shadow roots
 * and frame documents pierced. The trees of same-process child frames are read separately and attached under
 * their frame element; cross-process frames stay empty.
 * <p>
 * Only Chromium-based drivers ({@link HasCdp}) are supported.
 */
public final class CdpAccessibilitySnapshotter {

    static final String GET_FULL_AX_TREE = "Accessibility.getFullAXTree";
    static final String GET_DOCUMENT = "DOM.getDocument";

    private static final Map<String, String> ROLE_ALIASES = Map.of(
            "StaticText", NodeRole.TEXT.getValue(),
            "RootWebArea", NodeRole.WEB_AREA.getValue()
    );

    private static final Set<String> DROPPED_ROLES = Set.of("InlineTextBox");

    private final HasCdp cdp;

    public CdpAccessibilitySnapshotter(WebDriver driver) {
        Objects.requireNonNull(driver, "driver must not be null");
        if (!(driver instanceof HasCdp)) {
            throw new IllegalArgumentException(
                    "Accessibility snapshots need a Chromium driver with CDP access, got " + driver.getClass().getName()
            );
        }
        this.cdp = (HasCdp) driver;
    }

    /**
     * Captures the current page once and derives both trees from that capture.
     */
    public AccessibilitySnapshot capture() {
        Map<String, Object> documentParams = new HashMap<>();
        documentParams.put("depth", -1);
        documentParams.put("pierce", true);
        Map<String, Object> document = cdp.executeCdpCommand(GET_DOCUMENT, documentParams);
        DomContextIndex index = DomContextIndex.fromDocument(
                document == null || !(document.get("root") instanceof Map) ? null : (Map<?, ?>) document.get("root")
        );

        cdp.executeCdpCommand("Accessibility.enable", new HashMap<>());
        List<?> nodes;
        Map<String, List<?>> frameNodesByOwner = new LinkedHashMap<>();
        try {
            nodes = nodesOf(cdp.executeCdpCommand(GET_FULL_AX_TREE, new HashMap<>()));
            for (Map.Entry<String, String> owner : index.frameOwners().entrySet()) {
                Map<String, Object> frameParams = new HashMap<>();
                frameParams.put("frameId", owner.getKey());
                frameNodesByOwner.put(owner.getValue(), nodesOf(cdp.executeCdpCommand(GET_FULL_AX_TREE, frameParams)));
            }
        } finally {
            cdp.executeCdpCommand("Accessibility.disable", new HashMap<>());
        }
        return fromCdp(nodes, index, frameNodesByOwner);
    }

    /**
     * Builds both trees from the {@code nodes} array of a {@code getFullAXTree} response, with no frame or shadow
     * context.
     *
     * @throws ActionSpaceException when the response holds no usable root node
     */
    public static AccessibilitySnapshot fromCdpNodes(List<?> nodes) {
        return fromCdp(nodes, DomContextIndex.EMPTY, Map.of());
    }

    /**
     * @param frameNodesByOwner child frame {@code nodes} arrays keyed by the backend node ID of their frame element
     */
    static AccessibilitySnapshot fromCdp(List<?> nodes, DomContextIndex index, Map<String, List<?>> frameNodesByOwner) {
        return new AccessibilitySnapshot(
                toTree(nodes, false, index, frameNodesByOwner),
                toTree(nodes, true, index, frameNodesByOwner)
        );
    }

    private static List<?> nodesOf(Map<String, Object> response) {
        Object raw = response == null ? null : response.get("nodes");
        return raw instanceof List ? (List<?>) raw : List.of();
    }

    static AccessibilityNode toTree(List<?> nodes, boolean interestingOnly) {
        return toTree(nodes, interestingOnly, DomContextIndex.EMPTY, Map.of());
    }

    static AccessibilityNode toTree(
            List<?> nodes,
            boolean interestingOnly,
            DomContextIndex index,
            Map<String, List<?>> frameNodesByOwner
    ) {
        Map<String, Map<?, ?>> byId = new LinkedHashMap<>();
        for (Object o : nodes) {
            if (o instanceof Map) {
                Map<?, ?> node = (Map<?, ?>) o;
                byId.put(String.valueOf(node.get("nodeId")), node);
            }
        }

        Map<?, ?> root = null;
        for (Map<?, ?> node : byId.values()) {
            Object parentId = node.get("parentId");
            if (parentId == null || !byId.containsKey(String.valueOf(parentId))) {
                root = node;
                break;
            }
        }
        if (root == null) {
            throw new ActionSpaceException("Accessibility tree has no root node (" + byId.size() + " node(s))");
        }

        Converter converter = new Converter(byId, interestingOnly, index, frameNodesByOwner);
        List<AccessibilityNode> top = converter.convert(root, true);
        if (top.size() != 1) {
            throw new ActionSpaceException("Accessibility tree root '" + roleOf(root) + "' could not be converted");
        }
        return top.get(0);
    }

    private static final class Converter {
        private final Map<String, Map<?, ?>> byId;
        private final boolean interestingOnly;
        private final DomContextIndex index;
        private final Map<String, List<?>> frameNodesByOwner;
        private final Set<String> visited = new HashSet<>();

        Converter(
                Map<String, Map<?, ?>> byId,
                boolean interestingOnly,
                DomContextIndex index,
                Map<String, List<?>> frameNodesByOwner
        ) {
            this.byId = byId;
            this.interestingOnly = interestingOnly;
            this.index = index;
            this.frameNodesByOwner = frameNodesByOwner;
        }

        /**
         * @return the converted node, or its converted children when the node itself is skipped
         */
        List<AccessibilityNode> convert(Map<?, ?> node, boolean isRoot) {
            String nodeId = String.valueOf(node.get("nodeId"));
            if (!visited.add(nodeId)) {
                throw new ActionSpaceException("Accessibility tree has a cycle at node " + nodeId);
            }

            String rawRole = roleOf(node);
            if (DROPPED_ROLES.contains(rawRole)) {
                return List.of();
            }

            List<AccessibilityNode> children = new ArrayList<>();
            Object childIds = node.get("childIds");
            if (childIds instanceof List) {
                for (Object childId : (List<?>) childIds) {
                    Map<?, ?> child = byId.get(String.valueOf(childId));
                    if (child != null) {
                        children.addAll(convert(child, false));
                    }
                }
            }

            Object backendNodeId = node.get("backendDOMNodeId");
            List<?> frameNodes = backendNodeId == null
                    ? null
                    : frameNodesByOwner.get(DomContextIndex.key(backendNodeId));
            if (frameNodes != null && !frameNodes.isEmpty()) {
                children.add(toTree(frameNodes, interestingOnly, index, frameNodesByOwner));
            }

            Role role = Role.of(ROLE_ALIASES.getOrDefault(rawRole, rawRole));
            String name = axString(node.get("name")).trim();

            if (!isRoot && (Boolean.TRUE.equals(node.get("ignored")) || skipped(role, name))) {
                return children;
            }

            return List.of(AccessibilityNode.builder(role, name)
                    .children(children)
                    .flags(flagsOf(node))
                    .context(index.contextOf(backendNodeId))
                    .build());
        }

        private boolean skipped(Role role, String name) {
            if (!interestingOnly || !name.isEmpty()) {
                return false;
            }
            return role.isPlaceholder() || role.is(NodeRole.TEXT);
        }
    }

    static NodeFlags flagsOf(Map<?, ?> node) {
        NodeFlags.Builder flags = NodeFlags.builder()
                .description(blankToNull(axString(node.get("description"))))
                .value(blankToNull(axString(node.get("value"))));

        Object properties = node.get("properties");
        if (!(properties instanceof List)) {
            return flags.build();
        }
        for (Object p : (List<?>) properties) {
            if (!(p instanceof Map)) {
                continue;
            }
            Map<?, ?> property = (Map<?, ?>) p;
            String propertyName = String.valueOf(property.get("name"));
            Object value = property.get("value") instanceof Map ? ((Map<?, ?>) property.get("value")).get("value") : null;
            switch (propertyName) {
                case "focused":
                    flags.focused(isTrue(value));
                    break;
                case "modal":
                    flags.modal(isTrue(value));
                    break;
                case "required":
                    flags.required(isTrue(value));
                    break;
                case "selected":
                    flags.selected(isTrue(value));
                    break;
                case "checked":
                    // tristate: "mixed" counts as unchecked
                    flags.checked(isTrue(value));
                    break;
                case "disabled":
                    flags.enabled(!isTrue(value));
                    break;
                case "hidden":
                    flags.visible(!isTrue(value));
                    break;
                default:
                    break;
            }
        }
        return flags.build();
    }

    private static String roleOf(Map<?, ?> node) {
        return axString(node.get("role"));
    }

    /**
     * Reads the {@code value} of a CDP {@code AXValue} object.
     */
    private static String axString(Object axValue) {
        if (!(axValue instanceof Map)) {
            return "";
        }
        Object value = ((Map<?, ?>) axValue).get("value");
        return value == null ? "" : String.valueOf(value);
    }

    private static boolean isTrue(Object value) {
        return value != null && "true".equalsIgnoreCase(String.valueOf(value));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
