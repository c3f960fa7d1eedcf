package io.hearthwarrio.actionspace.webdriver;

import io.hearthwarrio.actionspace.core.ComputedAttributes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Frame and shadow context of every DOM node, keyed by CDP backend node ID.
 * <p>
 * Built from a {@code DOM.getDocument} response taken with {@code depth=-1} and {@code pierce=true}, so shadow roots
 * and same-process frame documents are part of the tree. Boundary selectors are relative to the document or
 * shadow root that holds the boundary element: {@code tag#id} when the element has an id, otherwise a positional
 * {@code >} chain of {@code :nth-of-type} steps.
 * <p>
 * Frames nested inside shadow trees are not indexed: their content keeps the empty context.
 */
final class DomContextIndex {

    static final DomContextIndex EMPTY = new DomContextIndex(Map.of(), Map.of());

    private static final int ELEMENT_NODE = 1;

    private final Map<String, ComputedAttributes> contexts;
    private final Map<String, String> frameOwners;

    private DomContextIndex(Map<String, ComputedAttributes> contexts, Map<String, String> frameOwners) {
        this.contexts = contexts;
        this.frameOwners = frameOwners;
    }

    /**
     * @param document the {@code root} node of a {@code DOM.getDocument} response
     */
    static DomContextIndex fromDocument(Map<?, ?> document) {
        if (document == null) {
            return EMPTY;
        }
        Walker walker = new Walker();
        walker.walk(document, List.of(), List.of(), null);
        return new DomContextIndex(
                Collections.unmodifiableMap(walker.contexts),
                Collections.unmodifiableMap(walker.frameOwners)
        );
    }

    ComputedAttributes contextOf(Object backendNodeId) {
        if (backendNodeId == null) {
            return ComputedAttributes.EMPTY;
        }
        return contexts.getOrDefault(key(backendNodeId), ComputedAttributes.EMPTY);
    }

    /**
     * Frame ID to backend node ID of the frame element, for frames whose document is part of the index.
     */
    Map<String, String> frameOwners() {
        return frameOwners;
    }

    static String key(Object backendNodeId) {
        if (backendNodeId instanceof Number) {
            return String.valueOf(((Number) backendNodeId).longValue());
        }
        return String.valueOf(backendNodeId);
    }

    private static final class Walker {
        private final Map<String, ComputedAttributes> contexts = new HashMap<>();
        private final Map<String, String> frameOwners = new LinkedHashMap<>();

        void walk(Map<?, ?> node, List<String> frames, List<String> hosts, String path) {
            Object backendNodeId = node.get("backendNodeId");
            if (backendNodeId != null) {
                ComputedAttributes context = ComputedAttributes.scopedTo(frames, hosts);
                if (context != ComputedAttributes.EMPTY) {
                    contexts.put(key(backendNodeId), context);
                }
            }

            if (isElement(node)) {
                Object contentDocument = node.get("contentDocument");
                if (contentDocument instanceof Map && hosts.isEmpty()) {
                    Object frameId = node.get("frameId");
                    if (frameId != null && backendNodeId != null) {
                        frameOwners.put(String.valueOf(frameId), key(backendNodeId));
                    }
                    walk((Map<?, ?>) contentDocument, append(frames, boundarySelector(node, path)), List.of(), null);
                }
                for (Map<?, ?> shadowRoot : maps(node.get("shadowRoots"))) {
                    walk(shadowRoot, frames, append(hosts, boundarySelector(node, path)), null);
                }
            }

            Map<String, Integer> seen = new HashMap<>();
            for (Map<?, ?> child : maps(node.get("children"))) {
                String childPath = path;
                if (isElement(child)) {
                    String tag = tagOf(child);
                    int nth = seen.merge(tag, 1, Integer::sum);
                    String step = tag + ":nth-of-type(" + nth + ")";
                    childPath = path == null ? step : path + " > " + step;
                }
                walk(child, frames, hosts, childPath);
            }
        }
    }

    static String boundarySelector(Map<?, ?> element, String path) {
        String id = attribute(element, "id");
        if (id != null && !id.isBlank()) {
            return tagOf(element) + "#" + SelectorText.cssEscapeIdentifier(id);
        }
        return path == null ? tagOf(element) : path;
    }

    /**
     * CDP sends attributes as a flat {@code [name, value, name, value, ...]} list.
     */
    static String attribute(Map<?, ?> element, String name) {
        Object attributes = element.get("attributes");
        if (!(attributes instanceof List)) {
            return null;
        }
        List<?> flat = (List<?>) attributes;
        for (int i = 0; i + 1 < flat.size(); i += 2) {
            if (name.equals(flat.get(i))) {
                return String.valueOf(flat.get(i + 1));
            }
        }
        return null;
    }

    private static boolean isElement(Map<?, ?> node) {
        Object type = node.get("nodeType");
        return type instanceof Number && ((Number) type).intValue() == ELEMENT_NODE;
    }

    private static String tagOf(Map<?, ?> element) {
        Object localName = element.get("localName");
        if (localName != null && !String.valueOf(localName).isEmpty()) {
            return String.valueOf(localName);
        }
        return String.valueOf(element.get("nodeName")).toLowerCase(Locale.ROOT);
    }

    private static List<Map<?, ?>> maps(Object list) {
        if (!(list instanceof List)) {
            return List.of();
        }
        List<Map<?, ?>> out = new ArrayList<>();
        for (Object o : (List<?>) list) {
            if (o instanceof Map) {
                out.add((Map<?, ?>) o);
            }
        }
        return out;
    }

    private static List<String> append(List<String> list, String value) {
        List<String> next = new ArrayList<>(list);
        next.add(value);
        return List.copyOf(next);
    }
}
