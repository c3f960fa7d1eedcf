package io.hearthwarrio.actionspace.core.resolution;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory page for resolver tests: a tree of elements carrying role, accessible name and attributes.
 */
final class FakePage implements PageQueryCapability {

    static final class Element implements LocatorHandle {
        final String role;
        final String name;
        final List<Element> children = new ArrayList<>();
        final Map<String, String> attributes = new HashMap<>();
        Element parent;
        String css;
        boolean selected;
        boolean checked;

        Element(String role, String name, Element... children) {
            this.role = role;
            this.name = name;
            for (Element child : children) {
                child.parent = this;
                this.children.add(child);
            }
        }

        Element attr(String key, String value) {
            attributes.put(key, value);
            return this;
        }

        Element css(String css) {
            this.css = css;
            return this;
        }

        Element selected() {
            this.selected = true;
            return this;
        }

        boolean isDescendantOf(Element ancestor) {
            for (Element p = parent; p != null; p = p.parent) {
                if (p == ancestor) {
                    return true;
                }
            }
            return false;
        }

        String textContent() {
            if (children.isEmpty()) {
                return name;
            }
            StringBuilder sb = new StringBuilder();
            for (Element child : children) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(child.textContent());
            }
            return sb.toString();
        }

        void preOrder(List<Element> out) {
            out.add(this);
            for (Element child : children) {
                child.preOrder(out);
            }
        }

        @Override
        public String describe() {
            return role + " '" + name + "'";
        }

        @Override
        public String toString() {
            return describe();
        }
    }

    static Element el(String role, String name, Element... children) {
        return new Element(role, name, children);
    }

    private final Element root;
    private final String url;
    final List<List<RoleQuery>> queries = new ArrayList<>();
    final List<List<SelectorSegment>> scopedResolutions = new ArrayList<>();

    FakePage(String url, Element... body) {
        this.root = new Element("WebArea", "", body);
        this.url = url;
    }

    FakePage(Element... body) {
        this("https://shop.test/", body);
    }

    @Override
    public String currentUrl() {
        return url;
    }

    @Override
    public List<LocatorHandle> locate(LocatorHandle scope, List<RoleQuery> path) {
        queries.add(List.copyOf(path));
        List<Element> all = new ArrayList<>();
        root.preOrder(all);

        List<Element> current = List.of(scope == null ? root : (Element) scope);
        for (RoleQuery query : path) {
            Set<Element> next = new LinkedHashSet<>();
            for (Element candidate : all) {
                if (!query.matches(candidate.role, candidate.name, candidate.selected, candidate.checked)) {
                    continue;
                }
                for (Element container : current) {
                    if (candidate.isDescendantOf(container)) {
                        next.add(candidate);
                        break;
                    }
                }
            }
            current = new ArrayList<>(next);
        }
        return new ArrayList<>(current);
    }

    @Override
    public Optional<String> getAttribute(LocatorHandle handle, String name) {
        return Optional.ofNullable(((Element) handle).attributes.get(name));
    }

    @Override
    public boolean isEditable(LocatorHandle handle) {
        return "textbox".equals(((Element) handle).role);
    }

    @Override
    public boolean isEnabled(LocatorHandle handle) {
        return !"true".equals(((Element) handle).attributes.get("disabled"));
    }

    @Override
    public boolean isVisible(LocatorHandle handle) {
        return true;
    }

    @Override
    public Optional<LocatorHandle> climbAncestor(LocatorHandle handle, int levels) {
        Element e = (Element) handle;
        for (int i = 0; i < levels && e != null; i++) {
            e = e.parent;
        }
        return Optional.ofNullable(e);
    }

    @Override
    public List<LocatorHandle> filterContainsText(List<LocatorHandle> handles, String text) {
        List<LocatorHandle> out = new ArrayList<>();
        for (LocatorHandle handle : handles) {
            if (((Element) handle).textContent().contains(text)) {
                out.add(handle);
            }
        }
        return out;
    }

    @Override
    public LocatorHandle resolveThroughShadowOrIframe(List<SelectorSegment> segments) {
        scopedResolutions.add(List.copyOf(segments));
        List<Element> all = new ArrayList<>();
        root.preOrder(all);
        Element scope = root;
        for (SelectorSegment segment : segments) {
            Element found = null;
            for (Element e : all) {
                if (segment.getSelector().equals(e.css) && e.isDescendantOf(scope)) {
                    found = e;
                    break;
                }
            }
            if (found == null) {
                throw new IllegalStateException("No element for " + segment + " in " + scope.describe());
            }
            scope = found;
        }
        return scope;
    }

    @Override
    public List<String> describeSelectors(LocatorHandle handle) {
        Element e = (Element) handle;
        return e.css == null ? List.of() : List.of(e.css);
    }
}
