package io.hearthwarrio.actionspace.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * HTML-level attributes of a resolved element. Missing values are empty strings.
 */
public final class DomAttributes {

    public static final DomAttributes EMPTY = builder().build();

    private final String tagName;
    private final String href;
    private final String src;
    private final String inputType;
    private final String placeholder;
    private final String title;
    private final Boolean editable;
    private final Map<String, String> aria;

    private DomAttributes(Builder b) {
        this.tagName = normalizeNull(b.tagName);
        this.href = normalizeNull(b.href);
        this.src = normalizeNull(b.src);
        this.inputType = normalizeNull(b.inputType);
        this.placeholder = normalizeNull(b.placeholder);
        this.title = normalizeNull(b.title);
        this.editable = b.editable;
        this.aria = Collections.unmodifiableMap(new LinkedHashMap<>(b.aria));
    }

    private static String normalizeNull(String s) {
        return s == null ? "" : s;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTagName() {
        return tagName;
    }

    public String getHref() {
        return href;
    }

    public String getSrc() {
        return src;
    }

    public String getInputType() {
        return inputType;
    }

    public String getPlaceholder() {
        return placeholder;
    }

    public String getTitle() {
        return title;
    }

    /**
     * @return editable flag, or null when it was never checked
     */
    public Boolean getEditable() {
        return editable;
    }

    /**
     * {@code aria-*} attributes keyed by their full attribute name.
     */
    public Map<String, String> getAria() {
        return aria;
    }

    @Override
    public String toString() {
        return "DomAttributes{" +
                "tagName='" + tagName + '\'' +
                ", href='" + href + '\'' +
                ", src='" + src + '\'' +
                ", inputType='" + inputType + '\'' +
                ", editable=" + editable +
                ", aria=" + aria +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DomAttributes)) return false;
        DomAttributes that = (DomAttributes) o;
        return tagName.equals(that.tagName) &&
                href.equals(that.href) &&
                src.equals(that.src) &&
                inputType.equals(that.inputType) &&
                placeholder.equals(that.placeholder) &&
                title.equals(that.title) &&
                Objects.equals(editable, that.editable) &&
                aria.equals(that.aria);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tagName, href, src, inputType, placeholder, title, editable, aria);
    }

    public static final class Builder {
        private String tagName;
        private String href;
        private String src;
        private String inputType;
        private String placeholder;
        private String title;
        private Boolean editable;
        private final Map<String, String> aria = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder tagName(String tagName) {
            this.tagName = tagName;
            return this;
        }

        public Builder href(String href) {
            this.href = href;
            return this;
        }

        public Builder src(String src) {
            this.src = src;
            return this;
        }

        public Builder inputType(String inputType) {
            this.inputType = inputType;
            return this;
        }

        public Builder placeholder(String placeholder) {
            this.placeholder = placeholder;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder editable(Boolean editable) {
            this.editable = editable;
            return this;
        }

        public Builder aria(String attributeName, String value) {
            if (attributeName != null && value != null) {
                aria.put(attributeName, value);
            }
            return this;
        }

        public DomAttributes build() {
            return new DomAttributes(this);
        }
    }
}
