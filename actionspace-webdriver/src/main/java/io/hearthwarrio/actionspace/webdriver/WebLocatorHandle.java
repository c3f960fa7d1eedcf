package io.hearthwarrio.actionspace.webdriver;

import io.hearthwarrio.actionspace.core.resolution.LocatorHandle;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link LocatorHandle} backed by Selenium.
 * <p>
 * Element handles wrap a {@link WebElement}; scope handles (frame documents, shadow roots) only carry the
 * {@link SearchContext} to search in.
 */
public final class WebLocatorHandle implements LocatorHandle {

    private final SearchContext context;
    private final WebElement element;
    private final String label;

    private WebLocatorHandle(SearchContext context, WebElement element, String label) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.element = element;
        this.label = label == null ? "" : label;
    }

    public static WebLocatorHandle of(WebElement element) {
        return new WebLocatorHandle(Objects.requireNonNull(element, "element must not be null"), element, "");
    }

    public static WebLocatorHandle scope(SearchContext context, String label) {
        return new WebLocatorHandle(context, null, label);
    }

    /**
     * @return context to run nested queries in
     */
    public SearchContext getSearchContext() {
        return context;
    }

    public Optional<WebElement> getElement() {
        return Optional.ofNullable(element);
    }

    /**
     * @throws IllegalStateException when this is a scope handle
     */
    public WebElement requireElement() {
        if (element == null) {
            throw new IllegalStateException("Handle '" + label + "' is a search scope, not an element");
        }
        return element;
    }

    @Override
    public String describe() {
        if (element == null) {
            return "scope(" + label + ")";
        }
        try {
            String tag = element.getTagName();
            String name = SelectorText.normalizeText(element.getAccessibleName());
            return name.isEmpty() ? "<" + tag + ">" : "<" + tag + "> '" + name + "'";
        } catch (WebDriverException e) {
            // diagnostics only; a stale element is still worth naming
            return "element(" + e.getClass().getSimpleName() + ")";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WebLocatorHandle)) {
            return false;
        }
        WebLocatorHandle that = (WebLocatorHandle) o;
        if (element != null || that.element != null) {
            return Objects.equals(element, that.element);
        }
        return context.equals(that.context);
    }

    @Override
    public int hashCode() {
        return element != null ? element.hashCode() : context.hashCode();
    }

    @Override
    public String toString() {
        return describe();
    }
}
