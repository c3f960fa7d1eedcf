package io.hearthwarrio.actionspace.webdriver;

import io.hearthwarrio.actionspace.core.resolution.LocatorHandle;
import io.hearthwarrio.actionspace.core.resolution.PageQueryCapability;
import io.hearthwarrio.actionspace.core.resolution.RoleQuery;
import io.hearthwarrio.actionspace.core.resolution.SelectorSegment;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.UnsupportedCommandException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.*;

/**
 * {@link PageQueryCapability} over a Selenium {@link WebDriver}.
 * <p>
 * Role queries select candidates with {@link AriaRoleSelectors} and then compare the browser-computed role and
 * accessible name. Entering an iframe switches the driver into it; call {@link #enterTopDocument()} before the
 * next unscoped query.
 * <p>
 * This class is not thread-safe and is expected to be used from a single test thread.
 */
public class WebDriverPageQuery implements PageQueryCapability {

    /**
     * Default whitelist of "test/qa" attributes tried when describing fallback selectors.
     * <p>
     * The order matters: the first present attribute wins.
     */
    public static final List<String> DEFAULT_TEST_ATTRIBUTE_WHITELIST = Collections.unmodifiableList(Arrays.asList(
            "data-testid",
            "data-test-id",
            "data-test",
            "data-qa",
            "data-cy",
            "data-automation-id",
            "data-automation"
    ));

    private static final String EDITABLE_SCRIPT =
            "const e = arguments[0];" +
            "if (e.isContentEditable) { return true; }" +
            "const t = e.tagName.toLowerCase();" +
            "if (t !== 'input' && t !== 'textarea' && t !== 'select') { return false; }" +
            "return !e.disabled && !e.readOnly;";

    private static final String CLIMB_SCRIPT =
            "let e = arguments[0];" +
            "for (let i = 0; i < arguments[1]; i++) {" +
            "  if (!e) { return null; }" +
            "  e = e.parentElement || (e.parentNode && e.parentNode.host) || null;" +
            "}" +
            "return e;";

    private static final String TEXT_SCRIPT = "return arguments[0].textContent;";

    private static final String PATH_SCRIPT =
            "const el = arguments[0];" +
            "function cssPath(e) {" +
            "  const parts = [];" +
            "  while (e && e.nodeType === 1) {" +
            "    const tag = e.tagName.toLowerCase();" +
            "    const parent = e.parentElement;" +
            "    if (!parent) { parts.unshift(tag); break; }" +
            "    const same = Array.from(parent.children).filter(c => c.tagName === e.tagName);" +
            "    parts.unshift(same.length > 1 ? tag + ':nth-of-type(' + (same.indexOf(e) + 1) + ')' : tag);" +
            "    e = parent;" +
            "  }" +
            "  return parts.join(' > ');" +
            "}" +
            "function xPath(e) {" +
            "  const parts = [];" +
            "  while (e && e.nodeType === 1) {" +
            "    let index = 1;" +
            "    for (let s = e.previousElementSibling; s; s = s.previousElementSibling) {" +
            "      if (s.tagName === e.tagName) { index++; }" +
            "    }" +
            "    parts.unshift(e.tagName.toLowerCase() + '[' + index + ']');" +
            "    e = e.parentElement;" +
            "  }" +
            "  return '/' + parts.join('/');" +
            "}" +
            "return [cssPath(el), xPath(el)];";

    private final WebDriver driver;
    private final JavascriptExecutor js;
    private final List<String> testAttributeWhitelist;

    public WebDriverPageQuery(WebDriver driver) {
        this(driver, DEFAULT_TEST_ATTRIBUTE_WHITELIST);
    }

    /**
     * @param driver                 Selenium WebDriver instance, must also be a {@link JavascriptExecutor}
     * @param testAttributeWhitelist attribute names tried for fallback selectors; empty disables them
     */
    public WebDriverPageQuery(WebDriver driver, List<String> testAttributeWhitelist) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        if (!(driver instanceof JavascriptExecutor)) {
            throw new IllegalArgumentException("driver must implement JavascriptExecutor: " + driver.getClass().getName());
        }
        this.js = (JavascriptExecutor) driver;
        this.testAttributeWhitelist = List.copyOf(Objects.requireNonNull(
                testAttributeWhitelist,
                "testAttributeWhitelist must not be null"
        ));
    }

    /**
     * Leaves any iframe entered by {@link #resolveThroughShadowOrIframe(List)}.
     */
    public void enterTopDocument() {
        driver.switchTo().defaultContent();
    }

    @Override
    public String currentUrl() {
        return driver.getCurrentUrl();
    }

    @Override
    public List<LocatorHandle> locate(LocatorHandle scope, List<RoleQuery> path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("path must not be empty");
        }

        List<SearchContext> contexts = new ArrayList<>();
        contexts.add(scope == null ? driver : handle(scope).getSearchContext());

        List<WebElement> matches = List.of();
        for (RoleQuery query : path) {
            By by = By.cssSelector(AriaRoleSelectors.css(query.getRole()));
            Set<WebElement> found = new LinkedHashSet<>();
            for (SearchContext context : contexts) {
                for (WebElement element : context.findElements(by)) {
                    if (matches(element, query)) {
                        found.add(element);
                    }
                }
            }
            matches = new ArrayList<>(found);
            contexts = new ArrayList<>(matches);
        }

        List<LocatorHandle> out = new ArrayList<>(matches.size());
        for (WebElement element : matches) {
            out.add(WebLocatorHandle.of(element));
        }
        return out;
    }

    @Override
    public Optional<String> getAttribute(LocatorHandle handle, String name) {
        return Optional.ofNullable(element(handle).getDomAttribute(name));
    }

    @Override
    public boolean isEditable(LocatorHandle handle) {
        return Boolean.TRUE.equals(js.executeScript(EDITABLE_SCRIPT, element(handle)));
    }

    @Override
    public boolean isEnabled(LocatorHandle handle) {
        return element(handle).isEnabled();
    }

    @Override
    public boolean isVisible(LocatorHandle handle) {
        return element(handle).isDisplayed();
    }

    @Override
    public Optional<LocatorHandle> climbAncestor(LocatorHandle handle, int levels) {
        if (levels < 1) {
            throw new IllegalArgumentException("levels must be >= 1, got " + levels);
        }
        Object result = js.executeScript(CLIMB_SCRIPT, element(handle), levels);
        if (result instanceof WebElement) {
            return Optional.of(WebLocatorHandle.of((WebElement) result));
        }
        return Optional.empty();
    }

    @Override
    public List<LocatorHandle> filterContainsText(List<LocatorHandle> handles, String text) {
        String needle = SelectorText.normalizeText(text);
        List<LocatorHandle> out = new ArrayList<>();
        for (LocatorHandle h : handles) {
            Object content = js.executeScript(TEXT_SCRIPT, element(h));
            String haystack = SelectorText.normalizeText(content == null ? "" : content.toString());
            if (haystack.contains(needle)) {
                out.add(h);
            }
        }
        return out;
    }

    @Override
    public LocatorHandle resolveThroughShadowOrIframe(List<SelectorSegment> segments) {
        SearchContext context = driver;
        StringBuilder label = new StringBuilder();
        for (SelectorSegment segment : segments) {
            WebElement host = context.findElement(By.cssSelector(segment.getSelector()));
            switch (segment.getKind()) {
                case IFRAME:
                    driver.switchTo().frame(host);
                    context = driver;
                    break;
                case SHADOW_HOST:
                    context = host.getShadowRoot();
                    break;
                default:
                    throw new IllegalStateException("Unknown segment kind: " + segment.getKind());
            }
            if (label.length() > 0) {
                label.append(" >> ");
            }
            label.append(segment);
        }
        return WebLocatorHandle.scope(context, label.toString());
    }

    /**
     * Unique id / test attribute / name selectors when the page has them, otherwise positional CSS and XPath
     * computed in the page.
     */
    @Override
    public List<String> describeSelectors(LocatorHandle handle) {
        Optional<WebElement> maybeElement = handle(handle).getElement();
        if (maybeElement.isEmpty()) {
            return List.of();
        }
        WebElement element = maybeElement.get();
        String tag = element.getTagName().toLowerCase(Locale.ROOT);

        String id = safe(element.getDomAttribute("id"));
        if (!id.isBlank()) {
            String css = "#" + SelectorText.cssEscapeIdentifier(id);
            if (isUnique(By.cssSelector(css))) {
                return List.of(css, "//*[@id=" + SelectorText.xpathLiteral(id) + "]");
            }
        }

        for (String attr : testAttributeWhitelist) {
            String value = safe(element.getDomAttribute(attr));
            if (value.isBlank()) {
                continue;
            }
            String css = tag + "[" + attr + "=" + SelectorText.cssAttrLiteral(value) + "]";
            if (isUnique(By.cssSelector(css))) {
                return List.of(css, "//" + tag + "[@" + attr + "=" + SelectorText.xpathLiteral(value) + "]");
            }
            // first present attribute wins
            break;
        }

        String name = safe(element.getDomAttribute("name"));
        if (!name.isBlank()) {
            String css = tag + "[name=" + SelectorText.cssAttrLiteral(name) + "]";
            if (isUnique(By.cssSelector(css))) {
                return List.of(css, "//" + tag + "[@name=" + SelectorText.xpathLiteral(name) + "]");
            }
        }

        Object paths = js.executeScript(PATH_SCRIPT, element);
        List<String> out = new ArrayList<>();
        if (paths instanceof List) {
            for (Object p : (List<?>) paths) {
                if (p != null && !p.toString().isBlank()) {
                    out.add(p.toString());
                }
            }
        }
        return out;
    }

    private boolean matches(WebElement element, RoleQuery query) {
        String role = computedRole(element);
        if (!query.getRole().equalsIgnoreCase(role)) {
            return false;
        }
        boolean selected = query.getSelected() != null && isSelected(element);
        boolean checked = query.getChecked() != null && isChecked(element);
        return query.matches(role, accessibleName(element), selected, checked);
    }

    private String computedRole(WebElement element) {
        String role;
        try {
            role = element.getAriaRole();
        } catch (UnsupportedCommandException e) {
            role = null;
        }
        if (role == null || role.isBlank() || "none".equals(role)) {
            role = element.getDomAttribute("role");
        }
        return safe(role).trim();
    }

    private String accessibleName(WebElement element) {
        try {
            return SelectorText.normalizeText(element.getAccessibleName());
        } catch (UnsupportedCommandException e) {
            String aria = safe(element.getDomAttribute("aria-label"));
            return SelectorText.normalizeText(aria.isBlank() ? element.getText() : aria);
        }
    }

    private boolean isSelected(WebElement element) {
        if ("true".equals(element.getDomAttribute("aria-selected"))) {
            return true;
        }
        return "option".equalsIgnoreCase(element.getTagName()) && element.isSelected();
    }

    private boolean isChecked(WebElement element) {
        if ("true".equals(element.getDomAttribute("aria-checked"))) {
            return true;
        }
        return "input".equalsIgnoreCase(element.getTagName()) && element.isSelected();
    }

    private boolean isUnique(By by) {
        try {
            return driver.findElements(by).size() == 1;
        } catch (RuntimeException e) {
            // invalid selector or driver quirks: just treat as non-unique
            return false;
        }
    }

    private static WebLocatorHandle handle(LocatorHandle handle) {
        Objects.requireNonNull(handle, "handle must not be null");
        if (!(handle instanceof WebLocatorHandle)) {
            throw new IllegalArgumentException("Foreign handle: " + handle.describe());
        }
        return (WebLocatorHandle) handle;
    }

    private static WebElement element(LocatorHandle handle) {
        return handle(handle).requireElement();
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
