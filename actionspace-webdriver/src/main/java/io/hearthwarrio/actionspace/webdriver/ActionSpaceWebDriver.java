package io.hearthwarrio.actionspace.webdriver;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.InvalidActionException;
import io.hearthwarrio.actionspace.core.action.ActionRole;
import io.hearthwarrio.actionspace.core.action.ActionSpace;
import io.hearthwarrio.actionspace.core.action.ActionSpaceBuilder;
import io.hearthwarrio.actionspace.core.pipeline.AccessibilityTreePipeline;
import io.hearthwarrio.actionspace.core.pipeline.ProcessedTree;
import io.hearthwarrio.actionspace.core.pipeline.TreeKind;
import io.hearthwarrio.actionspace.core.processing.PruningConfig;
import io.hearthwarrio.actionspace.core.resolution.ResolutionConfig;
import io.hearthwarrio.actionspace.core.resolution.ResolutionResult;
import io.hearthwarrio.actionspace.core.resolution.ResolutionStrategies;
import io.hearthwarrio.actionspace.core.resolution.ResolutionStrategy;
import io.hearthwarrio.actionspace.core.resolution.SelectorResolver;
import io.hearthwarrio.actionspace.core.resolution.UniqueSelector;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.*;

/**
 * High-level entry point for Selenium WebDriver.
 * <p>
 * {@link #observe()} captures the accessibility tree of the current page and runs it through the
 * {@link AccessibilityTreePipeline}. Every later call ({@link #actionSpace()}, {@link #resolve(String)},
 * {@link #click(String)}, {@link #fill(String, CharSequence)}) works on that observation until the next
 * {@code observe()}; IDs are only meaningful for the observation that produced them.
 * <p>
 * Resolution runs on the raw tree of the observation, starting from the top document.
 * <p>
 * This class is not thread-safe and is expected to be used from a single test thread.
 */
public class ActionSpaceWebDriver {

    private final WebDriver driver;
    private final CdpAccessibilitySnapshotter snapshotter;
    private final WebDriverPageQuery page;

    private AccessibilityTreePipeline pipeline = new AccessibilityTreePipeline();
    private ResolutionConfig resolutionConfig = ResolutionConfig.DEFAULT;
    private List<ResolutionStrategy> strategies = ResolutionStrategies.defaults();

    /**
     * Mutable to support runtime overrides and DSL sugar.
     */
    private ResolvedSelectorLogger resolvedSelectorLogger;

    private boolean consistencyCheckEnabled = false;

    private ProcessedTree observation;
    private String observedTitle = "";

    public ActionSpaceWebDriver(WebDriver driver) {
        this(driver, null);
    }

    public ActionSpaceWebDriver(WebDriver driver, ResolvedSelectorLogger logger) {
        this(driver, new CdpAccessibilitySnapshotter(driver), new WebDriverPageQuery(driver), logger);
    }

    public ActionSpaceWebDriver(
            WebDriver driver,
            CdpAccessibilitySnapshotter snapshotter,
            WebDriverPageQuery page,
            ResolvedSelectorLogger logger
    ) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.snapshotter = Objects.requireNonNull(snapshotter, "snapshotter must not be null");
        this.page = Objects.requireNonNull(page, "page must not be null");
        this.resolvedSelectorLogger = logger;
    }

    // ----------- configuration (low-level) -----------

    public ActionSpaceWebDriver withPruningConfig(PruningConfig config) {
        this.pipeline = pipeline.withPruningConfig(Objects.requireNonNull(config, "config must not be null"));
        return this;
    }

    /**
     * Accepts names contained in one another when the observed trees are compared.
     */
    public ActionSpaceWebDriver withSoftConsistencyCheck(boolean soft) {
        this.pipeline = pipeline.withSoftConsistencyCheck(soft);
        return this;
    }

    public ActionSpaceWebDriver withResolutionConfig(ResolutionConfig config) {
        this.resolutionConfig = Objects.requireNonNull(config, "config must not be null");
        return this;
    }

    /**
     * Replaces the resolution strategies. They are ordered by {@link ResolutionStrategy#order()}.
     *
     * @throws IllegalArgumentException when no strategy is left
     */
    public ActionSpaceWebDriver withStrategies(List<? extends ResolutionStrategy> strategies) {
        List<ResolutionStrategy> normalized = ResolutionStrategies.normalize(strategies);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("At least one resolution strategy is required");
        }
        this.strategies = normalized;
        return this;
    }

    public ActionSpaceWebDriver withStrategies(ResolutionStrategy... strategies) {
        Objects.requireNonNull(strategies, "strategies must not be null");
        return withStrategies(Arrays.asList(strategies));
    }

    public ActionSpaceWebDriver withLogger(ResolvedSelectorLogger logger) {
        this.resolvedSelectorLogger = logger;
        return this;
    }

    public ActionSpaceWebDriver withLoggingToStdOut(SelectorLogDetail detail) {
        this.resolvedSelectorLogger = new StdOutResolvedSelectorLogger(detail);
        return this;
    }

    /**
     * When enabled, every CSS/XPath fallback selector of a resolved node must find the same element again.
     */
    public ActionSpaceWebDriver withConsistencyCheck(boolean enabled) {
        this.consistencyCheckEnabled = enabled;
        return this;
    }

    // ----------- configuration (sugar, minimal set) -----------

    public ActionSpaceWebDriver logSelectors() {
        return withLoggingToStdOut(SelectorLogDetail.ALL);
    }

    public ActionSpaceWebDriver disableSelectorLogging() {
        this.resolvedSelectorLogger = null;
        return this;
    }

    public ActionSpaceWebDriver checkSelectors() {
        this.consistencyCheckEnabled = true;
        return this;
    }

    public ActionSpaceWebDriver disableSelectorChecks() {
        this.consistencyCheckEnabled = false;
        return this;
    }

    public boolean isConsistencyCheckEnabled() {
        return consistencyCheckEnabled;
    }

    public List<ResolutionStrategy> getStrategies() {
        return strategies;
    }

    public WebDriver getDriver() {
        return driver;
    }

    // ----------- observation -----------

    /**
     * Captures the current page and replaces the previous observation.
     *
     * @throws io.hearthwarrio.actionspace.core.EmptyTreeException when pruning leaves nothing
     * @throws io.hearthwarrio.actionspace.core.StructuralInconsistencyException when the captured trees disagree
     */
    public ProcessedTree observe() {
        AccessibilitySnapshot snapshot = snapshotter.capture();
        this.observation = pipeline.process(snapshot.getRaw(), snapshot.getSimple());
        this.observedTitle = safe(driver.getTitle());
        return observation;
    }

    public Optional<ProcessedTree> lastObservation() {
        return Optional.ofNullable(observation);
    }

    /**
     * Actions of the last observation, described by the page title.
     */
    public ActionSpace actionSpace() {
        return ActionSpaceBuilder.build(requireObservation().processed(), observedTitle);
    }

    /**
     * Part of the last observation that holds interactions outside {@code knownIds}.
     */
    public Optional<AccessibilityNode> diff(Set<String> knownIds) {
        return ActionSpaceBuilder.diffUncovered(requireObservation().processed(), knownIds);
    }

    // ----------- resolution and interaction -----------

    /**
     * Resolves an action ID of the last observation to a single live element.
     * <p>
     * Failures are returned, not thrown; use {@link ResolutionResult#orElseThrow()} to demand a selector.
     *
     * @throws InvalidActionException when the last observation has no node with this ID
     * @throws SelectorConsistencyException when the consistency check is enabled and a fallback selector disagrees
     */
    public ResolutionResult resolve(String nodeId) {
        ProcessedTree tree = requireObservation();
        page.enterTopDocument();

        SelectorResolver resolver = new SelectorResolver(page, resolutionConfig, strategies);
        ResolutionResult result = resolver.resolve(nodeId, tree.toDomNode(TreeKind.RAW));

        ResolvedSelectorLogger logger = resolvedSelectorLogger;
        if (result.isResolved()) {
            UniqueSelector selector = result.getSelector().orElseThrow();
            if (logger != null) {
                List<AccessibilityNode> path = tree.requirePath(nodeId, TreeKind.RAW);
                AccessibilityNode node = path.get(path.size() - 1);
                logger.logResolvedSelector(nodeId, node.getRole().getValue(), node.getName(), selector);
            }
            if (consistencyCheckEnabled) {
                runConsistencyCheck(selector);
            }
        } else if (logger != null) {
            logger.logUnresolved(result.getFailure().orElseThrow());
        }
        return result;
    }

    /**
     * @throws io.hearthwarrio.actionspace.core.resolution.SelectorResolutionException when the ID cannot be resolved
     */
    public WebElement findElement(String nodeId) {
        UniqueSelector selector = resolve(nodeId).orElseThrow();
        return ((WebLocatorHandle) selector.getHandle()).requireElement();
    }

    public void click(String nodeId) {
        findElement(nodeId).click();
    }

    /**
     * Replaces the content of an input action ({@code I...}) with {@code text}.
     *
     * @throws InvalidActionException when {@code nodeId} is not an input action
     */
    public void fill(String nodeId, CharSequence text) {
        Objects.requireNonNull(text, "text must not be null");
        if (ActionRole.fromId(nodeId) != ActionRole.INPUT) {
            throw new InvalidActionException(nodeId, "only input actions accept text");
        }
        WebElement element = findElement(nodeId);
        element.clear();
        element.sendKeys(text);
    }

    // ----------- internals -----------

    private ProcessedTree requireObservation() {
        if (observation == null) {
            throw new IllegalStateException("Nothing observed yet: call observe() first");
        }
        return observation;
    }

    private void runConsistencyCheck(UniqueSelector selector) {
        if (selector.isInShadowRoot()) {
            // page-level CSS/XPath cannot reach into shadow trees
            return;
        }
        WebElement original = ((WebLocatorHandle) selector.getHandle()).requireElement();

        for (String s : selector.getSelectors()) {
            if (SelectorText.isRoleNotation(s)) {
                continue;
            }
            By by = SelectorText.isXPath(s) ? By.xpath(s) : By.cssSelector(s);
            List<WebElement> found = driver.findElements(by);
            if (found.isEmpty()) {
                throw new SelectorConsistencyException(
                        "Selector consistency check failed for " + selector.getNodeId() +
                                ". Re-resolving by '" + s + "' found nothing"
                );
            }
            boolean matchesOriginal = found.size() == 1 && original.equals(found.get(0));
            if (!matchesOriginal) {
                throw new SelectorConsistencyException(
                        "Selector consistency check failed for " + selector.getNodeId() +
                                ". Selector does not resolve to the element found by strategy '" +
                                selector.getStrategyId() + "': matches=" + found.size() + ", selector='" + s + '\''
                );
            }
        }
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
