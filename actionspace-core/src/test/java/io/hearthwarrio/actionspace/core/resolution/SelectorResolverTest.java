package io.hearthwarrio.actionspace.core.resolution;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.ComputedAttributes;
import io.hearthwarrio.actionspace.core.DomAttributes;
import io.hearthwarrio.actionspace.core.DomNode;
import io.hearthwarrio.actionspace.core.InvalidActionException;
import io.hearthwarrio.actionspace.core.NodeFlags;
import io.hearthwarrio.actionspace.core.Role;
import io.hearthwarrio.actionspace.core.ids.IdAssigner;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.hearthwarrio.actionspace.core.resolution.FakePage.el;
import static org.junit.jupiter.api.Assertions.*;

public class SelectorResolverTest {

    private static AccessibilityNode labeled(AccessibilityNode... children) {
        return IdAssigner.assignIds(AccessibilityNode.of("WebArea", "", children));
    }

    @Test
    void resolvesUniqueNodeDirectly() {
        FakePage.Element signIn = el("button", "Sign in").css("#sign-in");
        FakePage page = new FakePage(signIn, el("link", "Help"));
        AccessibilityNode tree = labeled(
                AccessibilityNode.of("button", "Sign in"),
                AccessibilityNode.of("link", "Help"));

        UniqueSelector selector = new SelectorResolver(page).resolve("B1", tree).orElseThrow();

        assertSame(signIn, selector.getHandle());
        assertEquals("direct-role-name", selector.getStrategyId());
        assertEquals(List.of("role=button[name=\"Sign in\" i]", "#sign-in"), selector.getSelectors());
        assertEquals("role=button[name=\"Sign in\" i]", selector.getPrimarySelector());
        assertFalse(selector.isInShadowRoot());
    }

    @Test
    void separatesSameNamedButtonsByAncestors() {
        FakePage.Element deleteOk = el("button", "OK");
        FakePage.Element renameOk = el("button", "OK");
        FakePage page = new FakePage(
                el("dialog", "Delete", deleteOk),
                el("dialog", "Rename", renameOk));
        AccessibilityNode tree = labeled(
                AccessibilityNode.of("dialog", "Delete", AccessibilityNode.of("button", "OK")),
                AccessibilityNode.of("dialog", "Rename", AccessibilityNode.of("button", "OK")));
        SelectorResolver resolver = new SelectorResolver(page);

        UniqueSelector first = resolver.resolve("B1", tree).orElseThrow();
        UniqueSelector second = resolver.resolve("B2", tree).orElseThrow();

        assertSame(deleteOk, first.getHandle());
        assertSame(renameOk, second.getHandle());
        assertNotSame(first.getHandle(), second.getHandle());
        assertEquals("ancestor-path", first.getStrategyId());
        assertEquals("role=dialog[name=\"Delete\"] >> role=button[name=\"OK\"]", first.getPrimarySelector());
    }

    @Test
    void takesFirstOfInterchangeableLinks() {
        FakePage.Element top = el("link", "Home").attr("href", "https://shop.test/#");
        FakePage.Element bottom = el("link", "Home").attr("href", "/");
        FakePage page = new FakePage("https://shop.test/cart",
                el("navigation", "Top", top),
                el("contentinfo", "Footer", bottom));
        AccessibilityNode tree = labeled(
                AccessibilityNode.of("navigation", "Top", AccessibilityNode.of("link", "Home")),
                AccessibilityNode.of("contentinfo", "Footer", AccessibilityNode.of("link", "Home")));
        SelectorResolver resolver = new SelectorResolver(page);

        UniqueSelector second = resolver.resolve("L2", tree).orElseThrow();

        assertEquals("link-href", second.getStrategyId());
        assertSame(top, second.getHandle());
        assertEquals("role=link[name=\"Home\" i] >> nth=0", second.getPrimarySelector());
    }

    @Test
    void linkWithoutHrefIsNotInterchangeable() {
        FakePage.Element top = el("link", "Home").attr("href", "/a");
        FakePage.Element bottom = el("link", "Home");
        FakePage page = new FakePage(
                el("navigation", "Top", top),
                el("contentinfo", "Footer", bottom));
        AccessibilityNode tree = labeled(
                AccessibilityNode.of("navigation", "Top", AccessibilityNode.of("link", "Home")),
                AccessibilityNode.of("contentinfo", "Footer", AccessibilityNode.of("link", "Home")));

        UniqueSelector selector = new SelectorResolver(page).resolve("L2", tree).orElseThrow();

        assertEquals("ancestor-path", selector.getStrategyId());
        assertSame(bottom, selector.getHandle());
    }

    @Test
    void linksToDifferentPlacesFallBackToAncestors() {
        FakePage.Element top = el("link", "Home").attr("href", "/a");
        FakePage.Element bottom = el("link", "Home").attr("href", "/b");
        FakePage page = new FakePage(
                el("navigation", "Top", top),
                el("contentinfo", "Footer", bottom));
        AccessibilityNode tree = labeled(
                AccessibilityNode.of("navigation", "Top", AccessibilityNode.of("link", "Home")),
                AccessibilityNode.of("contentinfo", "Footer", AccessibilityNode.of("link", "Home")));

        UniqueSelector selector = new SelectorResolver(page).resolve("L2", tree).orElseThrow();

        assertEquals("ancestor-path", selector.getStrategyId());
        assertSame(bottom, selector.getHandle());
    }

    @Test
    void separatesRepeatedButtonsBySurroundingText() {
        FakePage.Element blue = el("button", "Add to cart");
        FakePage.Element red = el("button", "Add to cart");
        FakePage page = new FakePage(el("list", "",
                el("listitem", "", el("heading", "Blue mug"), blue),
                el("listitem", "", el("heading", "Red mug"), red)));
        AccessibilityNode tree = labeled(AccessibilityNode.of("list", "",
                AccessibilityNode.of("listitem", "",
                        AccessibilityNode.of("heading", "Blue mug"),
                        AccessibilityNode.of("button", "Add to cart")),
                AccessibilityNode.of("listitem", "",
                        AccessibilityNode.of("heading", "Red mug"),
                        AccessibilityNode.of("button", "Add to cart"))));
        SelectorResolver resolver = new SelectorResolver(page);

        UniqueSelector blueSelector = resolver.resolve("B1", tree).orElseThrow();
        UniqueSelector redSelector = resolver.resolve("B2", tree).orElseThrow();

        assertEquals("text-context", blueSelector.getStrategyId());
        assertSame(blue, blueSelector.getHandle());
        assertSame(red, redSelector.getHandle());
        assertEquals("text-context(depth=1, texts=[Red mug]) >> role=button[name=\"Add to cart\"]",
                redSelector.getPrimarySelector());
    }

    @Test
    void reportsEveryStrategyWhenNothingMatches() {
        FakePage page = new FakePage(el("link", "Help"));
        AccessibilityNode tree = labeled(AccessibilityNode.of("button", "Checkout"));

        ResolutionResult result = new SelectorResolver(page).resolve("B1", tree);

        assertFalse(result.isResolved());
        ResolutionFailure failure = result.getFailure().orElseThrow();
        assertEquals("no strategy found a unique element", failure.getReason());
        assertEquals(List.of("direct-role-name", "link-href", "ancestor-path", "text-context"),
                List.copyOf(failure.getAttempts().keySet()));
        assertEquals(StrategyOutcome.Kind.NO_MATCH, failure.getAttempts().get("direct-role-name").getKind());
        assertEquals(StrategyOutcome.Kind.NOT_APPLICABLE, failure.getAttempts().get("link-href").getKind());

        SelectorResolutionException e = assertThrows(SelectorResolutionException.class, result::orElseThrow);
        assertTrue(e.getMessage().startsWith("Could not resolve B1 (role 'button', name 'Checkout')"));
        assertSame(failure, e.getFailure());
    }

    @Test
    void onlyFirstStrategyRunsWithoutConflictResolution() {
        FakePage page = new FakePage(
                el("dialog", "Delete", el("button", "OK")),
                el("dialog", "Rename", el("button", "OK")));
        AccessibilityNode tree = labeled(
                AccessibilityNode.of("dialog", "Delete", AccessibilityNode.of("button", "OK")),
                AccessibilityNode.of("dialog", "Rename", AccessibilityNode.of("button", "OK")));
        SelectorResolver resolver = new SelectorResolver(page, ResolutionConfig.DEFAULT.withConflictResolution(false));

        ResolutionFailure failure = resolver.resolve("B1", tree).getFailure().orElseThrow();

        assertEquals("conflict resolution is disabled", failure.getReason());
        assertEquals(List.of("direct-role-name"), List.copyOf(failure.getAttempts().keySet()));
        assertEquals(2, failure.getAttempts().get("direct-role-name").getCount());
    }

    @Test
    void doesNotLocateImagesOrText() {
        FakePage page = new FakePage(el("img", "logo"));
        AccessibilityNode tree = labeled(AccessibilityNode.of("img", "logo"));

        ResolutionResult result = new SelectorResolver(page).resolve("F1", tree);

        ResolutionFailure failure = result.getFailure().orElseThrow();
        assertEquals("role 'img' is not locatable", failure.getReason());
        assertTrue(failure.getAttempts().isEmpty());
        assertTrue(page.queries.isEmpty());
    }

    @Test
    void rejectsUnknownId() {
        FakePage page = new FakePage(el("button", "OK"));
        AccessibilityNode tree = labeled(AccessibilityNode.of("button", "OK"));

        InvalidActionException e = assertThrows(InvalidActionException.class,
                () -> new SelectorResolver(page).resolve("B9", tree));
        assertEquals("B9", e.getActionId());
    }

    @Test
    void searchesInsideIframe() {
        FakePage.Element inner = el("button", "Pay");
        FakePage page = new FakePage(
                el("button", "Pay"),
                el("Iframe", "", inner).css("iframe#checkout"));
        DomNode framed = new DomNode("B2", Role.of("button"), "Pay", List.of(), NodeFlags.NONE, DomAttributes.EMPTY,
                new ComputedAttributes(List.of("#pay-now"), false, List.of("iframe#checkout"), List.of()));
        DomNode root = new DomNode(null, Role.of("WebArea"), "", List.of(
                new DomNode("B1", Role.of("button"), "Pay", List.of(), NodeFlags.NONE, null, null),
                new DomNode(null, Role.of("Iframe"), "", List.of(framed), NodeFlags.NONE, null, null)
        ), NodeFlags.NONE, null, null);

        UniqueSelector selector = new SelectorResolver(page).resolve("B2", root).orElseThrow();

        assertSame(inner, selector.getHandle());
        assertEquals(List.of("role=button[name=\"Pay\" i]", "#pay-now"), selector.getSelectors());
        assertEquals(List.of("iframe#checkout"), selector.getIframePath());
        assertEquals(List.of(List.of(SelectorSegment.iframe("iframe#checkout"))), page.scopedResolutions);
    }

    @Test
    void keepsOnlyAncestorsInsideTheSameShadowTree() {
        ComputedAttributes inWidget = ComputedAttributes.scopedTo(List.of(), List.of("my-widget#card"));
        DomNode card = new DomNode(null, Role.of("region"), "Card", List.of(), NodeFlags.NONE, null, inWidget);
        DomNode page = new DomNode(null, Role.of("main"), "Shop", List.of(), NodeFlags.NONE, null, null);

        List<DomNode> kept = SelectorResolver.ancestorsInScope(List.of(card, page), inWidget);

        assertEquals(List.of(card), kept);
        assertEquals(List.of(page), SelectorResolver.ancestorsInScope(List.of(card, page), ComputedAttributes.EMPTY));
    }

    @Test
    void queriesSelectedStateWhenSet() {
        FakePage.Element active = el("tab", "Billing").selected();
        FakePage page = new FakePage(el("tab", "Billing"), active);
        AccessibilityNode tree = labeled(
                AccessibilityNode.of("tab", "Billing"),
                AccessibilityNode.builder("tab", "Billing")
                        .flags(NodeFlags.builder().selected(true).build())
                        .build());

        UniqueSelector selector = new SelectorResolver(page).resolve("B2", tree).orElseThrow();

        assertSame(active, selector.getHandle());
        assertEquals("role=tab[name=\"Billing\" i][selected=true]", selector.getPrimarySelector());
    }

    @Test
    void requiresAtLeastOneStrategy() {
        FakePage page = new FakePage();

        assertThrows(IllegalArgumentException.class,
                () -> new SelectorResolver(page, ResolutionConfig.DEFAULT, List.of()));
    }
}
