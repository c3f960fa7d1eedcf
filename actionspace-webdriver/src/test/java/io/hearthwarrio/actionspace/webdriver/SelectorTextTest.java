package io.hearthwarrio.actionspace.webdriver;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SelectorTextTest {

    @Test
    void xpathLiteralPicksAQuoteThatIsNotInTheValue() {
        assertEquals("'Sign in'", SelectorText.xpathLiteral("Sign in"));
        assertEquals("\"Don't\"", SelectorText.xpathLiteral("Don't"));
        assertEquals("''", SelectorText.xpathLiteral(null));
    }

    @Test
    void xpathLiteralWithBothQuotesUsesConcat() {
        assertEquals("concat('say \"it', \"'\", 's\"')", SelectorText.xpathLiteral("say \"it's\""));
    }

    @Test
    void cssLiteralsAreEscaped() {
        assertEquals("'O\\'Brien'", SelectorText.cssAttrLiteral("O'Brien"));
        assertEquals("'a\\\\b'", SelectorText.cssAttrLiteral("a\\b"));
        assertEquals("user\\.name", SelectorText.cssEscapeIdentifier("user.name"));
        assertEquals("\\31 abc", SelectorText.cssEscapeIdentifier("1abc"));
    }

    @Test
    void selectorKinds() {
        assertTrue(SelectorText.isXPath("/html[1]/body[1]"));
        assertTrue(SelectorText.isXPath("(//button)[2]"));
        assertFalse(SelectorText.isXPath("#login"));
        assertTrue(SelectorText.isRoleNotation("role=button[name=\"OK\"]"));
        assertTrue(SelectorText.isRoleNotation("text-context(depth=1, texts=[Red mug]) >> role=button[name=\"Add\"]"));
        assertFalse(SelectorText.isRoleNotation("html > body"));
    }

    @Test
    void normalizeTextCollapsesWhitespace() {
        assertEquals("Add to cart", SelectorText.normalizeText("  Add\n\t to   cart "));
        assertEquals("", SelectorText.normalizeText(null));
    }
}
