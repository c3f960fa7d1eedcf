package io.hearthwarrio.actionspace.webdriver;

import io.hearthwarrio.actionspace.core.resolution.ResolutionFailure;
import io.hearthwarrio.actionspace.core.resolution.StrategyOutcome;
import io.hearthwarrio.actionspace.core.resolution.UniqueSelector;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class StdOutResolvedSelectorLoggerTest {

    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);

    private static UniqueSelector okInDialog() {
        return new UniqueSelector(
                "B2",
                "ancestor-path",
                List.of("role=dialog[name=\"Delete\"] >> role=button[name=\"OK\"]", "#confirm-delete"),
                List.of("iframe#modal"),
                false,
                () -> "<button> 'OK'"
        );
    }

    private String printed() {
        return bytes.toString(StandardCharsets.UTF_8).trim();
    }

    @Test
    void noneLogsOnlyTheNode() {
        new StdOutResolvedSelectorLogger(SelectorLogDetail.NONE, out)
                .logResolvedSelector("B2", "button", "OK", okInDialog());

        assertEquals("[ActionSpace] id=B2, role=button, name='OK'", printed());
    }

    @Test
    void primaryOnlyAddsStrategyAndFirstSelector() {
        new StdOutResolvedSelectorLogger(SelectorLogDetail.PRIMARY_ONLY, out)
                .logResolvedSelector("B2", "button", "OK", okInDialog());

        assertEquals(
                "[ActionSpace] id=B2, role=button, name='OK', strategy=ancestor-path, " +
                        "selector=role=dialog[name=\"Delete\"] >> role=button[name=\"OK\"]",
                printed()
        );
    }

    @Test
    void allListsEverySelectorAndTheFramePath() {
        new StdOutResolvedSelectorLogger(SelectorLogDetail.ALL, out)
                .logResolvedSelector("B2", "button", "OK", okInDialog());

        String line = printed();
        assertTrue(line.contains("#confirm-delete"), line);
        assertTrue(line.endsWith("iframes=[iframe#modal]"), line);
        assertFalse(line.contains("shadow"), line);
    }

    @Test
    void unresolvedNodesPrintTheReport() {
        Map<String, StrategyOutcome> attempts = new LinkedHashMap<>();
        attempts.put("direct", StrategyOutcome.notApplicable("test"));
        ResolutionFailure failure = new ResolutionFailure("B3", "button", "Delete", "no strategy found a unique element", attempts);

        new StdOutResolvedSelectorLogger(SelectorLogDetail.ALL, out).logUnresolved(failure);

        String text = printed();
        assertTrue(text.startsWith("[ActionSpace] Could not resolve B3 (role 'button', name 'Delete')"), text);
        assertTrue(text.contains("direct -> "), text);
    }

    @Test
    void detailIsRequired() {
        assertThrows(NullPointerException.class, () -> new StdOutResolvedSelectorLogger(null));
    }
}
