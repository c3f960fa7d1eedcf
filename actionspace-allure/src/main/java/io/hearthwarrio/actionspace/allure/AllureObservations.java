package io.hearthwarrio.actionspace.allure;

import io.hearthwarrio.actionspace.core.action.ActionSpace;
import io.hearthwarrio.actionspace.core.action.ActionSpaceJson;
import io.hearthwarrio.actionspace.core.pipeline.ProcessedTree;
import io.hearthwarrio.actionspace.core.pipeline.TreeKind;
import io.qameta.allure.Allure;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Attaches an observation to the current Allure step: the processed tree as text, the action space as
 * markdown and as JSON.
 */
public final class AllureObservations {

    private AllureObservations() {
        // utility class
    }

    public static void attach(ProcessedTree observation, ActionSpace space) {
        Objects.requireNonNull(observation, "observation must not be null");
        Objects.requireNonNull(space, "space must not be null");

        Allure.step("ActionSpace: observed " + space.actions().size() + " action(s)", () -> {
            AllureResolvedSelectorLogger.attachText("Processed tree", observation.visualize(TreeKind.PROCESSED));
            Allure.addAttachment(
                    "Action space",
                    "text/markdown",
                    new ByteArrayInputStream(space.markdown().getBytes(StandardCharsets.UTF_8)),
                    ".md"
            );
            Allure.addAttachment(
                    "Action space JSON",
                    "application/json",
                    new ByteArrayInputStream(ActionSpaceJson.render(space).getBytes(StandardCharsets.UTF_8)),
                    ".json"
            );
        });
    }
}
