package io.hearthwarrio.actionspace.core.action;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.ids.IdAssigner;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ActionSpaceBuilderTest {

    private static AccessibilityNode page() {
        return IdAssigner.assignIds(AccessibilityNode.of("WebArea", "Checkout",
                AccessibilityNode.of("heading", "Your details"),
                AccessibilityNode.of("textbox", "Email"),
                AccessibilityNode.of("combobox", "Country",
                        AccessibilityNode.of("option", "France"),
                        AccessibilityNode.of("option", "Spain")),
                AccessibilityNode.of("form", "Payment",
                        AccessibilityNode.of("button", "Pay"),
                        AccessibilityNode.of("img", "card logos")),
                AccessibilityNode.of("link", "Back to cart")));
    }

    private static List<String> ids(List<Action> actions) {
        List<String> out = new ArrayList<>();
        for (Action action : actions) {
            out.add(action.getId());
        }
        return out;
    }

    @Test
    void listsInteractionNodesInPreOrder() {
        List<Action> actions = ActionSpaceBuilder.build(page());

        assertEquals(List.of("I1", "I2", "B1", "L1"), ids(actions));
        assertEquals("textbox 'Email'", actions.get(0).getDescription());
        assertEquals(ActionRole.BUTTON, actions.get(2).getRole());
        assertEquals(Action.INTERACTION_CATEGORY, actions.get(3).getCategory());
    }

    @Test
    void inputsTakeOneTextParameter() {
        List<Action> actions = ActionSpaceBuilder.build(page());

        assertEquals(List.of(ActionParameter.text()), actions.get(0).getParameters());
        assertEquals(List.of(ActionParameter.text()), actions.get(1).getParameters());
        assertTrue(actions.get(2).getParameters().isEmpty());
        assertTrue(actions.get(3).getParameters().isEmpty());
    }

    @Test
    void buildsValidatedSpace() {
        ActionSpace space = ActionSpaceBuilder.build(page(), "Checkout page");

        assertEquals("Checkout page", space.getDescription());
        assertEquals(Set.of("I1", "I2", "B1", "L1"), space.ids());
    }

    @Test
    void diffWithoutKnownIdsCoversEveryInteraction() {
        AccessibilityNode tree = page();

        AccessibilityNode uncovered = ActionSpaceBuilder.diffUncovered(tree, Set.of()).orElseThrow();

        assertEquals(ids(ActionSpaceBuilder.build(tree)), ids(ActionSpaceBuilder.build(uncovered)));
    }

    @Test
    void diffWithAllIdsKnownIsEmpty() {
        AccessibilityNode tree = page();
        Set<String> all = new HashSet<>();
        for (AccessibilityNode node : tree.flatten(n -> n.getId() != null)) {
            all.add(node.getId());
        }

        assertEquals(Optional.empty(), ActionSpaceBuilder.diffUncovered(tree, all));
    }

    @Test
    void diffKeepsOnlyUnknownPartWithItsAncestors() {
        AccessibilityNode tree = page();

        AccessibilityNode uncovered = ActionSpaceBuilder.diffUncovered(tree,
                Set.of("I1", "I2", "O1", "O2", "L1", "F1")).orElseThrow();

        assertEquals(List.of("B1"), ids(ActionSpaceBuilder.build(uncovered)));
        assertTrue(uncovered.find("I1").isEmpty());
        assertEquals("form", uncovered.getChildren().get(0).getRole().getValue());
    }

    @Test
    void mergeKeepsKnownActionsStillOnPage() {
        AccessibilityNode current = page();
        Action oldPay = new Action("B1", "button 'Pay now'", Action.INTERACTION_CATEGORY, List.of());
        Action gone = new Action("B7", "button 'Apply coupon'", Action.INTERACTION_CATEGORY, List.of());
        Action email = new Action("I1", "textbox 'Email'", Action.INTERACTION_CATEGORY, List.of(ActionParameter.text()));
        Action pay = new Action("B1", "button 'Pay'", Action.INTERACTION_CATEGORY, List.of());
        Action back = new Action("L1", "link 'Back to cart'", Action.INTERACTION_CATEGORY, List.of());

        List<Action> merged = ActionSpaceBuilder.merge(List.of(oldPay, gone, email), List.of(pay, back), current);

        assertEquals(List.of(pay, back, email), merged);
    }
}
