package io.hearthwarrio.actionspace.core.action;

import io.hearthwarrio.actionspace.core.EligibilityViolationException;
import io.hearthwarrio.actionspace.core.InvalidActionException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ActionSpaceTest {

    private static Action action(String id, String description) {
        List<ActionParameter> params = id.startsWith("I") ? List.of(ActionParameter.text()) : List.of();
        return new Action(id, description, Action.INTERACTION_CATEGORY, params);
    }

    @Test
    void rendersMarkdownSortedById() {
        ActionSpace space = new ActionSpace("Login", List.of(
                action("L1", "link 'Help'"),
                action("I1", "textbox 'Email'"),
                action("B2", "button 'Save'")));

        assertEquals("# Interaction action\n"
                + "* B2: button 'Save'\n"
                + "* I1: textbox 'Email' (param: string)\n"
                + "* L1: link 'Help'", space.markdown());
    }

    @Test
    void sortsIdsAsText() {
        ActionSpace space = new ActionSpace("", List.of(action("B2", "button 'b'"), action("B10", "button 'a'")));

        assertEquals("# Interaction action\n* B10: button 'a'\n* B2: button 'b'", space.markdown());
    }

    @Test
    void groupsByCategoryInOrderOfAppearance() {
        ActionSpace space = new ActionSpace("", List.of(
                new Action("L2", "link 'Blog'", "Navigation", List.of()),
                action("B1", "button 'Search'"),
                new Action("L1", "link 'Home'", "Navigation", List.of())));

        assertEquals("# Navigation\n"
                + "* L1: link 'Home'\n"
                + "* L2: link 'Blog'\n"
                + "\n"
                + "# Interaction action\n"
                + "* B1: button 'Search'", space.markdown());
    }

    @Test
    void markdownListsOnlyRequestedStatus() {
        ActionSpace space = new ActionSpace("", List.of(action("B1", "button 'OK'"), action("B2", "button 'Cancel'")))
                .withStatus("B2", ActionStatus.FAILED);

        assertEquals("# Interaction action\n* B1: button 'OK'", space.markdown());
        assertEquals("# Interaction action\n* B2: button 'Cancel'", space.markdown(ActionStatus.FAILED));
        assertEquals("", space.markdown(ActionStatus.EXCLUDED));
    }

    @Test
    void withStatusCopies() {
        ActionSpace space = new ActionSpace("", List.of(action("B1", "button 'OK'")));

        ActionSpace excluded = space.withStatus("B1", ActionStatus.EXCLUDED);

        assertEquals(ActionStatus.VALID, space.find("B1").orElseThrow().getStatus());
        assertEquals(ActionStatus.EXCLUDED, excluded.find("B1").orElseThrow().getStatus());
        assertThrows(InvalidActionException.class, () -> space.withStatus("B9", ActionStatus.FAILED));
    }

    @Test
    void filtersByStatusAndRole() {
        ActionSpace space = new ActionSpace("", List.of(
                action("B1", "button 'OK'"),
                action("L1", "link 'Help'"),
                action("O1", "option 'France'")));

        assertEquals(1, space.actions(ActionStatus.VALID, ActionRole.LINK).size());
        assertEquals(ActionRole.OPTION, space.actions(ActionStatus.VALID, ActionRole.OPTION).get(0).getRole());
        assertTrue(space.actions(ActionStatus.FAILED).isEmpty());
    }

    @Test
    void rejectsUnknownPrefix() {
        InvalidActionException e = assertThrows(InvalidActionException.class,
                () -> new ActionSpace("", List.of(new Action("F1", "img 'logo'", Action.INTERACTION_CATEGORY, List.of()))));

        assertEquals("F1", e.getActionId());
    }

    @Test
    void rejectsMissingDescription() {
        assertThrows(InvalidActionException.class,
                () -> new ActionSpace("", List.of(new Action("B1", "", Action.INTERACTION_CATEGORY, List.of()))));
    }

    @Test
    void rejectsDuplicateIds() {
        InvalidActionException e = assertThrows(InvalidActionException.class,
                () -> new ActionSpace("", List.of(action("B1", "button 'a'"), action("B1", "button 'b'"))));

        assertTrue(e.getMessage().contains("listed twice"));
    }

    @Test
    void inputActionNeedsExactlyOneParameter() {
        assertThrows(EligibilityViolationException.class,
                () -> new Action("I1", "textbox 'Email'", Action.INTERACTION_CATEGORY, List.of()));
        assertThrows(EligibilityViolationException.class,
                () -> new Action("I1", "textbox 'Email'", Action.INTERACTION_CATEGORY,
                        List.of(ActionParameter.text(), ActionParameter.text())));
    }

    @Test
    void describesRestrictedParameters() {
        ActionParameter size = new ActionParameter("size", "enum", "M", List.of("S", "M", "L"));
        Action pick = new Action("I3", "combobox 'Size'", Action.INTERACTION_CATEGORY, List.of(size));

        assertEquals("* I3: combobox 'Size' (size: enum = [S, M, L])", pick.markdownLine());
    }
}
