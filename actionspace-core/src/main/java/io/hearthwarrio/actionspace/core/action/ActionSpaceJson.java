package io.hearthwarrio.actionspace.core.action;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hearthwarrio.actionspace.core.ActionSpaceException;

/**
 * JSON projection of an {@link ActionSpace}.
 */
public final class ActionSpaceJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ActionSpaceJson() {
    }

    public static ObjectNode toJson(ActionSpace space) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("description", space.getDescription());
        ArrayNode actions = root.putArray("actions");
        for (Action action : space.actions()) {
            ObjectNode a = actions.addObject();
            a.put("id", action.getId());
            a.put("role", action.getRole().getValue());
            a.put("category", action.getCategory());
            a.put("description", action.getDescription());
            a.put("status", action.getStatus().name().toLowerCase());
            ArrayNode params = a.putArray("parameters");
            for (ActionParameter p : action.getParameters()) {
                ObjectNode param = params.addObject();
                param.put("name", p.getName());
                param.put("type", p.getType());
                if (p.getDefaultValue() == null) {
                    param.putNull("default");
                } else {
                    param.put("default", p.getDefaultValue());
                }
                ArrayNode values = param.putArray("values");
                p.getValues().forEach(values::add);
            }
        }
        return root;
    }

    /**
     * @return pretty-printed JSON document
     */
    public static String render(ActionSpace space) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(space));
        } catch (JsonProcessingException e) {
            throw new ActionSpaceException("Failed to render action space as JSON", e);
        }
    }
}
