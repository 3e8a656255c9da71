package io.reqbind.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.reqbind.core.model.Outcome;

/**
 * Renders an {@link Outcome} as the JSON body of the HTTP answer:
 *
 * <ul>
 *   <li>400 / 422: {@code {"code", "message", "errors": [{"field", "message", "value"?}]}}
 *   <li>valid: {@code {"status": "valid", "data": {...}}}, data keyed by wire name
 * </ul>
 */
public final class ResponseRenderer {

    public static final String INTERNAL_ERROR = "Internal server error";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ResponseRenderer() {
        // utility class
    }

    public static ObjectNode render(Outcome outcome) {
        if (outcome.isValid()) {
            ObjectNode node = MAPPER.createObjectNode();
            node.put("status", "valid");
            node.set("data", outcome.record().toJson());
            return node;
        }
        return MAPPER.valueToTree(outcome.errorResponse());
    }

    /** Renders the outcome as a JSON string. */
    public static String renderString(Outcome outcome) {
        return write(render(outcome));
    }

    /** The body answered when request handling itself failed. */
    public static String internalError() {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("code", 500);
        node.put("message", INTERNAL_ERROR);
        return write(node);
    }

    private static String write(ObjectNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response body", e);
        }
    }
}
