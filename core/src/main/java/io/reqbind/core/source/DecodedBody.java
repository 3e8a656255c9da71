package io.reqbind.core.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;

/** A payload decoded into a JSON object. Missing keys and JSON {@code null} both read as absent. */
public final class DecodedBody {

    private static final DecodedBody EMPTY = new DecodedBody(JsonNodeFactory.instance.objectNode());

    private final ObjectNode root;

    DecodedBody(ObjectNode root) {
        this.root = root;
    }

    public static DecodedBody empty() {
        return EMPTY;
    }

    /** Returns the value under {@code key}, or empty when missing or {@code null}. */
    public Optional<JsonNode> get(String key) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(node);
    }

    public boolean isEmpty() {
        return root.isEmpty();
    }

    @Override
    public String toString() {
        return "DecodedBody" + root;
    }
}
