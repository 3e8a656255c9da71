package io.reqbind.core.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.reqbind.core.error.BodyDecodeException;
import io.reqbind.core.model.RequestBody;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Decodes a whole request payload once, before any body field is bound.
 *
 * <ul>
 *   <li>JSON ({@code application/json}, {@code +json}): must be a JSON object.
 *   <li>Form ({@code application/x-www-form-urlencoded}): UTF-8 URL-decoded string values, first
 *       value wins for repeated keys.
 *   <li>Empty payload: every body field is absent, whatever the content type.
 *   <li>A non-empty payload without a content type is read as JSON.
 * </ul>
 *
 * <p>Thread-safe.
 */
public final class BodyDecoder {

    public static final String INVALID_BODY = "Invalid request body";
    public static final String UNSUPPORTED_MEDIA_TYPE = "Unsupported media type";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private BodyDecoder() {
        // utility class
    }

    /**
     * Decodes the payload.
     *
     * @throws BodyDecodeException if the payload is malformed or of an unsupported media type
     */
    public static DecodedBody decode(RequestBody body) {
        if (body == null || body.isEmpty()) {
            return DecodedBody.empty();
        }
        return switch (body.format()) {
            case JSON -> decodeJson(body);
            case FORM -> decodeForm(body);
            case UNSUPPORTED -> throw new BodyDecodeException(UNSUPPORTED_MEDIA_TYPE + ": " + body.mimeType());
        };
    }

    private static DecodedBody decodeJson(RequestBody body) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body.content());
        } catch (IOException e) {
            throw new BodyDecodeException(INVALID_BODY, e);
        }
        if (root == null || root.isMissingNode()) {
            return DecodedBody.empty();
        }
        if (!root.isObject()) {
            throw new BodyDecodeException(INVALID_BODY);
        }
        return new DecodedBody((ObjectNode) root);
    }

    private static DecodedBody decodeForm(RequestBody body) {
        ObjectNode root = MAPPER.createObjectNode();
        for (String pair : body.asString().split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            try {
                key = URLDecoder.decode(key, StandardCharsets.UTF_8);
                value = URLDecoder.decode(value, StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                throw new BodyDecodeException(INVALID_BODY, e);
            }
            if (!root.has(key)) {
                root.put(key, value);
            }
        }
        return new DecodedBody(root);
    }
}
