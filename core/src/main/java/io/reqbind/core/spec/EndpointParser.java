package io.reqbind.core.spec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.reqbind.core.error.SpecParseException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Parses endpoint YAML files into {@link EndpointDefinition}s.
 *
 * <p>A file is checked three ways before it is accepted: strict unknown-key detection (typos such
 * as {@code requried} fail instead of being ignored), the bundled JSON Schema {@value
 * #SCHEMA_RESOURCE}, and a few semantic checks the schema cannot express. Rules are kept as text;
 * they are parsed when the definition is compiled.
 *
 * <p>Thread-safe.
 */
public final class EndpointParser {

    static final String SCHEMA_RESOURCE = "/schema/endpoint-spec.schema.json";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchema ENDPOINT_SCHEMA = loadSchema();

    private static final Set<String> VALID_HTTP_METHODS =
            Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD", "OPTIONS");

    // ── Strict unknown-key detection ──

    private static final Set<String> KNOWN_ROOT_KEYS =
            Set.of("id", "description", "method", "path", "group", "success-status", "fields");

    private static final Set<String> KNOWN_FIELD_KEYS = Set.of("name", "source", "required", "default", "rules");

    /**
     * Parses the YAML file at the given path.
     *
     * @throws SpecParseException if the file cannot be read or is not a valid endpoint definition
     */
    public EndpointDefinition parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        String yaml;
        try {
            yaml = Files.readString(path);
        } catch (IOException e) {
            throw new SpecParseException("Failed to read endpoint file: " + e.getMessage(), e, null, source);
        }
        return parse(yaml, source);
    }

    /**
     * Parses YAML text.
     *
     * @param yaml   the document
     * @param source label used in errors, may be null
     * @throws SpecParseException if the document is not a valid endpoint definition
     */
    public EndpointDefinition parse(String yaml, String source) {
        JsonNode root = readYaml(yaml, source);
        if (root == null || !root.isObject()) {
            throw new SpecParseException("Endpoint file must be a YAML mapping", null, source);
        }
        String id = root.path("id").isTextual() ? root.get("id").asText() : null;

        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "endpoint root", id, source);
        JsonNode fieldsNode = root.get("fields");
        if (fieldsNode != null && fieldsNode.isArray()) {
            for (int i = 0; i < fieldsNode.size(); i++) {
                rejectUnknownKeys(fieldsNode.get(i), KNOWN_FIELD_KEYS, "fields[" + i + "]", id, source);
            }
        }
        validateAgainstSchema(root, id, source);

        String method = root.get("method").asText().toUpperCase(Locale.ROOT);
        if (!VALID_HTTP_METHODS.contains(method)) {
            throw new SpecParseException(
                    "Invalid HTTP method '" + method + "'; expected one of " + VALID_HTTP_METHODS, id, source);
        }

        List<FieldDefinition> fields = new ArrayList<>();
        for (JsonNode field : fieldsNode) {
            fields.add(new FieldDefinition(
                    field.get("name").asText(),
                    field.get("source").asText(),
                    field.path("required").asBoolean(false),
                    optionalText(field, "default"),
                    optionalText(field, "rules")));
        }

        return new EndpointDefinition(
                id,
                method,
                root.get("path").asText(),
                optionalText(root, "group"),
                root.path("success-status").asInt(200),
                fields,
                source);
    }

    // --- Private helpers ---

    private static JsonNode readYaml(String yaml, String source) {
        try {
            return YAML_MAPPER.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw SpecParseException.malformedYaml(e, source);
        }
    }

    private static void validateAgainstSchema(JsonNode root, String id, String source) {
        Set<ValidationMessage> errors = ENDPOINT_SCHEMA.validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new SpecParseException("Endpoint definition does not match schema: " + detail, id, source);
        }
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static void rejectUnknownKeys(
            JsonNode node, Set<String> knownKeys, String blockName, String id, String source) {
        if (node == null || !node.isObject()) {
            return;
        }
        List<String> unknown = StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .filter(key -> !knownKeys.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new SpecParseException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in '" + blockName + "': " + unknown
                            + "; recognized keys are: " + knownKeys.stream().sorted().collect(Collectors.toList()),
                    id,
                    source);
        }
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = EndpointParser.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + SCHEMA_RESOURCE, e);
        }
    }
}
