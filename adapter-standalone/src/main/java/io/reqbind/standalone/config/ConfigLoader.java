package io.reqbind.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ServerConfig} from a YAML file with an environment variable overlay.
 *
 * <p>The file is {@code reqbind.yaml} in the working directory unless {@code --config <path>} is
 * given. Missing keys keep the defaults of {@link ServerConfig.Builder}. Relative
 * {@code endpoints.schema} and {@code endpoints.dir} values are resolved against the config
 * file's directory.
 *
 * <p>An environment variable overrides the YAML value if it is defined and non-blank after
 * trimming.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "reqbind.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the config, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static ServerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the config, applying overrides from the supplied lookup. A {@code null} lookup result
     * means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static ServerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw ConfigLoadException.unreadable(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.", null);
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode()) {
                root = YAML_MAPPER.createObjectNode();
            }
            Path baseDir = configPath.toAbsolutePath().getParent();
            return mapToConfig(root, baseDir, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw ConfigLoadException.unreadable("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw ConfigLoadException.unreadable("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static ServerConfig mapToConfig(JsonNode root, Path baseDir, Function<String, String> envLookup) {
        ServerConfig.Builder builder = ServerConfig.builder();

        // --- YAML mapping ---

        JsonNode server = root.path("server");
        if (server.has("host")) builder.host(server.get("host").asText());
        if (server.has("port")) builder.port(server.get("port").asInt());

        JsonNode endpoints = root.path("endpoints");
        String schema = textOrDefault(endpoints, "schema", "schema.yaml");
        String endpointsDir = textOrDefault(endpoints, "dir", "endpoints");

        JsonNode validation = root.path("validation");
        if (validation.has("groups")) builder.groups(stringList(validation.get("groups"), "validation.groups"));
        if (validation.has("messages")) builder.messages(stringMap(validation.get("messages"), "validation.messages"));

        JsonNode health = root.path("health");
        if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.has("path")) builder.healthPath(health.get("path").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        envString(envLookup, "REQBIND_SERVER_HOST", builder::host);
        envInt(envLookup, "REQBIND_SERVER_PORT", builder::port);
        envBool(envLookup, "REQBIND_HEALTH_ENABLED", builder::healthEnabled);
        envString(envLookup, "REQBIND_HEALTH_PATH", builder::healthPath);
        envString(envLookup, "REQBIND_LOGGING_FORMAT", builder::loggingFormat);
        envString(envLookup, "REQBIND_LOGGING_LEVEL", builder::loggingLevel);
        schema = envStringOrDefault(envLookup, "REQBIND_SCHEMA", schema);
        endpointsDir = envStringOrDefault(envLookup, "REQBIND_ENDPOINTS_DIR", endpointsDir);

        builder.schemaPath(baseDir.resolve(schema).normalize().toString());
        builder.endpointsDir(baseDir.resolve(endpointsDir).normalize().toString());
        return builder.build();
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw ConfigLoadException.invalid(envVar, "must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    private static String envStringOrDefault(Function<String, String> envLookup, String envVar, String yamlDefault) {
        return isSet(envLookup, envVar) ? envLookup.apply(envVar).trim() : yamlDefault;
    }

    // --- YAML helpers ---

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        return node.has(field) ? node.get(field).asText() : defaultValue;
    }

    private static List<String> stringList(JsonNode node, String key) {
        if (!node.isArray()) {
            throw ConfigLoadException.invalid(key, "must be a list");
        }
        List<String> values = new ArrayList<>();
        node.forEach(element -> values.add(element.asText()));
        return values;
    }

    private static Map<String, String> stringMap(JsonNode node, String key) {
        if (!node.isObject()) {
            throw ConfigLoadException.invalid(key, "must be a mapping");
        }
        Map<String, String> values = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> values.put(entry.getKey(), entry.getValue().asText()));
        return values;
    }
}
