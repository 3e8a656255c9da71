package io.reqbind.standalone.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration of the standalone server. Use {@link #builder()}; every field has a default.
 *
 * @param host          bind address
 * @param port          listen port, {@code 0} for an ephemeral port
 * @param schemaPath    record schema file
 * @param endpointsDir  directory of endpoint definition files
 * @param groups        validation group markers
 * @param messages      message template overrides, keyed like the built-in catalogue
 * @param healthEnabled whether the health route is registered
 * @param healthPath    health route
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel  root log level
 */
public record ServerConfig(
        String host,
        int port,
        String schemaPath,
        String endpointsDir,
        List<String> groups,
        Map<String, String> messages,
        boolean healthEnabled,
        String healthPath,
        String loggingFormat,
        String loggingLevel) {

    public ServerConfig {
        groups = List.copyOf(groups);
        messages = Map.copyOf(messages);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ServerConfig}. */
    public static final class Builder {

        private String host = "0.0.0.0";
        private int port = 8080;
        private String schemaPath = "schema.yaml";
        private String endpointsDir = "endpoints";
        private List<String> groups = new ArrayList<>(List.of("create", "update"));
        private Map<String, String> messages = new LinkedHashMap<>();
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        private Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder schemaPath(String schemaPath) {
            this.schemaPath = schemaPath;
            return this;
        }

        public Builder endpointsDir(String endpointsDir) {
            this.endpointsDir = endpointsDir;
            return this;
        }

        public Builder groups(List<String> groups) {
            this.groups = new ArrayList<>(groups);
            return this;
        }

        public Builder messages(Map<String, String> messages) {
            this.messages = new LinkedHashMap<>(messages);
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the config.
         *
         * @throws ConfigLoadException if a value is out of range
         */
        public ServerConfig build() {
            if (port < 0 || port > 65535) {
                throw ConfigLoadException.invalid("server.port", "must be between 0 and 65535, got " + port);
            }
            if (!"text".equalsIgnoreCase(loggingFormat) && !"json".equalsIgnoreCase(loggingFormat)) {
                throw ConfigLoadException.invalid("logging.format", "must be 'text' or 'json', got '" + loggingFormat + "'");
            }
            if (healthEnabled && (healthPath == null || !healthPath.startsWith("/"))) {
                throw ConfigLoadException.invalid("health.path", "must start with '/', got '" + healthPath + "'");
            }
            return new ServerConfig(
                    host,
                    port,
                    schemaPath,
                    endpointsDir,
                    groups,
                    messages,
                    healthEnabled,
                    healthPath,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
