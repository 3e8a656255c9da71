package io.reqbind.standalone.config;

/**
 * The server configuration could not be loaded. When a single setting is at fault, {@link #key()}
 * names it as written in YAML ({@code server.port}) or in the environment ({@code
 * REQBIND_SERVER_PORT}).
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String key;

    private ConfigLoadException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /** The file as a whole is unusable: missing, unreadable or not YAML. */
    static ConfigLoadException unreadable(String message, Throwable cause) {
        return new ConfigLoadException(null, message, cause);
    }

    /** One setting has a bad value; the message reads {@code "<key> <problem>"}. */
    static ConfigLoadException invalid(String key, String problem) {
        return new ConfigLoadException(key, key + " " + problem, null);
    }

    static ConfigLoadException invalid(String key, String problem, Throwable cause) {
        return new ConfigLoadException(key, key + " " + problem, cause);
    }

    /** The offending setting, or {@code null} when the file itself could not be read. */
    public String key() {
        return key;
    }
}
