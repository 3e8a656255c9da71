package io.reqbind.standalone;

import io.reqbind.core.error.ReqbindLoadException;
import io.reqbind.standalone.config.ConfigLoadException;
import io.reqbind.standalone.server.ValidationServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point: {@code java -jar reqbind.jar [--config reqbind.yaml]}.
 *
 * <p>Exit status {@value #EXIT_CONFIG} means the server config is unusable, {@value
 * #EXIT_DEFINITIONS} that the schema or an endpoint file was rejected, {@value #EXIT_OTHER}
 * anything else. Once started, the server is stopped by a JVM shutdown hook.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    static final int EXIT_CONFIG = 2;
    static final int EXIT_DEFINITIONS = 3;
    static final int EXIT_OTHER = 1;

    private StandaloneMain() {
        // utility class
    }

    public static void main(String[] args) {
        ValidationServer server;
        try {
            server = ValidationServer.start(args);
        } catch (RuntimeException e) {
            LOG.error("reqbind failed to start: {}", e.getMessage(), e);
            System.exit(exitStatus(e));
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "reqbind-shutdown"));
    }

    static int exitStatus(Throwable failure) {
        if (failure instanceof ConfigLoadException || failure instanceof IllegalArgumentException) {
            return EXIT_CONFIG;
        }
        if (failure instanceof ReqbindLoadException) {
            return EXIT_DEFINITIONS;
        }
        return EXIT_OTHER;
    }
}
