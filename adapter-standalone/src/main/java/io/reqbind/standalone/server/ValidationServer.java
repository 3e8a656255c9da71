package io.reqbind.standalone.server;

import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import io.reqbind.core.engine.Endpoint;
import io.reqbind.core.engine.EndpointLoader;
import io.reqbind.core.engine.EndpointRegistry;
import io.reqbind.core.engine.RequestProcessor;
import io.reqbind.core.engine.ResponseRenderer;
import io.reqbind.core.model.RecordSchema;
import io.reqbind.core.rule.Validator;
import io.reqbind.core.spec.SchemaParser;
import io.reqbind.standalone.adapter.JavalinRequestAdapter;
import io.reqbind.standalone.config.ConfigLoader;
import io.reqbind.standalone.config.ServerConfig;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup sequence of the standalone server:
 *
 * <ol>
 *   <li>load configuration (YAML + env overlay) and configure logging;
 *   <li>parse the record schema and build the validator;
 *   <li>load and compile every endpoint file, failing on the first bad one;
 *   <li>register one Javalin route per endpoint, plus the health route;
 *   <li>start Javalin.
 * </ol>
 *
 * Kept apart from {@link io.reqbind.standalone.StandaloneMain} so tests can start and stop it.
 */
public final class ValidationServer {

    private static final Logger LOG = LoggerFactory.getLogger(ValidationServer.class);

    private final Javalin app;
    private final EndpointRegistry registry;
    private final ServerConfig config;

    private ValidationServer(Javalin app, EndpointRegistry registry, ServerConfig config) {
        this.app = app;
        this.registry = registry;
        this.config = config;
    }

    /**
     * Loads the configuration named by the arguments, configures logging and starts the server.
     *
     * @param args command-line arguments (e.g. {@code --config conf/reqbind.yaml})
     */
    public static ValidationServer start(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        ServerConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config);
        LOG.info("Configuration loaded from {}", configPath);
        return start(config);
    }

    /**
     * Starts the server from an already loaded configuration. Logging is left as it is.
     *
     * @throws io.reqbind.core.error.ReqbindLoadException if the schema or an endpoint file is
     *     rejected
     */
    public static ValidationServer start(ServerConfig config) {
        long startTime = System.nanoTime();

        RecordSchema schema = new SchemaParser().parse(Path.of(config.schemaPath()));
        LOG.info("Record schema loaded: {} field(s) from {}", schema.size(), config.schemaPath());

        Validator validator = Validator.builder()
                .groups(config.groups())
                .messageOverrides(config.messages())
                .build();

        EndpointRegistry registry =
                new EndpointLoader(schema, validator, null).loadDirectory(Path.of(config.endpointsDir()));

        RequestProcessor processor = new RequestProcessor(validator);
        JavalinRequestAdapter adapter = new JavalinRequestAdapter();

        Javalin app = Javalin.create();
        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler(registry));
        }
        for (Endpoint endpoint : registry.endpoints()) {
            app.addHttpHandler(
                    HandlerType.valueOf(endpoint.method()),
                    endpoint.path(),
                    new EndpointHandler(endpoint, processor, adapter));
        }
        app.exception(Exception.class, (e, ctx) -> {
            LOG.error("Unhandled error on {} {}: {}", ctx.method(), ctx.path(), e.getMessage(), e);
            ctx.status(500);
            ctx.contentType("application/json");
            ctx.result(ResponseRenderer.internalError());
        });

        app.start(config.host(), config.port());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info("reqbind started: port={}, endpoints={}, groups={}, startupMs={}",
                app.port(), registry.size(), validator.groups(), elapsedMs);
        return new ValidationServer(app, registry, config);
    }

    /** The port the server listens on. */
    public int port() {
        return app.port();
    }

    public EndpointRegistry registry() {
        return registry;
    }

    public ServerConfig config() {
        return config;
    }

    public void stop() {
        app.stop();
        LOG.info("reqbind stopped");
    }
}
