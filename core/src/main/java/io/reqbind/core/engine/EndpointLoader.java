package io.reqbind.core.engine;

import io.reqbind.core.error.ReqbindLoadException;
import io.reqbind.core.error.SpecParseException;
import io.reqbind.core.model.RecordSchema;
import io.reqbind.core.rule.Validator;
import io.reqbind.core.spec.EndpointDefinition;
import io.reqbind.core.spec.EndpointParser;
import io.reqbind.core.spi.ValidationListener;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads endpoint files from a directory into an {@link EndpointRegistry}. Loading is
 * all-or-nothing: the first rejected file aborts the load with its {@link ReqbindLoadException}.
 */
public final class EndpointLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EndpointLoader.class);

    private final EndpointParser parser = new EndpointParser();
    private final EndpointCompiler compiler;
    private final ValidationListener listener;

    public EndpointLoader(RecordSchema schema, Validator validator, ValidationListener listener) {
        this.compiler = new EndpointCompiler(schema, validator);
        this.listener = listener;
    }

    /**
     * Loads every {@code *.yaml} / {@code *.yml} file of a directory, in file name order.
     *
     * @throws ReqbindLoadException if the directory cannot be listed or any file is rejected
     */
    public EndpointRegistry loadDirectory(Path dir) {
        if (!Files.isDirectory(dir)) {
            throw new SpecParseException("Endpoints directory not found: " + dir, null, dir.toString());
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing.filter(EndpointLoader::isYaml).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new SpecParseException("Failed to list endpoints directory: " + e.getMessage(), e, null,
                    dir.toString());
        }

        EndpointRegistry.Builder registry = EndpointRegistry.builder();
        for (Path file : files) {
            try {
                registry.add(load(file));
            } catch (ReqbindLoadException e) {
                LOG.error("Rejected endpoint file {}: {}", file, e.describe());
                notifyRejected(file.toString(), e.getMessage());
                throw e;
            }
        }
        EndpointRegistry result = registry.build();
        LOG.info("Loaded {} endpoint(s) from {}", result.size(), dir);
        return result;
    }

    /**
     * Parses and compiles one endpoint file.
     *
     * @throws ReqbindLoadException if the file is rejected
     */
    public Endpoint load(Path file) {
        EndpointDefinition definition = parser.parse(file);
        Endpoint endpoint = compiler.compile(definition);
        LOG.info("Loaded endpoint: id={}, route={} {}, fields={}, source={}",
                endpoint.id(), endpoint.method(), endpoint.path(), endpoint.descriptors().size(), file);
        notifyLoaded(endpoint, file.toString());
        return endpoint;
    }

    // --- Private helpers ---

    private static boolean isYaml(Path path) {
        String name = path.getFileName().toString();
        return Files.isRegularFile(path) && (name.endsWith(".yaml") || name.endsWith(".yml"));
    }

    private void notifyLoaded(Endpoint endpoint, String sourcePath) {
        if (listener == null) return;
        try {
            listener.onEndpointLoaded(new ValidationListener.EndpointLoadedEvent(
                    endpoint.id(), endpoint.method(), endpoint.path(), sourcePath, endpoint.descriptors().size()));
        } catch (Exception e) {
            LOG.warn("ValidationListener.onEndpointLoaded failed", e);
        }
    }

    private void notifyRejected(String sourcePath, String detail) {
        if (listener == null) return;
        try {
            listener.onEndpointRejected(new ValidationListener.EndpointRejectedEvent(sourcePath, detail));
        } catch (Exception e) {
            LOG.warn("ValidationListener.onEndpointRejected failed", e);
        }
    }
}
