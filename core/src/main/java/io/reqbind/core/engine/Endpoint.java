package io.reqbind.core.engine;

import io.reqbind.core.model.FieldDescriptor;
import io.reqbind.core.model.RecordSchema;
import io.reqbind.core.model.SourceKind;
import java.util.List;
import java.util.Objects;

/**
 * A compiled endpoint: its route, validation group and checked field descriptors. Produced by
 * {@link EndpointCompiler}; immutable.
 *
 * @param id            unique endpoint id
 * @param method        HTTP method, upper case
 * @param path          route template
 * @param group         validation group, or {@code null}
 * @param successStatus status of a valid response
 * @param descriptors   field descriptors in declaration order
 * @param schema        record schema the descriptors were checked against
 * @param source        definition file, or {@code null}
 */
public record Endpoint(
        String id,
        String method,
        String path,
        String group,
        int successStatus,
        List<FieldDescriptor> descriptors,
        RecordSchema schema,
        String source) {

    public Endpoint {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        descriptors = List.copyOf(descriptors);
    }

    /** True if at least one field is read from the body. */
    public boolean readsBody() {
        return descriptors.stream().anyMatch(d -> d.source() == SourceKind.BODY);
    }

    @Override
    public String toString() {
        return "Endpoint[" + id + " " + method + " " + path + ", fields=" + descriptors.size() + "]";
    }
}
