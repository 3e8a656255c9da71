package io.reqbind.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.reqbind.core.coerce.JsonValueBinder;
import io.reqbind.core.coerce.ValueCoercer;
import io.reqbind.core.error.BodyDecodeException;
import io.reqbind.core.error.CoercionException;
import io.reqbind.core.model.FieldDescriptor;
import io.reqbind.core.model.FieldSpec;
import io.reqbind.core.model.RawValue;
import io.reqbind.core.model.RecordSchema;
import io.reqbind.core.model.SourceKind;
import io.reqbind.core.model.TypedRecord;
import io.reqbind.core.model.ValidationError;
import io.reqbind.core.source.BodyDecoder;
import io.reqbind.core.source.DecodedBody;
import io.reqbind.core.source.RequestSources;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads, coerces and assembles every field of a request.
 *
 * <p>Every descriptor is visited even after a failure, so the caller gets all presence and
 * coercion errors at once. For each field:
 *
 * <ol>
 *   <li>present: the raw value is coerced (body values are bound from the decoded payload);
 *   <li>absent with a default: the default literal is coerced, whatever the field's source,
 *       even when the field is also required;
 *   <li>absent and required: {@code This field is required};
 *   <li>absent otherwise: the kind's zero value.
 * </ol>
 *
 * The body is decoded at most once, on the first body field.
 *
 * <p>Thread-safe; holds no per-request state.
 */
public final class ExtractionPipeline {

    static final String FIELD_REQUIRED = "This field is required";

    private final RecordSchema schema;

    public ExtractionPipeline(RecordSchema schema) {
        this.schema = schema;
    }

    /**
     * Extracts all fields.
     *
     * @param descriptors field descriptors, in declaration order
     * @param sources     the request's sources
     * @return the record and the extraction errors, in declaration order
     * @throws BodyDecodeException if a body field is declared and the payload cannot be decoded
     */
    public Extraction extract(List<FieldDescriptor> descriptors, RequestSources sources) {
        TypedRecord.Builder record = TypedRecord.builder();
        List<ValidationError> errors = new ArrayList<>();
        DecodedBody body = null;

        for (FieldDescriptor descriptor : descriptors) {
            FieldSpec spec = schema.find(descriptor.name())
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Field '" + descriptor.name() + "' is not part of " + schema));

            if (descriptor.source() == SourceKind.BODY && body == null) {
                body = BodyDecoder.decode(sources.body());
            }

            try {
                Optional<Object> value = read(descriptor, spec, sources, body);
                if (value.isPresent()) {
                    record.put(spec, value.get());
                } else if (descriptor.hasDefault()) {
                    record.put(spec, ValueCoercer.coerce(descriptor.defaultValue(), spec.kind()));
                } else if (descriptor.required()) {
                    errors.add(ValidationError.of(descriptor.name(), FIELD_REQUIRED));
                    record.putZero(spec);
                } else {
                    record.putZero(spec);
                }
            } catch (CoercionException e) {
                errors.add(new ValidationError(descriptor.name(), e.getMessage(), e.rawValue()));
                record.putZero(spec);
            }
        }
        return new Extraction(record.build(), errors);
    }

    /** Reads and coerces a present value; empty when the source does not carry the key. */
    private static Optional<Object> read(
            FieldDescriptor descriptor, FieldSpec spec, RequestSources sources, DecodedBody body) {
        if (descriptor.source() == SourceKind.BODY) {
            Optional<JsonNode> node = body.get(spec.key());
            return node.map(n -> JsonValueBinder.bind(n, spec.kind()));
        }
        RawValue raw = sources.reader(descriptor.source()).lookup(spec.key());
        if (!raw.present()) {
            return Optional.empty();
        }
        return Optional.of(ValueCoercer.coerce(raw.text(), spec.kind()));
    }
}
