package io.reqbind.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered table of the typed slots a request can be decoded into. This is the explicit
 * name-to-slot mapping that descriptors are checked against when an endpoint is compiled, so an
 * unknown field name is caught at startup rather than per request.
 *
 * <p>Immutable and thread-safe.
 */
public final class RecordSchema {

    private final Map<String, FieldSpec> fields;

    private RecordSchema(Map<String, FieldSpec> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<FieldSpec> find(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    /** All slots in declaration order. */
    public Collection<FieldSpec> fields() {
        return fields.values();
    }

    public int size() {
        return fields.size();
    }

    @Override
    public String toString() {
        return "RecordSchema" + fields.keySet();
    }

    /** Builder for {@link RecordSchema}. Duplicate names are rejected. */
    public static final class Builder {

        private final Map<String, FieldSpec> fields = new LinkedHashMap<>();

        private Builder() {}

        public Builder field(String name, String key, ValueKind kind) {
            return field(new FieldSpec(name, key, kind));
        }

        public Builder field(FieldSpec spec) {
            if (fields.putIfAbsent(spec.name(), spec) != null) {
                throw new IllegalArgumentException("Duplicate schema field: '" + spec.name() + "'");
            }
            return this;
        }

        public RecordSchema build() {
            return new RecordSchema(fields);
        }
    }
}
