package io.reqbind.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The decoded request: logical field name to typed value, in descriptor declaration order.
 * Fields that were absent and optional hold their kind's zero value.
 *
 * <p>Immutable and thread-safe. Values follow the representations documented on {@link
 * ValueKind}.
 */
public final class TypedRecord {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, FieldSpec> specs;
    private final Map<String, Object> values;

    private TypedRecord(Map<String, FieldSpec> specs, Map<String, Object> values) {
        this.specs = Collections.unmodifiableMap(specs);
        this.values = Collections.unmodifiableMap(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the value of a field, or {@code null} if the record has no such field. */
    public Object get(String name) {
        return values.get(name);
    }

    /**
     * Returns the value of a field cast to the expected Java type.
     *
     * @throws IllegalArgumentException if the record has no such field
     * @throws ClassCastException       if the value is of another type
     */
    public <T> T get(String name, Class<T> type) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("No field '" + name + "' in record " + values.keySet());
        }
        return type.cast(values.get(name));
    }

    public String getString(String name) {
        return get(name, String.class);
    }

    public long getLong(String name) {
        return get(name, Long.class);
    }

    /** Returns a list-valued field; the element type follows {@link ValueKind}. */
    @SuppressWarnings("unchecked")
    public <E> List<E> getList(String name) {
        return (List<E>) get(name, List.class);
    }

    /** The kind of a field, or {@code null} if the record has no such field. */
    public ValueKind kindOf(String name) {
        FieldSpec spec = specs.get(name);
        return spec != null ? spec.kind() : null;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /** Field names in declaration order. */
    public Set<String> names() {
        return values.keySet();
    }

    /** Unmodifiable name-to-value view in declaration order. */
    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    /** Renders the record as a JSON object keyed by wire name. */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        specs.forEach((name, spec) -> node.set(spec.key(), spec.kind().toJson(values.get(name))));
        return node;
    }

    /**
     * Binds the record into an application type (POJO or record) whose properties follow the
     * wire names, e.g. {@code record UserUpdate(@JsonProperty("user_id") long userId, ...)}.
     *
     * @throws IllegalArgumentException if Jackson cannot bind the record to {@code type}
     */
    public <T> T as(Class<T> type) {
        return MAPPER.convertValue(toJson(), type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypedRecord that)) return false;
        return specs.equals(that.specs) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(specs, values);
    }

    @Override
    public String toString() {
        return "TypedRecord" + values;
    }

    /** Builder for {@link TypedRecord}. Later puts for the same name replace earlier ones. */
    public static final class Builder {

        private final Map<String, FieldSpec> specs = new LinkedHashMap<>();
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(FieldSpec spec, Object value) {
            Objects.requireNonNull(spec, "spec must not be null");
            specs.put(spec.name(), spec);
            values.put(spec.name(), value != null ? value : spec.kind().zeroValue());
            return this;
        }

        /** Stores the kind's zero value for a field. */
        public Builder putZero(FieldSpec spec) {
            return put(spec, spec.kind().zeroValue());
        }

        public TypedRecord build() {
            return new TypedRecord(new LinkedHashMap<>(specs), new LinkedHashMap<>(values));
        }
    }
}
