package io.reqbind.core.model;

import java.util.Objects;

/**
 * One slot of a {@link RecordSchema}.
 *
 * @param name logical name, used by descriptors and reported in errors (e.g. {@code UserID})
 * @param key  wire name, looked up in the body, query string and path (e.g. {@code user_id})
 * @param kind target type of the slot
 */
public record FieldSpec(String name, String key, ValueKind kind) {

    public FieldSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (key == null || key.isBlank()) {
            key = name;
        }
    }
}
