package io.reqbind.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

/**
 * One user-facing, field-level problem.
 *
 * @param field   logical field name, with an element index for per-element failures ({@code
 *                Tags[1]})
 * @param message human-readable message
 * @param value   the offending input as text, or {@code null} (e.g. for a missing field); left out
 *                of the JSON when null or empty
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationError(
        String field, String message, @JsonInclude(JsonInclude.Include.NON_EMPTY) String value) {

    public ValidationError {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static ValidationError of(String field, String message) {
        return new ValidationError(field, message, null);
    }
}
