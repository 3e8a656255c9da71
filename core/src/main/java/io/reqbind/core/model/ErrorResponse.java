package io.reqbind.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Objects;

/**
 * Failure body returned to clients: {@code {code, message, errors}}. {@code errors} is left out of
 * the JSON when there are none.
 *
 * @param code    HTTP status code
 * @param message summary ({@code Invalid request data}, {@code Validation failed}, ...)
 * @param errors  field-level errors in field declaration order, possibly empty
 */
public record ErrorResponse(
        int code, String message, @JsonInclude(JsonInclude.Include.NON_EMPTY) List<ValidationError> errors) {

    /** Summary used when extraction fails. */
    public static final String INVALID_REQUEST_DATA = "Invalid request data";

    /** Summary used when validation rules fail. */
    public static final String VALIDATION_FAILED = "Validation failed";

    public ErrorResponse {
        Objects.requireNonNull(message, "message must not be null");
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static ErrorResponse badRequest(List<ValidationError> errors) {
        return new ErrorResponse(400, INVALID_REQUEST_DATA, errors);
    }

    public static ErrorResponse unprocessable(List<ValidationError> errors) {
        return new ErrorResponse(422, VALIDATION_FAILED, errors);
    }
}
