package io.reqbind.core.model;

import java.util.Objects;

/**
 * Result of running one request through the pipeline. Exactly one of three states:
 *
 * <ul>
 *   <li>{@link Type#BAD_REQUEST}: a field was missing or could not be coerced, or the payload
 *       could not be decoded; {@link #errorResponse()} holds the details. Validation rules did not
 *       run.
 *   <li>{@link Type#UNPROCESSABLE}: every field decoded but validation rules failed.
 *   <li>{@link Type#VALID}: {@link #record()} holds the decoded, validated record.
 * </ul>
 */
public final class Outcome {

    /** The type of outcome. */
    public enum Type {
        BAD_REQUEST,
        UNPROCESSABLE,
        VALID
    }

    private final Type type;
    private final ErrorResponse errorResponse;
    private final TypedRecord record;
    private final int httpStatus;

    private Outcome(Type type, ErrorResponse errorResponse, TypedRecord record, int httpStatus) {
        this.type = type;
        this.errorResponse = errorResponse;
        this.record = record;
        this.httpStatus = httpStatus;
    }

    public static Outcome badRequest(ErrorResponse errorResponse) {
        Objects.requireNonNull(errorResponse, "errorResponse must not be null for BAD_REQUEST");
        return new Outcome(Type.BAD_REQUEST, errorResponse, null, errorResponse.code());
    }

    public static Outcome unprocessable(ErrorResponse errorResponse) {
        Objects.requireNonNull(errorResponse, "errorResponse must not be null for UNPROCESSABLE");
        return new Outcome(Type.UNPROCESSABLE, errorResponse, null, errorResponse.code());
    }

    /** Creates a VALID outcome answered with {@code 200}. */
    public static Outcome valid(TypedRecord record) {
        return valid(record, 200);
    }

    /** Creates a VALID outcome answered with the endpoint's success status (200 or 201). */
    public static Outcome valid(TypedRecord record, int httpStatus) {
        Objects.requireNonNull(record, "record must not be null for VALID");
        return new Outcome(Type.VALID, null, record, httpStatus);
    }

    public Type type() {
        return type;
    }

    /** The error body. Only set when {@code type() != VALID}. */
    public ErrorResponse errorResponse() {
        return errorResponse;
    }

    /** The decoded record. Only set when {@code type() == VALID}. */
    public TypedRecord record() {
        return record;
    }

    /** The HTTP status the transport layer should answer with. */
    public int httpStatus() {
        return httpStatus;
    }

    public boolean isValid() {
        return type == Type.VALID;
    }

    public boolean isBadRequest() {
        return type == Type.BAD_REQUEST;
    }

    public boolean isUnprocessable() {
        return type == Type.UNPROCESSABLE;
    }

    @Override
    public String toString() {
        return switch (type) {
            case VALID -> "Outcome[VALID, status=" + httpStatus + "]";
            case BAD_REQUEST, UNPROCESSABLE -> "Outcome[" + type + ", status=" + httpStatus + ", errors="
                    + errorResponse.errors().size() + "]";
        };
    }
}
