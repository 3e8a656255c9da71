package io.reqbind.core.error;

/**
 * Raw text (or a body value) could not be converted to the field's target type. The message is
 * user-facing ("must be a positive integer"); {@link #rawValue()} carries the offending input.
 */
public final class CoercionException extends ReqbindEvalException {

    private static final long serialVersionUID = 1L;

    private final String rawValue;

    public CoercionException(String message, String rawValue) {
        super(message, null);
        this.rawValue = rawValue;
    }

    public CoercionException(String message, String rawValue, Throwable cause) {
        super(message, cause, null);
        this.rawValue = rawValue;
    }

    /** The input that failed to convert, never {@code null}. */
    public String rawValue() {
        return rawValue;
    }
}
