package io.reqbind.core.error;

/** The request payload could not be decoded as a whole (malformed JSON, unsupported media type). */
public final class BodyDecodeException extends ReqbindEvalException {

    private static final long serialVersionUID = 1L;

    public BodyDecodeException(String message) {
        super(message, null);
    }

    public BodyDecodeException(String message, Throwable cause) {
        super(message, cause, null);
    }
}
