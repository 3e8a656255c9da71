package io.reqbind.core.error;

/**
 * Abstract parent for configuration-time errors. Thrown while endpoint or schema definitions are
 * parsed and compiled, i.e. before the first request is served. A load error means the endpoint is
 * miswired and must never be downgraded to a per-request failure.
 */
public abstract class ReqbindLoadException extends ReqbindException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected ReqbindLoadException(String message, String endpointId, String source) {
        super(message, endpointId, Phase.LOAD);
        this.source = source;
    }

    protected ReqbindLoadException(String message, Throwable cause, String endpointId, String source) {
        super(message, cause, endpointId, Phase.LOAD);
        this.source = source;
    }

    /** The file or resource the definition came from, or {@code null} when built in code. */
    public String source() {
        return source;
    }
}
