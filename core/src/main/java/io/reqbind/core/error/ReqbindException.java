package io.reqbind.core.error;

/**
 * Root of the reqbind exception tree. Subclasses split by {@link Phase}: {@link
 * ReqbindLoadException} aborts startup, {@link ReqbindEvalException} is confined to one request and
 * never escapes the pipeline.
 */
public abstract class ReqbindException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Phase {
        /** Reading or compiling schema and endpoint definitions. */
        LOAD,
        /** Decoding one request. */
        EVALUATION
    }

    private final Phase phase;
    private final String endpointId;

    protected ReqbindException(String message, String endpointId, Phase phase) {
        this(message, null, endpointId, phase);
    }

    protected ReqbindException(String message, Throwable cause, String endpointId, Phase phase) {
        super(message, cause);
        this.phase = phase;
        this.endpointId = endpointId;
    }

    public Phase phase() {
        return phase;
    }

    /** Id of the endpoint involved, or {@code null} when it is not known yet. */
    public String endpointId() {
        return endpointId;
    }

    /** The message prefixed with the endpoint id when there is one, for log lines. */
    public String describe() {
        return endpointId == null ? getMessage() : "endpoint '" + endpointId + "': " + getMessage();
    }
}
